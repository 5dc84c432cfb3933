package win.ixuni.keel.core.exception;

/**
 * Blob store failure
 * <p>
 * 底层存储读写失败时抛出，对调用方表现为 InternalError。
 */
public class StorageFailureException extends KeelException {

    public StorageFailureException(String message) {
        super(ErrorCode.INTERNAL_STORAGE_FAILURE, message);
    }

    public StorageFailureException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL_STORAGE_FAILURE, message, cause);
    }
}
