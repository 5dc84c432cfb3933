package win.ixuni.keel.core.exception;

/**
 * Object not found exception
 */
public class ObjectNotFoundException extends KeelException {

    public ObjectNotFoundException(String bucketName, String key) {
        super(ErrorCode.NO_SUCH_KEY, "The specified key does not exist: " + bucketName + "/" + key);
    }
}
