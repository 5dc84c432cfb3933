package win.ixuni.keel.core.exception;

/**
 * Bucket already exists exception
 */
public class BucketAlreadyExistsException extends KeelException {

    public BucketAlreadyExistsException(String bucketName) {
        super(ErrorCode.BUCKET_ALREADY_EXISTS, "The requested bucket name is not available: " + bucketName);
    }
}
