package win.ixuni.keel.core.exception;

/**
 * Bucket not found exception
 */
public class BucketNotFoundException extends KeelException {

    public BucketNotFoundException(String bucketName) {
        super(ErrorCode.NO_SUCH_BUCKET, "The specified bucket does not exist: " + bucketName);
    }
}
