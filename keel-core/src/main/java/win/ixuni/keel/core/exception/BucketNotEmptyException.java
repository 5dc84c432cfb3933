package win.ixuni.keel.core.exception;

/**
 * Bucket not empty exception
 *
 * Thrown when attempting to delete a non-empty bucket.
 */
public class BucketNotEmptyException extends KeelException {

    public BucketNotEmptyException(String bucketName) {
        super(ErrorCode.BUCKET_NOT_EMPTY, "The bucket you tried to delete is not empty: " + bucketName);
    }
}
