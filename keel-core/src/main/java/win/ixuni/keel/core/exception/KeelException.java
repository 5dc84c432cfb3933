package win.ixuni.keel.core.exception;

import lombok.Getter;

/**
 * S3Keel base exception
 */
@Getter
public class KeelException extends RuntimeException {

    private final ErrorCode errorCode;

    public KeelException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public KeelException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * S3 wire code, e.g. "NoSuchBucket"
     */
    public String getS3Code() {
        return errorCode.getS3Code();
    }

    public int getHttpStatus() {
        return errorCode.getHttpStatus();
    }
}
