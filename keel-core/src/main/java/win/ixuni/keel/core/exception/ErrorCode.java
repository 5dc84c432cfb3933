package win.ixuni.keel.core.exception;

import lombok.Getter;

/**
 * Closed set of error kinds surfaced to callers
 * <p>
 * 每种错误对应一个 S3 error code 与 HTTP 状态码，调用方按枚举分支，不解析消息文本。
 */
@Getter
public enum ErrorCode {

    BUCKET_ALREADY_EXISTS("BucketAlreadyExists", 409),

    NO_SUCH_BUCKET("NoSuchBucket", 404),

    NO_SUCH_KEY("NoSuchKey", 404),

    BUCKET_NOT_EMPTY("BucketNotEmpty", 409),

    /**
     * Malformed request values, e.g. declared length mismatch or invalid bucket name
     */
    INVALID_ARGUMENT("InvalidArgument", 400),

    /**
     * Blob store I/O failure
     */
    INTERNAL_STORAGE_FAILURE("InternalError", 500);

    private final String s3Code;
    private final int httpStatus;

    ErrorCode(String s3Code, int httpStatus) {
        this.s3Code = s3Code;
        this.httpStatus = httpStatus;
    }
}
