package win.ixuni.keel.core.exception;

/**
 * Invalid request argument exception
 */
public class InvalidArgumentException extends KeelException {

    public InvalidArgumentException(String message) {
        super(ErrorCode.INVALID_ARGUMENT, message);
    }
}
