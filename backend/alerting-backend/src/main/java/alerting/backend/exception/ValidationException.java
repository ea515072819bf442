package alerting.backend.exception;

/** Malformed input, rejected before any state is touched. */
public class ValidationException extends AlertingException {

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ValidationException(ErrorCode errorCode) {
        super(errorCode);
    }
}
