package alerting.backend.exception;

/** The operation is not legal in the alert's current lifecycle state. */
public class InvalidStateException extends AlertingException {

    public InvalidStateException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
