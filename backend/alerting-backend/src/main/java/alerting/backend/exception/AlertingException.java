package alerting.backend.exception;

import lombok.Getter;

/**
 * Base of every business failure surfaced to callers. Never retried by the core.
 */
@Getter
public abstract class AlertingException extends RuntimeException {

    private final ErrorCode errorCode;

    protected AlertingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected AlertingException(ErrorCode errorCode) {
        this(errorCode, errorCode.getMessage());
    }
}
