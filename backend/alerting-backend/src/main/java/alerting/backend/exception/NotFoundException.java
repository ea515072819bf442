package alerting.backend.exception;

public class NotFoundException extends AlertingException {

    public NotFoundException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static NotFoundException alert(Long alertId) {
        return new NotFoundException(ErrorCode.ALERT_NOT_FOUND, "Alert not found: " + alertId);
    }

    public static NotFoundException notTargeted(String userId, Long alertId) {
        return new NotFoundException(ErrorCode.ALERT_NOT_TARGETED,
                "Alert " + alertId + " is not addressed to user " + userId);
    }
}
