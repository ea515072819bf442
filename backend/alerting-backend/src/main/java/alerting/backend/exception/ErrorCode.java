package alerting.backend.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum ErrorCode {
    // === 400 ===
    INVALID_INPUT_VALUE("V001", "Invalid input value", HttpStatus.BAD_REQUEST),
    INVALID_SEVERITY("V002", "Unknown severity", HttpStatus.BAD_REQUEST),
    INVALID_VISIBILITY("V003", "Invalid visibility", HttpStatus.BAD_REQUEST),
    INVALID_TIME_WINDOW("V004", "expiresAt must be after startAt", HttpStatus.BAD_REQUEST),
    INVALID_REMINDER_INTERVAL("V005", "Reminder interval must be positive", HttpStatus.BAD_REQUEST),
    DUPLICATE_ID("V006", "Identifier already in use", HttpStatus.BAD_REQUEST),

    // === 404 ===
    ALERT_NOT_FOUND("N001", "Alert not found", HttpStatus.NOT_FOUND),
    ALERT_NOT_TARGETED("N002", "Alert is not addressed to this user", HttpStatus.NOT_FOUND),
    TEAM_NOT_FOUND("N003", "Team not found", HttpStatus.NOT_FOUND),

    // === 409 ===
    ALERT_ARCHIVED("S001", "Alert is archived", HttpStatus.CONFLICT),
    ALERT_INACTIVE("S002", "Alert is archived or expired", HttpStatus.CONFLICT),

    // === 500 ===
    INTERNAL_SERVER_ERROR("E001", "Internal server error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String message;
    private final HttpStatus status;
}
