package alerting.backend.domain;

import alerting.backend.exception.ErrorCode;
import alerting.backend.exception.ValidationException;

import java.util.Locale;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    public static Severity from(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_SEVERITY, "severity is required");
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ErrorCode.INVALID_SEVERITY, "unknown severity: " + value);
        }
    }
}
