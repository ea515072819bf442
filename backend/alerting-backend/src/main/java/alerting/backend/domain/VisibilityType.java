package alerting.backend.domain;

import alerting.backend.exception.ErrorCode;
import alerting.backend.exception.ValidationException;

import java.util.Locale;

public enum VisibilityType {
    ORGANIZATION,
    TEAM,
    USER;

    public static VisibilityType from(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_VISIBILITY, "visibility type is required");
        }
        try {
            return VisibilityType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ErrorCode.INVALID_VISIBILITY, "unknown visibility type: " + value);
        }
    }
}
