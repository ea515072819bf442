package alerting.backend.dto;

import alerting.backend.domain.Alert;
import alerting.backend.domain.AlertStatus;
import alerting.backend.domain.Severity;
import alerting.backend.domain.VisibilityType;

public record AlertFilter(Severity severity, AlertStatus status, VisibilityType visibilityType) {

    public static AlertFilter none() {
        return new AlertFilter(null, null, null);
    }

    public boolean matches(Alert alert) {
        return (severity == null || alert.getSeverity() == severity)
                && (status == null || alert.getStatus() == status)
                && (visibilityType == null || alert.getVisibilityType() == visibilityType);
    }
}
