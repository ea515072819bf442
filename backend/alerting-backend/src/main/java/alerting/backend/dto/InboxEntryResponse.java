package alerting.backend.dto;

import alerting.backend.domain.InboxEntry;
import alerting.backend.domain.Severity;

import java.time.LocalDateTime;

public record InboxEntryResponse(
        Long id,
        Long alertId,
        String title,
        String message,
        Severity severity,
        LocalDateTime deliveredAt
) {
    public static InboxEntryResponse from(InboxEntry e) {
        return new InboxEntryResponse(
                e.getId(), e.getAlertId(), e.getTitle(), e.getMessage(), e.getSeverity(), e.getDeliveredAt());
    }
}
