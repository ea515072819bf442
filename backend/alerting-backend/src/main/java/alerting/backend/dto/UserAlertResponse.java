package alerting.backend.dto;

import alerting.backend.domain.Alert;
import alerting.backend.domain.ReadStatus;
import alerting.backend.domain.Severity;
import alerting.backend.domain.UserAlertState;
import lombok.*;

import java.time.LocalDateTime;

/**
 * An alert as seen by one of its recipients.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserAlertResponse {
    private Long alertId;
    private String title;
    private String message;
    private Severity severity;
    private LocalDateTime startAt;
    private LocalDateTime expiresAt;
    private ReadStatus readStatus;
    private LocalDateTime readAt;
    private LocalDateTime snoozedUntil;
    private LocalDateTime lastNotifiedAt;

    public static UserAlertResponse of(Alert a, UserAlertState s) {
        return UserAlertResponse.builder()
                .alertId(a.getId())
                .title(a.getTitle())
                .message(a.getMessage())
                .severity(a.getSeverity())
                .startAt(a.getStartAt())
                .expiresAt(a.getExpiresAt())
                .readStatus(s.getReadStatus())
                .readAt(s.getReadAt())
                .snoozedUntil(s.getSnoozedUntil())
                .lastNotifiedAt(s.getLastNotifiedAt())
                .build();
    }
}
