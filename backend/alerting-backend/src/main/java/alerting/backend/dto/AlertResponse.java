package alerting.backend.dto;

import alerting.backend.domain.Alert;
import alerting.backend.domain.AlertStatus;
import alerting.backend.domain.Severity;
import alerting.backend.domain.VisibilityType;
import lombok.*;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Set;
import java.util.TreeSet;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertResponse {
    private Long id;
    private String title;
    private String message;
    private Severity severity;
    private String createdBy;
    private VisibilityType visibilityType;
    private Set<String> visibilityIds;
    private Set<String> targetUserIds;
    private LocalDateTime startAt;
    private LocalDateTime expiresAt;
    private boolean remindersEnabled;
    private Duration reminderInterval;
    private AlertStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static AlertResponse from(Alert a) {
        return AlertResponse.builder()
                .id(a.getId())
                .title(a.getTitle())
                .message(a.getMessage())
                .severity(a.getSeverity())
                .createdBy(a.getCreatedBy())
                .visibilityType(a.getVisibilityType())
                .visibilityIds(new TreeSet<>(a.getVisibilityIds()))
                .targetUserIds(new TreeSet<>(a.getTargetUserIds()))
                .startAt(a.getStartAt())
                .expiresAt(a.getExpiresAt())
                .remindersEnabled(a.isRemindersEnabled())
                .reminderInterval(a.getReminderInterval())
                .status(a.getStatus())
                .createdAt(a.getCreatedAt())
                .updatedAt(a.getUpdatedAt())
                .build();
    }
}
