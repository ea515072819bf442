package alerting.backend.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(
        name = "alerts",
        indexes = {
                @Index(name = "idx_alert_status", columnList = "status"),
                @Index(name = "idx_alert_severity", columnList = "severity")
        }
)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Alert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "alert_id")
    private Long id;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Severity severity;

    @Column(name = "created_by", nullable = false, updatable = false, length = 64)
    private String createdBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "visibility_type", nullable = false, length = 16)
    private VisibilityType visibilityType;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "alert_visibility_ids", joinColumns = @JoinColumn(name = "alert_id"))
    @Column(name = "target_id", length = 64)
    private Set<String> visibilityIds = new LinkedHashSet<>();

    // resolved at creation (and on visibility change), not on every read
    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "alert_targets", joinColumns = @JoinColumn(name = "alert_id"))
    @Column(name = "user_id", length = 64)
    private Set<String> targetUserIds = new LinkedHashSet<>();

    @Column(name = "start_at", nullable = false)
    private LocalDateTime startAt;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Builder.Default
    @Column(name = "reminders_enabled", nullable = false)
    private boolean remindersEnabled = true;

    @Builder.Default
    @Column(name = "reminder_interval", nullable = false)
    private Duration reminderInterval = Duration.ofHours(2);

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertStatus status = AlertStatus.ACTIVE;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public Visibility getVisibility() {
        return new Visibility(visibilityType, visibilityIds);
    }

    public void applyVisibility(Visibility visibility) {
        this.visibilityType = visibility.type();
        this.visibilityIds = new LinkedHashSet<>(visibility.ids());
    }

    public boolean isArchived() {
        return status == AlertStatus.ARCHIVED;
    }

    public boolean isActiveAt(LocalDateTime now) {
        return status == AlertStatus.ACTIVE && (expiresAt == null || now.isBefore(expiresAt));
    }

    public boolean isExpiredAt(LocalDateTime now) {
        return status == AlertStatus.ACTIVE && expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean hasStartedAt(LocalDateTime now) {
        return !startAt.isAfter(now);
    }

    public boolean targets(String userId) {
        return targetUserIds.contains(userId);
    }

    /** @return true if the status changed */
    public boolean archive(LocalDateTime now) {
        if (!status.canTransitionTo(AlertStatus.ARCHIVED)) {
            return false;
        }
        this.status = AlertStatus.ARCHIVED;
        this.updatedAt = now;
        return true;
    }
}
