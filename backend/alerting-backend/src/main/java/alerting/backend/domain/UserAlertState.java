package alerting.backend.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.LocalDateTime;

@Entity
@Table(
        name = "user_alert_states",
        indexes = {
                @Index(name = "idx_state_alert", columnList = "alert_id")
        }
)
@IdClass(UserAlertStateId.class)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserAlertState {

    @Id
    @Column(name = "user_id", length = 64)
    private String userId;

    @Id
    @Column(name = "alert_id")
    private Long alertId;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "read_status", nullable = false, length = 16)
    private ReadStatus readStatus = ReadStatus.UNREAD;

    @Column(name = "read_at")
    private LocalDateTime readAt;

    // exclusive: the snooze covers everything before this instant
    @Column(name = "snoozed_until")
    private LocalDateTime snoozedUntil;

    @Column(name = "last_notified_at")
    private LocalDateTime lastNotifiedAt;

    public static UserAlertState unread(String userId, Long alertId) {
        return UserAlertState.builder()
                .userId(userId)
                .alertId(alertId)
                .build();
    }

    public boolean isSnoozedAt(LocalDateTime now) {
        return snoozedUntil != null && now.isBefore(snoozedUntil);
    }

    public boolean isDueAt(LocalDateTime now, Duration interval) {
        if (isSnoozedAt(now)) return false;
        if (lastNotifiedAt == null) return true;
        return Duration.between(lastNotifiedAt, now).compareTo(interval) >= 0;
    }

    public void markRead(LocalDateTime now) {
        this.readStatus = ReadStatus.READ;
        this.readAt = now;
    }

    public void markUnread() {
        this.readStatus = ReadStatus.UNREAD;
        this.readAt = null;
    }
}
