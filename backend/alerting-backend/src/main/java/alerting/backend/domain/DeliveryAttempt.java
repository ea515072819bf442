package alerting.backend.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "delivery_attempts",
        indexes = {
                @Index(
                        name = "idx_attempt_alert_user_time",
                        columnList = "alert_id, user_id, attempted_at"
                )
        }
)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeliveryAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "alert_id", nullable = false)
    private Long alertId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "channel", nullable = false, length = 32)
    private String channel;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 16)
    private DeliveryKind kind;

    @Column(name = "success", nullable = false)
    private boolean success;

    @Column(name = "error_message", length = 512)
    private String errorMessage;

    @Column(name = "attempted_at", nullable = false)
    private LocalDateTime attemptedAt;
}
