package alerting.backend.dto;

import lombok.*;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Set;

/**
 * Partial update; null fields are left untouched.
 * An expiry is removed with {@code clearExpiresAt = true}, which cannot be combined with {@code expiresAt}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertUpdateRequest {
    private String title;
    private String message;
    private String severity;
    private String visibilityType;
    private Set<String> targetIds;
    private LocalDateTime startAt;
    private LocalDateTime expiresAt;
    private Boolean clearExpiresAt;
    private Boolean remindersEnabled;
    private Duration reminderInterval;
}
