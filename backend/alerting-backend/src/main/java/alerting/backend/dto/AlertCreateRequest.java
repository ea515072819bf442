package alerting.backend.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Set;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertCreateRequest {
    @NotBlank
    private String title;
    @NotBlank
    private String message;
    @NotBlank
    private String severity;
    @NotBlank
    private String createdBy;
    @NotBlank
    private String visibilityType;   // organization | team | user
    private Set<String> targetIds;
    private LocalDateTime startAt;   // defaults to now
    private LocalDateTime expiresAt;
    private Boolean remindersEnabled;
    private Duration reminderInterval;
}
