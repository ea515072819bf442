package alerting.backend.dto;

import alerting.backend.domain.AlertStatus;
import alerting.backend.domain.Severity;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Map;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertAnalyticsResponse {
    private LocalDateTime generatedAt;

    private long totalAlerts;
    private long activeAlerts;
    private long expiredAlerts;
    private Map<Severity, Long> alertsBySeverity;
    private Map<AlertStatus, Long> alertsByStatus;

    private long readStates;
    private long unreadStates;
    private long snoozedStates;
    private long unsnoozedStates;

    private long deliveryAttempts;
    private long deliverySucceeded;
    private long deliveryFailed;
    private Map<String, ChannelStats> deliveryByChannel;

    public record ChannelStats(long succeeded, long failed) {
    }
}
