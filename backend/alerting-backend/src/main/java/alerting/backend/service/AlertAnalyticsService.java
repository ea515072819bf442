package alerting.backend.service;

import alerting.backend.domain.AlertStatus;
import alerting.backend.domain.ReadStatus;
import alerting.backend.domain.Severity;
import alerting.backend.dto.AlertAnalyticsResponse;
import alerting.backend.dto.AlertAnalyticsResponse.ChannelStats;
import alerting.backend.repository.AlertRepository;
import alerting.backend.repository.DeliveryAttemptRepository;
import alerting.backend.repository.UserAlertStateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only counters over alerts, user states and delivery attempts.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AlertAnalyticsService {

    private final AlertRepository alertRepository;
    private final UserAlertStateRepository stateRepository;
    private final DeliveryAttemptRepository attemptRepository;
    private final Clock clock;

    public AlertAnalyticsResponse aggregate() {
        LocalDateTime now = LocalDateTime.now(clock);

        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) bySeverity.put(s, 0L);
        for (Object[] row : alertRepository.countBySeverity()) {
            bySeverity.put((Severity) row[0], (Long) row[1]);
        }

        Map<AlertStatus, Long> byStatus = new EnumMap<>(AlertStatus.class);
        for (AlertStatus s : AlertStatus.values()) byStatus.put(s, 0L);
        for (Object[] row : alertRepository.countByStatus()) {
            byStatus.put((AlertStatus) row[0], (Long) row[1]);
        }
        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();

        long read = stateRepository.countByReadStatus(ReadStatus.READ);
        long unread = stateRepository.countByReadStatus(ReadStatus.UNREAD);
        long snoozed = stateRepository.countSnoozed(now);

        Map<String, ChannelStats> byChannel = new TreeMap<>();
        long succeeded = 0;
        long failed = 0;
        for (Object[] row : attemptRepository.countByChannelAndSuccess()) {
            String channel = (String) row[0];
            boolean success = (Boolean) row[1];
            long count = (Long) row[2];
            ChannelStats prev = byChannel.getOrDefault(channel, new ChannelStats(0, 0));
            if (success) {
                succeeded += count;
                byChannel.put(channel, new ChannelStats(prev.succeeded() + count, prev.failed()));
            } else {
                failed += count;
                byChannel.put(channel, new ChannelStats(prev.succeeded(), prev.failed() + count));
            }
        }

        return AlertAnalyticsResponse.builder()
                .generatedAt(now)
                .totalAlerts(total)
                .activeAlerts(alertRepository.countActive(now))
                .expiredAlerts(alertRepository.countExpired(now))
                .alertsBySeverity(bySeverity)
                .alertsByStatus(byStatus)
                .readStates(read)
                .unreadStates(unread)
                .snoozedStates(snoozed)
                .unsnoozedStates(read + unread - snoozed)
                .deliveryAttempts(succeeded + failed)
                .deliverySucceeded(succeeded)
                .deliveryFailed(failed)
                .deliveryByChannel(byChannel)
                .build();
    }
}
