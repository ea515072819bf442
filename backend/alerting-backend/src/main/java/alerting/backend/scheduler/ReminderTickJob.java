package alerting.backend.scheduler;

import alerting.backend.service.ReminderScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "alerting.reminder", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReminderTickJob {

    private final ReminderScheduler reminderScheduler;

    @Scheduled(
            initialDelayString = "${alerting.reminder.initial-delay:PT10S}",
            fixedDelayString = "${alerting.reminder.tick-interval:PT60S}"
    )
    public void tick() {
        try {
            reminderScheduler.runTick();
        } catch (Exception e) {
            log.error("ReminderTickJob failed", e);
        }
    }
}
