package alerting.backend.service;

import alerting.backend.domain.Alert;
import alerting.backend.dto.TickResult;
import alerting.backend.repository.AlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * One reminder pass. Holds no timer: callers decide when a tick runs.
 * <p>
 * Candidates are a snapshot taken at the start of the tick, but every pair is re-checked
 * and stamped in its own transaction, so a second tick at the same instant sends nothing
 * and concurrent read/snooze/update calls are honoured.
 * <p>
 * Alerts that started after they were created get their first notification here too,
 * with or without reminders enabled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderScheduler {

    private final AlertRepository alertRepository;
    private final UserAlertStateService stateService;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;

    public TickResult runTick() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Alert> candidates = alertRepository.findTickCandidates(now);

        int checked = 0;
        int notified = 0;
        for (Alert alert : candidates) {
            for (String userId : List.copyOf(alert.getTargetUserIds())) {
                checked++;
                try {
                    Optional<NotificationClaim> claim = stateService.claimNotification(userId, alert.getId(), now);
                    if (claim.isPresent()) {
                        dispatcher.dispatch(claim.get().alert(), userId, claim.get().kind());
                        notified++;
                    }
                } catch (Exception e) {
                    log.error("reminder failed alert={}, user={}", alert.getId(), userId, e);
                }
            }
        }

        if (notified > 0) {
            log.info("reminder tick at {}: alerts={}, checked={}, notified={}",
                    now, candidates.size(), checked, notified);
        } else {
            log.debug("reminder tick at {}: alerts={}, checked={}, nothing due", now, candidates.size(), checked);
        }
        return new TickResult(now, candidates.size(), checked, notified);
    }
}
