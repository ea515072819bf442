package alerting.backend.listener;

import alerting.backend.service.AlertTargetsResolvedEvent;
import alerting.backend.service.NotificationClaim;
import alerting.backend.service.NotificationDispatcher;
import alerting.backend.service.UserAlertStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Sends the first notification to newly targeted users once their state rows are committed.
 * Alerts that start in the future are skipped here and picked up by the first tick after they start.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InitialNotificationListener {

    private final UserAlertStateService stateService;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTargetsResolved(AlertTargetsResolvedEvent event) {
        LocalDateTime now = LocalDateTime.now(clock);
        int sent = 0;
        for (String userId : event.userIds()) {
            try {
                Optional<NotificationClaim> claim = stateService.claimNotification(userId, event.alertId(), now);
                if (claim.isPresent()) {
                    dispatcher.dispatch(claim.get().alert(), userId, claim.get().kind());
                    sent++;
                }
            } catch (Exception e) {
                log.error("initial notification failed alert={}, user={}", event.alertId(), userId, e);
            }
        }
        log.info("initial notification alert={}, targets={}, sent={}", event.alertId(), event.userIds().size(), sent);
    }
}
