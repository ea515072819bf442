package alerting.backend.service;

import alerting.backend.domain.Alert;
import alerting.backend.domain.DeliveryKind;
import alerting.backend.domain.UserAlertState;
import alerting.backend.dto.UserAlertResponse;
import alerting.backend.dto.UserAlertStateResponse;
import alerting.backend.exception.ErrorCode;
import alerting.backend.exception.InvalidStateException;
import alerting.backend.exception.NotFoundException;
import alerting.backend.repository.AlertRepository;
import alerting.backend.repository.UserAlertStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-(user, alert) read, snooze and notification bookkeeping.
 * Every transition locks the state row, so concurrent writers never interleave on one pair.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class UserAlertStateService {

    private final UserAlertStateRepository stateRepository;
    private final AlertRepository alertRepository;
    private final Clock clock;

    public UserAlertStateResponse getOrCreate(String userId, Long alertId) {
        Alert alert = targetedAlert(userId, alertId);
        return UserAlertStateResponse.from(lockOrCreate(userId, alert.getId()));
    }

    @Transactional(readOnly = true)
    public UserAlertStateResponse get(String userId, Long alertId) {
        targetedAlert(userId, alertId);
        return stateRepository.findByUserIdAndAlertId(userId, alertId)
                .map(UserAlertStateResponse::from)
                .orElseGet(() -> UserAlertStateResponse.from(UserAlertState.unread(userId, alertId)));
    }

    /** Allowed on archived and expired alerts. */
    public UserAlertStateResponse markRead(String userId, Long alertId) {
        targetedAlert(userId, alertId);
        UserAlertState state = lockOrCreate(userId, alertId);
        state.markRead(LocalDateTime.now(clock));
        log.debug("user {} read alert {}", userId, alertId);
        return UserAlertStateResponse.from(state);
    }

    public UserAlertStateResponse markUnread(String userId, Long alertId) {
        targetedAlert(userId, alertId);
        UserAlertState state = lockOrCreate(userId, alertId);
        state.markUnread();
        return UserAlertStateResponse.from(state);
    }

    /**
     * Suppresses reminders until the start of the next calendar day in the clock's zone.
     */
    public UserAlertStateResponse snooze(String userId, Long alertId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Alert alert = targetedAlert(userId, alertId);
        if (!alert.isActiveAt(now)) {
            throw new InvalidStateException(ErrorCode.ALERT_INACTIVE,
                    "Alert " + alertId + " is archived or expired and cannot be snoozed");
        }
        UserAlertState state = lockOrCreate(userId, alertId);
        state.setSnoozedUntil(endOfDay(now));
        log.debug("user {} snoozed alert {} until {}", userId, alertId, state.getSnoozedUntil());
        return UserAlertStateResponse.from(state);
    }

    @Transactional(readOnly = true)
    public boolean isEligibleForReminder(String userId, Long alertId, LocalDateTime now, Duration interval) {
        Alert alert = alertRepository.findById(alertId).orElse(null);
        if (alert == null || !alert.isActiveAt(now)) return false;
        return stateRepository.findByUserIdAndAlertId(userId, alertId)
                .map(state -> state.isDueAt(now, interval))
                .orElse(true);
    }

    /**
     * Re-checks eligibility against the current alert and state and, if due, stamps
     * {@code lastNotifiedAt = now}. Runs in its own transaction so the lock is released
     * before any channel is called.
     * <p>
     * A pair never notified before is claimed as INITIAL whatever the reminder setting;
     * later claims are REMINDERs and need reminders to be enabled.
     *
     * @return the claimed delivery, or empty when the pair is not due
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<NotificationClaim> claimNotification(String userId, Long alertId, LocalDateTime now) {
        Alert alert = alertRepository.findById(alertId).orElse(null);
        if (alert == null || !alert.isActiveAt(now) || !alert.hasStartedAt(now) || !alert.targets(userId)) {
            return Optional.empty();
        }
        UserAlertState state = lockOrCreate(userId, alertId);
        DeliveryKind kind = state.getLastNotifiedAt() == null ? DeliveryKind.INITIAL : DeliveryKind.REMINDER;
        if (kind == DeliveryKind.REMINDER && !alert.isRemindersEnabled()) {
            return Optional.empty();
        }
        if (!state.isDueAt(now, alert.getReminderInterval())) {
            log.debug("skip user={} alert={} snoozedUntil={} lastNotifiedAt={}",
                    userId, alertId, state.getSnoozedUntil(), state.getLastNotifiedAt());
            return Optional.empty();
        }
        state.setLastNotifiedAt(now);
        return Optional.of(new NotificationClaim(alert, userId, kind));
    }

    /** Active alerts addressed to the user, with that user's state. */
    @Transactional(readOnly = true)
    public List<UserAlertResponse> listForUser(String userId) {
        List<Alert> alerts = alertRepository.findActive(LocalDateTime.now(clock)).stream()
                .filter(a -> a.targets(userId))
                .toList();
        if (alerts.isEmpty()) return List.of();

        Map<Long, UserAlertState> states = stateRepository
                .findByUserIdAndAlertIdIn(userId, alerts.stream().map(Alert::getId).toList())
                .stream()
                .collect(Collectors.toMap(UserAlertState::getAlertId, Function.identity()));

        return alerts.stream()
                .map(a -> UserAlertResponse.of(a,
                        states.getOrDefault(a.getId(), UserAlertState.unread(userId, a.getId()))))
                .toList();
    }

    static LocalDateTime endOfDay(LocalDateTime now) {
        return now.toLocalDate().plusDays(1).atStartOfDay();
    }

    private Alert targetedAlert(String userId, Long alertId) {
        Alert alert = alertRepository.findById(alertId)
                .orElseThrow(() -> NotFoundException.alert(alertId));
        if (!alert.targets(userId)) {
            throw NotFoundException.notTargeted(userId, alertId);
        }
        return alert;
    }

    // creators serialize on the alert row before inserting, so a pair is never inserted twice
    private UserAlertState lockOrCreate(String userId, Long alertId) {
        return stateRepository.findWithLock(userId, alertId).orElseGet(() -> {
            alertRepository.findWithLockById(alertId);
            return stateRepository.findWithLock(userId, alertId)
                    .orElseGet(() -> stateRepository.save(UserAlertState.unread(userId, alertId)));
        });
    }
}
