package alerting.backend.service;

import alerting.backend.config.AlertingProperties;
import alerting.backend.domain.Alert;
import alerting.backend.domain.AlertStatus;
import alerting.backend.domain.Severity;
import alerting.backend.domain.UserAlertState;
import alerting.backend.domain.Visibility;
import alerting.backend.domain.VisibilityType;
import alerting.backend.dto.AlertCreateRequest;
import alerting.backend.dto.AlertFilter;
import alerting.backend.dto.AlertResponse;
import alerting.backend.dto.AlertUpdateRequest;
import alerting.backend.exception.ErrorCode;
import alerting.backend.exception.InvalidStateException;
import alerting.backend.exception.NotFoundException;
import alerting.backend.exception.ValidationException;
import alerting.backend.repository.AlertRepository;
import alerting.backend.repository.UserAlertStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Owns alert entities. Alerts are never deleted, only archived.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class AlertService {

    private final AlertRepository alertRepository;
    private final UserAlertStateRepository stateRepository;
    private final VisibilityResolver visibilityResolver;
    private final ApplicationEventPublisher eventPublisher;
    private final AlertingProperties properties;
    private final Clock clock;

    public AlertResponse create(AlertCreateRequest req) {
        LocalDateTime now = LocalDateTime.now(clock);

        requireText("title", req.getTitle());
        requireText("message", req.getMessage());
        requireText("createdBy", req.getCreatedBy());
        Severity severity = Severity.from(req.getSeverity());
        Visibility visibility = toVisibility(req.getVisibilityType(), req.getTargetIds());
        LocalDateTime startAt = req.getStartAt() != null ? req.getStartAt() : now;
        validateWindow(startAt, req.getExpiresAt());
        Duration interval = req.getReminderInterval() != null
                ? req.getReminderInterval()
                : properties.getReminder().getDefaultInterval();
        validateInterval(interval);

        Set<String> targets = visibilityResolver.resolve(visibility);

        Alert alert = Alert.builder()
                .title(req.getTitle())
                .message(req.getMessage())
                .severity(severity)
                .createdBy(req.getCreatedBy())
                .visibilityType(visibility.type())
                .visibilityIds(new LinkedHashSet<>(visibility.ids()))
                .targetUserIds(new LinkedHashSet<>(targets))
                .startAt(startAt)
                .expiresAt(req.getExpiresAt())
                .remindersEnabled(req.getRemindersEnabled() == null || req.getRemindersEnabled())
                .reminderInterval(interval)
                .status(AlertStatus.ACTIVE)
                .createdAt(now)
                .updatedAt(now)
                .build();
        Alert saved = alertRepository.save(alert);

        fanOut(saved.getId(), targets);
        log.info("alert created id={}, severity={}, visibility={}, targets={}",
                saved.getId(), severity, visibility.type(), targets.size());
        return AlertResponse.from(saved);
    }

    public AlertResponse update(Long id, AlertUpdateRequest patch) {
        LocalDateTime now = LocalDateTime.now(clock);

        // everything that can fail validation or call out to the directory happens before the lock
        if (patch.getTitle() != null) requireText("title", patch.getTitle());
        if (patch.getMessage() != null) requireText("message", patch.getMessage());
        Severity severity = patch.getSeverity() != null ? Severity.from(patch.getSeverity()) : null;
        Visibility visibility = patch.getVisibilityType() != null
                ? toVisibility(patch.getVisibilityType(), patch.getTargetIds())
                : null;
        if (patch.getReminderInterval() != null) validateInterval(patch.getReminderInterval());
        boolean clearExpiry = Boolean.TRUE.equals(patch.getClearExpiresAt());
        if (clearExpiry && patch.getExpiresAt() != null) {
            throw new ValidationException(ErrorCode.INVALID_INPUT_VALUE,
                    "expiresAt and clearExpiresAt cannot be combined");
        }
        Set<String> newTargets = visibility != null ? visibilityResolver.resolve(visibility) : null;

        Alert alert = alertRepository.findWithLockById(id)
                .orElseThrow(() -> NotFoundException.alert(id));
        if (alert.isArchived()) {
            throw new InvalidStateException(ErrorCode.ALERT_ARCHIVED, "Alert " + id + " is archived");
        }

        LocalDateTime startAt = patch.getStartAt() != null ? patch.getStartAt() : alert.getStartAt();
        LocalDateTime expiresAt = clearExpiry ? null
                : patch.getExpiresAt() != null ? patch.getExpiresAt() : alert.getExpiresAt();
        validateWindow(startAt, expiresAt);

        if (patch.getTitle() != null) alert.setTitle(patch.getTitle());
        if (patch.getMessage() != null) alert.setMessage(patch.getMessage());
        if (severity != null) alert.setSeverity(severity);
        if (patch.getRemindersEnabled() != null) alert.setRemindersEnabled(patch.getRemindersEnabled());
        if (patch.getReminderInterval() != null) alert.setReminderInterval(patch.getReminderInterval());
        alert.setStartAt(startAt);
        alert.setExpiresAt(expiresAt);

        if (visibility != null) {
            Set<String> added = new LinkedHashSet<>(newTargets);
            added.removeAll(alert.getTargetUserIds());
            alert.applyVisibility(visibility);
            alert.setTargetUserIds(new LinkedHashSet<>(newTargets));
            fanOut(alert.getId(), added);
            log.info("alert {} visibility changed to {}, targets={}, added={}",
                    id, visibility.type(), newTargets.size(), added.size());
        }
        alert.setUpdatedAt(now);
        return AlertResponse.from(alert);
    }

    /** Idempotent: archiving an archived alert succeeds without changes. */
    public AlertResponse archive(Long id) {
        Alert alert = alertRepository.findWithLockById(id)
                .orElseThrow(() -> NotFoundException.alert(id));
        if (alert.archive(LocalDateTime.now(clock))) {
            log.info("alert archived id={}", id);
        }
        return AlertResponse.from(alert);
    }

    @Transactional(readOnly = true)
    public AlertResponse get(Long id) {
        return alertRepository.findById(id)
                .map(AlertResponse::from)
                .orElseThrow(() -> NotFoundException.alert(id));
    }

    @Transactional(readOnly = true)
    public List<AlertResponse> list(AlertFilter filter) {
        return alertRepository.findAllByOrderByIdAsc().stream()
                .filter(filter::matches)
                .map(AlertResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public boolean isActive(Long id) {
        Alert alert = alertRepository.findById(id)
                .orElseThrow(() -> NotFoundException.alert(id));
        return alert.isActiveAt(LocalDateTime.now(clock));
    }

    // alert row is either new or locked here, so no concurrent creator can race these inserts
    private void fanOut(Long alertId, Set<String> userIds) {
        if (userIds.isEmpty()) return;
        List<UserAlertState> rows = userIds.stream()
                .filter(userId -> stateRepository.findByUserIdAndAlertId(userId, alertId).isEmpty())
                .map(userId -> UserAlertState.unread(userId, alertId))
                .toList();
        stateRepository.saveAll(rows);
        eventPublisher.publishEvent(new AlertTargetsResolvedEvent(alertId, userIds));
    }

    private Visibility toVisibility(String type, Set<String> ids) {
        VisibilityType visibilityType = VisibilityType.from(type);
        Set<String> targetIds = ids != null ? ids : Set.of();
        if (visibilityType != VisibilityType.ORGANIZATION
                && targetIds.stream().anyMatch(tid -> tid == null || tid.isBlank())) {
            throw new ValidationException(ErrorCode.INVALID_VISIBILITY, "target ids must not be blank");
        }
        return new Visibility(visibilityType, targetIds);
    }

    private void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_INPUT_VALUE, field + " is required");
        }
    }

    private void validateWindow(LocalDateTime startAt, LocalDateTime expiresAt) {
        if (expiresAt != null && !expiresAt.isAfter(startAt)) {
            throw new ValidationException(ErrorCode.INVALID_TIME_WINDOW,
                    "expiresAt (" + expiresAt + ") must be after startAt (" + startAt + ")");
        }
    }

    private void validateInterval(Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new ValidationException(ErrorCode.INVALID_REMINDER_INTERVAL,
                    "reminderInterval must be positive: " + interval);
        }
    }
}
