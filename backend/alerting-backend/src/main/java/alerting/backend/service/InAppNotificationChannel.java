package alerting.backend.service;

import alerting.backend.domain.Alert;
import alerting.backend.domain.InboxEntry;
import alerting.backend.repository.InboxEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Component
@RequiredArgsConstructor
public class InAppNotificationChannel implements NotificationChannel {

    public static final String NAME = "in-app";

    private final InboxEntryRepository inboxRepository;
    private final Clock clock;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean deliver(Alert alert, String userId) {
        inboxRepository.save(InboxEntry.builder()
                .userId(userId)
                .alertId(alert.getId())
                .title(alert.getTitle())
                .message(alert.getMessage())
                .severity(alert.getSeverity())
                .deliveredAt(LocalDateTime.now(clock))
                .build());
        log.debug("in-app entry stored user={}, alert={}", userId, alert.getId());
        return true;
    }
}
