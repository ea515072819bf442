package alerting.backend.service;

import java.util.Set;

/**
 * Published inside the transaction that gave these users an alert; consumed after commit
 * to send the first notification.
 */
public record AlertTargetsResolvedEvent(Long alertId, Set<String> userIds) {

    public AlertTargetsResolvedEvent {
        userIds = Set.copyOf(userIds);
    }
}
