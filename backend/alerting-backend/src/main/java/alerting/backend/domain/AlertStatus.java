package alerting.backend.domain;

import java.util.Map;
import java.util.Set;

/**
 * Alert lifecycle. ARCHIVED is terminal.
 */
public enum AlertStatus {
    ACTIVE,
    ARCHIVED;

    private static final Map<AlertStatus, Set<AlertStatus>> TRANSITIONS = Map.of(
            ACTIVE, Set.of(ARCHIVED),
            ARCHIVED, Set.of()
    );

    public boolean canTransitionTo(AlertStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }
}
