package alerting.backend.domain;

import java.util.Set;

/**
 * Who an alert is addressed to. {@code ids} holds team ids for TEAM, user ids for USER
 * and is empty for ORGANIZATION.
 */
public record Visibility(VisibilityType type, Set<String> ids) {

    public Visibility {
        ids = (type == VisibilityType.ORGANIZATION || ids == null) ? Set.of() : Set.copyOf(ids);
    }

    public static Visibility organization() {
        return new Visibility(VisibilityType.ORGANIZATION, Set.of());
    }

    public static Visibility teams(Set<String> teamIds) {
        return new Visibility(VisibilityType.TEAM, teamIds);
    }

    public static Visibility users(Set<String> userIds) {
        return new Visibility(VisibilityType.USER, userIds);
    }
}
