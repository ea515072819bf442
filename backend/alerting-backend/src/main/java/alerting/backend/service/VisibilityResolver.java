package alerting.backend.service;

import alerting.backend.domain.Visibility;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Turns a visibility descriptor into the user ids it addresses.
 * Unknown team and user ids are dropped without failing; an empty result is valid.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VisibilityResolver {

    private final UserDirectory userDirectory;

    public Set<String> resolve(Visibility visibility) {
        switch (visibility.type()) {
            case ORGANIZATION:
                return new LinkedHashSet<>(userDirectory.listUsers());
            case TEAM:
                Set<String> members = new LinkedHashSet<>();
                for (String teamId : visibility.ids()) {
                    Set<String> team = userDirectory.teamMembers(teamId);
                    if (team.isEmpty()) {
                        log.debug("team {} has no members or is unknown, skipped", teamId);
                    }
                    members.addAll(team);
                }
                return members;
            case USER:
                Set<String> known = userDirectory.listUsers();
                Set<String> users = new LinkedHashSet<>();
                for (String userId : visibility.ids()) {
                    if (known.contains(userId)) {
                        users.add(userId);
                    } else {
                        log.debug("unknown user {} dropped from visibility", userId);
                    }
                }
                return users;
            default:
                throw new IllegalStateException("Unhandled visibility type: " + visibility.type());
        }
    }
}
