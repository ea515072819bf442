package alerting.backend.service;

import java.util.Set;

/**
 * Read-only view of who exists and which team they belong to.
 */
public interface UserDirectory {

    Set<String> listUsers();

    /** @return members of the team, or an empty set when the team is unknown */
    Set<String> teamMembers(String teamId);
}
