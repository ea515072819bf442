package alerting.backend.dto;

import alerting.backend.domain.Team;

public record TeamResponse(String id, String name) {

    public static TeamResponse from(Team t) {
        return new TeamResponse(t.getId(), t.getName());
    }
}
