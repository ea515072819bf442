package alerting.backend.dto;

import alerting.backend.domain.User;

public record UserResponse(String id, String name, String email, String teamId) {

    public static UserResponse from(User u) {
        return new UserResponse(u.getId(), u.getName(), u.getEmail(), u.getTeamId());
    }
}
