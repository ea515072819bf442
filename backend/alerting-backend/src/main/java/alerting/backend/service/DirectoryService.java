package alerting.backend.service;

import alerting.backend.domain.Team;
import alerting.backend.domain.User;
import alerting.backend.dto.TeamRequest;
import alerting.backend.dto.TeamResponse;
import alerting.backend.dto.UserRequest;
import alerting.backend.dto.UserResponse;
import alerting.backend.exception.ErrorCode;
import alerting.backend.exception.NotFoundException;
import alerting.backend.exception.ValidationException;
import alerting.backend.repository.TeamRepository;
import alerting.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Registers the users and teams that visibility rules resolve against.
 * Alerts keep the target set resolved at creation, so later changes here do not retarget them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class DirectoryService {

    private final UserRepository userRepository;
    private final TeamRepository teamRepository;

    public TeamResponse registerTeam(TeamRequest req) {
        if (teamRepository.existsById(req.getId())) {
            throw new ValidationException(ErrorCode.DUPLICATE_ID, "Team already exists: " + req.getId());
        }
        Team saved = teamRepository.save(Team.builder()
                .id(req.getId())
                .name(req.getName())
                .build());
        log.info("team registered id={}", saved.getId());
        return TeamResponse.from(saved);
    }

    public UserResponse registerUser(UserRequest req) {
        if (userRepository.existsById(req.getId())) {
            throw new ValidationException(ErrorCode.DUPLICATE_ID, "User already exists: " + req.getId());
        }
        if (req.getTeamId() != null && !teamRepository.existsById(req.getTeamId())) {
            throw new NotFoundException(ErrorCode.TEAM_NOT_FOUND, "Team not found: " + req.getTeamId());
        }
        User saved = userRepository.save(User.builder()
                .id(req.getId())
                .name(req.getName())
                .email(req.getEmail())
                .teamId(req.getTeamId())
                .build());
        log.info("user registered id={}, team={}", saved.getId(), saved.getTeamId());
        return UserResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<UserResponse> listUsers() {
        return userRepository.findAllByOrderByIdAsc().stream()
                .map(UserResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<TeamResponse> listTeams() {
        return teamRepository.findAll().stream()
                .map(TeamResponse::from)
                .toList();
    }
}
