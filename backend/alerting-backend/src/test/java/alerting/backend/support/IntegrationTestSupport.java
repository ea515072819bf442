package alerting.backend.support;

import alerting.backend.AlertingBackendApplication;
import alerting.backend.dto.AlertCreateRequest;
import alerting.backend.dto.AlertResponse;
import alerting.backend.dto.TeamRequest;
import alerting.backend.dto.UserRequest;
import alerting.backend.repository.AlertRepository;
import alerting.backend.repository.DeliveryAttemptRepository;
import alerting.backend.repository.InboxEntryRepository;
import alerting.backend.repository.TeamRepository;
import alerting.backend.repository.UserAlertStateRepository;
import alerting.backend.repository.UserRepository;
import alerting.backend.service.AlertService;
import alerting.backend.service.DirectoryService;
import alerting.backend.service.UserAlertStateService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Set;

/**
 * Shared Spring context on H2 with a controllable clock and a recording channel.
 * Tests are deliberately not transactional: the first notification is sent after commit.
 */
@AutoConfigureMockMvc
@SpringBootTest(classes = {AlertingBackendApplication.class, TestSupportConfig.class})
public abstract class IntegrationTestSupport {

    public static final LocalDateTime T0 = LocalDateTime.of(2026, 3, 2, 9, 0);

    @Autowired protected MutableClock clock;
    @Autowired protected RecordingChannel recordingChannel;

    @Autowired protected AlertService alertService;
    @Autowired protected DirectoryService directoryService;
    @Autowired protected UserAlertStateService stateService;

    @Autowired protected AlertRepository alertRepository;
    @Autowired protected UserAlertStateRepository stateRepository;
    @Autowired protected DeliveryAttemptRepository attemptRepository;
    @Autowired protected InboxEntryRepository inboxRepository;
    @Autowired protected UserRepository userRepository;
    @Autowired protected TeamRepository teamRepository;

    @BeforeEach
    void resetWorld() {
        inboxRepository.deleteAll();
        attemptRepository.deleteAll();
        stateRepository.deleteAll();
        alertRepository.deleteAll();
        userRepository.deleteAll();
        teamRepository.deleteAll();
        recordingChannel.reset();
        clock.setNow(T0);

        team("team1", "Engineering");
        team("team2", "Marketing");
        user("u1", "team1");
        user("u2", "team1");
        user("u3", "team2");
    }

    protected void team(String id, String name) {
        directoryService.registerTeam(new TeamRequest(id, name));
    }

    protected void user(String id, String teamId) {
        directoryService.registerUser(new UserRequest(id, "User " + id, id + "@example.com", teamId));
    }

    protected AlertCreateRequest.AlertCreateRequestBuilder alertRequest(String visibilityType, Set<String> targetIds) {
        return AlertCreateRequest.builder()
                .title("Maintenance window")
                .message("Deploy freeze tonight")
                .severity("warning")
                .createdBy("admin")
                .visibilityType(visibilityType)
                .targetIds(targetIds)
                .remindersEnabled(true)
                .reminderInterval(Duration.ofHours(2));
    }

    protected AlertResponse createTeamAlert(String... teamIds) {
        return alertService.create(alertRequest("team", Set.of(teamIds)).build());
    }
}
