package alerting.backend.service;

import alerting.backend.domain.AlertStatus;
import alerting.backend.domain.ReadStatus;
import alerting.backend.domain.Severity;
import alerting.backend.domain.UserAlertState;
import alerting.backend.domain.VisibilityType;
import alerting.backend.dto.AlertFilter;
import alerting.backend.dto.AlertResponse;
import alerting.backend.dto.AlertUpdateRequest;
import alerting.backend.exception.ErrorCode;
import alerting.backend.exception.InvalidStateException;
import alerting.backend.exception.NotFoundException;
import alerting.backend.exception.ValidationException;
import alerting.backend.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AlertService")
class AlertServiceTest extends IntegrationTestSupport {

    @Test
    @DisplayName("organization alert snapshots the directory at creation time")
    void organizationAlert_snapshotsTargets() {
        AlertResponse alert = alertService.create(alertRequest("organization", null).build());

        user("u4", "team2");

        AlertResponse reloaded = alertService.get(alert.getId());
        assertThat(reloaded.getTargetUserIds()).containsExactlyInAnyOrder("u1", "u2", "u3");
        assertThat(stateRepository.findByUserIdAndAlertId("u4", alert.getId())).isEmpty();
    }

    @Test
    @DisplayName("team alert with one unknown team targets only the known team's members")
    void teamAlert_ignoresUnknownTeam() {
        AlertResponse alert = createTeamAlert("team1", "no-such-team");

        assertThat(alert.getTargetUserIds()).containsExactlyInAnyOrder("u1", "u2");
        List<UserAlertState> rows = stateRepository.findByAlertId(alert.getId());
        assertThat(rows).extracting(UserAlertState::getUserId).containsExactlyInAnyOrder("u1", "u2");
        assertThat(rows).allMatch(s -> s.getReadStatus() == ReadStatus.UNREAD);
    }

    @Test
    @DisplayName("an alert that targets nobody is still created")
    void emptyTargetSet_isAccepted() {
        AlertResponse alert = alertService.create(alertRequest("user", Set.of("ghost")).build());

        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACTIVE);
        assertThat(alert.getTargetUserIds()).isEmpty();
    }

    @Test
    @DisplayName("creation sends the first notification to every target and stamps lastNotifiedAt")
    void create_sendsInitialNotification() {
        AlertResponse alert = createTeamAlert("team1");

        assertThat(recordingChannel.countFor("u1")).isEqualTo(1);
        assertThat(recordingChannel.countFor("u2")).isEqualTo(1);
        assertThat(inboxRepository.findByUserIdOrderByDeliveredAtDescIdDesc("u1")).hasSize(1);
        assertThat(stateRepository.findByUserIdAndAlertId("u1", alert.getId()))
                .get().extracting(UserAlertState::getLastNotifiedAt).isEqualTo(T0);
    }

    @Test
    @DisplayName("an alert starting in the future is not sent on creation")
    void futureAlert_isNotSentOnCreation() {
        alertService.create(alertRequest("team", Set.of("team1")).startAt(T0.plusHours(1)).build());

        assertThat(recordingChannel.deliveries()).isEmpty();
    }

    @Test
    @DisplayName("unknown severity is rejected before anything is stored")
    void unknownSeverity_isRejected() {
        assertThatThrownBy(() -> alertService.create(alertRequest("organization", null).severity("panic").build()))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_SEVERITY);
        assertThat(alertRepository.count()).isZero();
    }

    @Test
    @DisplayName("expiresAt must be strictly after startAt")
    void expiryNotAfterStart_isRejected() {
        assertThatThrownBy(() -> alertService.create(alertRequest("organization", null)
                .startAt(T0).expiresAt(T0).build()))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_TIME_WINDOW);
        assertThat(alertRepository.count()).isZero();
    }

    @Test
    @DisplayName("non-positive reminder interval is rejected")
    void zeroInterval_isRejected() {
        assertThatThrownBy(() -> alertService.create(alertRequest("organization", null)
                .reminderInterval(Duration.ZERO).build()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("update changes only the supplied fields")
    void update_isPartial() {
        AlertResponse alert = createTeamAlert("team1");
        clock.advance(Duration.ofMinutes(5));

        AlertResponse updated = alertService.update(alert.getId(), AlertUpdateRequest.builder()
                .severity("critical")
                .reminderInterval(Duration.ofHours(1))
                .build());

        assertThat(updated.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(updated.getReminderInterval()).isEqualTo(Duration.ofHours(1));
        assertThat(updated.getTitle()).isEqualTo(alert.getTitle());
        assertThat(updated.getCreatedAt()).isEqualTo(T0);
        assertThat(updated.getUpdatedAt()).isEqualTo(T0.plusMinutes(5));
    }

    @Test
    @DisplayName("update rejects a window that would become invalid")
    void update_validatesMergedWindow() {
        AlertResponse alert = alertService.create(alertRequest("organization", null)
                .expiresAt(T0.plusDays(1)).build());

        assertThatThrownBy(() -> alertService.update(alert.getId(), AlertUpdateRequest.builder()
                .startAt(T0.plusDays(2)).build()))
                .isInstanceOf(ValidationException.class);
        assertThat(alertService.get(alert.getId()).getStartAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("an expiry can be removed explicitly, which makes an expired alert active again")
    void update_clearsExpiry() {
        AlertResponse alert = alertService.create(alertRequest("organization", null)
                .expiresAt(T0.plusHours(1)).build());
        clock.advance(Duration.ofHours(2));
        assertThat(alertService.isActive(alert.getId())).isFalse();

        AlertResponse updated = alertService.update(alert.getId(),
                AlertUpdateRequest.builder().clearExpiresAt(true).build());

        assertThat(updated.getExpiresAt()).isNull();
        assertThat(alertService.isActive(alert.getId())).isTrue();
    }

    @Test
    @DisplayName("clearing and setting the expiry in one update is rejected")
    void update_clearAndSetExpiry_isRejected() {
        AlertResponse alert = alertService.create(alertRequest("organization", null)
                .expiresAt(T0.plusHours(1)).build());

        assertThatThrownBy(() -> alertService.update(alert.getId(), AlertUpdateRequest.builder()
                .clearExpiresAt(true).expiresAt(T0.plusHours(3)).build()))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_INPUT_VALUE);
        assertThat(alertService.get(alert.getId()).getExpiresAt()).isEqualTo(T0.plusHours(1));
    }

    @Test
    @DisplayName("changing visibility adds state rows for new targets and notifies them")
    void update_visibilityFansOutToNewTargets() {
        AlertResponse alert = createTeamAlert("team1");
        stateService.markRead("u1", alert.getId());

        AlertResponse updated = alertService.update(alert.getId(), AlertUpdateRequest.builder()
                .visibilityType("organization")
                .build());

        assertThat(updated.getVisibilityType()).isEqualTo(VisibilityType.ORGANIZATION);
        assertThat(updated.getTargetUserIds()).containsExactlyInAnyOrder("u1", "u2", "u3");
        assertThat(stateRepository.findByUserIdAndAlertId("u3", alert.getId())).isPresent();
        assertThat(stateRepository.findByUserIdAndAlertId("u1", alert.getId()))
                .get().extracting(UserAlertState::getReadStatus).isEqualTo(ReadStatus.READ);
        assertThat(recordingChannel.countFor("u3")).isEqualTo(1);
        assertThat(recordingChannel.countFor("u1")).isEqualTo(1);
    }

    @Test
    @DisplayName("archive is idempotent and blocks later updates")
    void archive_isIdempotentAndTerminal() {
        AlertResponse alert = createTeamAlert("team1");

        assertThat(alertService.archive(alert.getId()).getStatus()).isEqualTo(AlertStatus.ARCHIVED);
        assertThat(alertService.archive(alert.getId()).getStatus()).isEqualTo(AlertStatus.ARCHIVED);
        assertThat(alertService.isActive(alert.getId())).isFalse();

        assertThatThrownBy(() -> alertService.update(alert.getId(), AlertUpdateRequest.builder().title("x").build()))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    @DisplayName("unknown ids fail with NotFoundException")
    void unknownId_isNotFound() {
        assertThatThrownBy(() -> alertService.archive(999L)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> alertService.update(999L, new AlertUpdateRequest())).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> alertService.isActive(999L)).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("isActive turns false once the alert expires")
    void isActive_followsExpiry() {
        AlertResponse alert = alertService.create(alertRequest("organization", null)
                .expiresAt(T0.plusHours(1)).build());

        assertThat(alertService.isActive(alert.getId())).isTrue();
        clock.advance(Duration.ofHours(1));
        assertThat(alertService.isActive(alert.getId())).isFalse();
    }

    @Test
    @DisplayName("list filters by severity, status and visibility in creation order")
    void list_filters() {
        AlertResponse first = createTeamAlert("team1");
        AlertResponse second = alertService.create(alertRequest("organization", null).severity("critical").build());
        AlertResponse third = alertService.create(alertRequest("user", Set.of("u3")).severity("info").build());
        alertService.archive(third.getId());

        assertThat(alertService.list(AlertFilter.none()))
                .extracting(AlertResponse::getId)
                .containsExactly(first.getId(), second.getId(), third.getId());
        assertThat(alertService.list(new AlertFilter(Severity.CRITICAL, null, null)))
                .extracting(AlertResponse::getId).containsExactly(second.getId());
        assertThat(alertService.list(new AlertFilter(null, AlertStatus.ARCHIVED, null)))
                .extracting(AlertResponse::getId).containsExactly(third.getId());
        assertThat(alertService.list(new AlertFilter(null, AlertStatus.ACTIVE, VisibilityType.TEAM)))
                .extracting(AlertResponse::getId).containsExactly(first.getId());
    }
}
