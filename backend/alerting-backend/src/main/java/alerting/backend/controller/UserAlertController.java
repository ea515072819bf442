package alerting.backend.controller;

import alerting.backend.dto.InboxEntryResponse;
import alerting.backend.dto.UserAlertResponse;
import alerting.backend.dto.UserAlertStateResponse;
import alerting.backend.service.InboxService;
import alerting.backend.service.UserAlertStateService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/users/{userId}")
@RequiredArgsConstructor
public class UserAlertController {

    private final UserAlertStateService stateService;
    private final InboxService inboxService;

    @GetMapping("/alerts")
    public ResponseEntity<List<UserAlertResponse>> alerts(@PathVariable String userId) {
        return ResponseEntity.ok(stateService.listForUser(userId));
    }

    @GetMapping("/alerts/{alertId}")
    public ResponseEntity<UserAlertStateResponse> state(@PathVariable String userId, @PathVariable Long alertId) {
        return ResponseEntity.ok(stateService.get(userId, alertId));
    }

    @PostMapping("/alerts/{alertId}/read")
    public ResponseEntity<UserAlertStateResponse> markRead(@PathVariable String userId, @PathVariable Long alertId) {
        return ResponseEntity.ok(stateService.markRead(userId, alertId));
    }

    @PostMapping("/alerts/{alertId}/unread")
    public ResponseEntity<UserAlertStateResponse> markUnread(@PathVariable String userId, @PathVariable Long alertId) {
        return ResponseEntity.ok(stateService.markUnread(userId, alertId));
    }

    @PostMapping("/alerts/{alertId}/snooze")
    public ResponseEntity<UserAlertStateResponse> snooze(@PathVariable String userId, @PathVariable Long alertId) {
        return ResponseEntity.ok(stateService.snooze(userId, alertId));
    }

    @GetMapping("/inbox")
    public ResponseEntity<List<InboxEntryResponse>> inbox(@PathVariable String userId) {
        return ResponseEntity.ok(inboxService.inbox(userId));
    }
}
