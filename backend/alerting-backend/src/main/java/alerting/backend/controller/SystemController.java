package alerting.backend.controller;

import alerting.backend.dto.AlertAnalyticsResponse;
import alerting.backend.dto.TickResult;
import alerting.backend.service.AlertAnalyticsService;
import alerting.backend.service.ReminderScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SystemController {

    private final ReminderScheduler reminderScheduler;
    private final AlertAnalyticsService analyticsService;

    @PostMapping("/system/reminders/run")
    public ResponseEntity<TickResult> runReminders() {
        return ResponseEntity.ok(reminderScheduler.runTick());
    }

    @GetMapping("/analytics")
    public ResponseEntity<AlertAnalyticsResponse> analytics() {
        return ResponseEntity.ok(analyticsService.aggregate());
    }
}
