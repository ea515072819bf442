package alerting.backend.controller;

import alerting.backend.domain.AlertStatus;
import alerting.backend.domain.Severity;
import alerting.backend.domain.VisibilityType;
import alerting.backend.dto.AlertCreateRequest;
import alerting.backend.dto.AlertFilter;
import alerting.backend.dto.AlertResponse;
import alerting.backend.dto.AlertUpdateRequest;
import alerting.backend.exception.ErrorCode;
import alerting.backend.exception.ValidationException;
import alerting.backend.service.AlertService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/admin/alerts")
@RequiredArgsConstructor
public class AlertAdminController {

    private final AlertService alertService;

    @PostMapping
    public ResponseEntity<AlertResponse> create(@RequestBody @Valid AlertCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(alertService.create(request));
    }

    @GetMapping
    public ResponseEntity<List<AlertResponse>> list(
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String visibility
    ) {
        AlertFilter filter = new AlertFilter(
                severity != null ? Severity.from(severity) : null,
                status != null ? parseStatus(status) : null,
                visibility != null ? VisibilityType.from(visibility) : null
        );
        return ResponseEntity.ok(alertService.list(filter));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AlertResponse> get(@PathVariable Long id) {
        return ResponseEntity.ok(alertService.get(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<AlertResponse> update(
            @PathVariable Long id,
            @RequestBody AlertUpdateRequest request
    ) {
        return ResponseEntity.ok(alertService.update(id, request));
    }

    @PostMapping("/{id}/archive")
    public ResponseEntity<AlertResponse> archive(@PathVariable Long id) {
        return ResponseEntity.ok(alertService.archive(id));
    }

    private AlertStatus parseStatus(String status) {
        try {
            return AlertStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ErrorCode.INVALID_INPUT_VALUE, "unknown status: " + status);
        }
    }
}
