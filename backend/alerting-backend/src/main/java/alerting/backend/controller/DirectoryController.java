package alerting.backend.controller;

import alerting.backend.dto.TeamRequest;
import alerting.backend.dto.TeamResponse;
import alerting.backend.dto.UserRequest;
import alerting.backend.dto.UserResponse;
import alerting.backend.service.DirectoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/directory")
@RequiredArgsConstructor
public class DirectoryController {

    private final DirectoryService directoryService;

    @PostMapping("/teams")
    public ResponseEntity<TeamResponse> registerTeam(@RequestBody @Valid TeamRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(directoryService.registerTeam(request));
    }

    @GetMapping("/teams")
    public ResponseEntity<List<TeamResponse>> teams() {
        return ResponseEntity.ok(directoryService.listTeams());
    }

    @PostMapping("/users")
    public ResponseEntity<UserResponse> registerUser(@RequestBody @Valid UserRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(directoryService.registerUser(request));
    }

    @GetMapping("/users")
    public ResponseEntity<List<UserResponse>> users() {
        return ResponseEntity.ok(directoryService.listUsers());
    }
}
