package alerting.backend.dto;

import java.time.LocalDateTime;

public record TickResult(LocalDateTime ranAt, int alertsScanned, int pairsChecked, int pairsNotified) {
}
