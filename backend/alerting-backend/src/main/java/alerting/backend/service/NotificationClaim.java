package alerting.backend.service;

import alerting.backend.domain.Alert;
import alerting.backend.domain.DeliveryKind;

/**
 * A pair that was due and has been stamped; {@code kind} is INITIAL until the user has been notified once.
 */
public record NotificationClaim(Alert alert, String userId, DeliveryKind kind) {
}
