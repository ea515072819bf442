package alerting.backend.service;

import alerting.backend.domain.Alert;

/**
 * A way of getting an alert in front of a user.
 */
public interface NotificationChannel {

    /** Short identifier stored with every delivery attempt. */
    String name();

    /**
     * @return true if the channel accepted the alert for delivery
     */
    boolean deliver(Alert alert, String userId);
}
