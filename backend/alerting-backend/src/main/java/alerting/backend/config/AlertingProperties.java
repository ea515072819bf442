package alerting.backend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties("alerting")
public class AlertingProperties {

    /** Zone of the application clock; also decides where a snoozed day ends. */
    private String timeZone = "Asia/Seoul";

    private final Reminder reminder = new Reminder();
    private final Dispatch dispatch = new Dispatch();

    @Getter
    @Setter
    public static class Reminder {
        private boolean enabled = true;
        private Duration initialDelay = Duration.ofSeconds(10);
        private Duration tickInterval = Duration.ofSeconds(60);
        private Duration defaultInterval = Duration.ofHours(2);
    }

    @Getter
    @Setter
    public static class Dispatch {
        private Duration channelTimeout = Duration.ofSeconds(5);
        /** Threads per channel. */
        private int poolSize = 4;
        /** Calls waiting per channel before new ones are rejected. */
        private int queueCapacity = 100;
    }
}
