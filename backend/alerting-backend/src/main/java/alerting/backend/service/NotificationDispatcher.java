package alerting.backend.service;

import alerting.backend.config.AlertingProperties;
import alerting.backend.config.ChannelExecutors;
import alerting.backend.domain.Alert;
import alerting.backend.domain.DeliveryKind;
import alerting.backend.dto.DispatchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Best-effort fan-out of one (alert, user) pair to every registered channel.
 * Each channel runs on its own bounded executor and all of them share one deadline.
 * A channel that fails, refuses or hangs is recorded as failed without touching the others;
 * timed-out calls are cancelled with an interrupt so their worker can be reused.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    private final List<NotificationChannel> channels;
    private final DeliveryLogService deliveryLog;
    private final ChannelExecutors channelExecutors;
    private final Duration channelTimeout;

    public NotificationDispatcher(List<NotificationChannel> channels,
                                  DeliveryLogService deliveryLog,
                                  ChannelExecutors channelExecutors,
                                  AlertingProperties properties) {
        this.channels = List.copyOf(channels);
        this.deliveryLog = deliveryLog;
        this.channelExecutors = channelExecutors;
        this.channelTimeout = properties.getDispatch().getChannelTimeout();
        log.info("notification channels registered: {}",
                this.channels.stream().map(NotificationChannel::name).toList());
    }

    public DispatchResult dispatch(Alert alert, String userId, DeliveryKind kind) {
        Map<NotificationChannel, Future<Boolean>> calls = new LinkedHashMap<>();
        for (NotificationChannel channel : channels) {
            calls.put(channel, submit(channel, alert, userId));
        }

        long deadline = System.nanoTime() + channelTimeout.toNanos();
        List<String> accepted = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (Map.Entry<NotificationChannel, Future<Boolean>> call : calls.entrySet()) {
            String channel = call.getKey().name();
            String error = null;
            boolean ok = false;
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                ok = Boolean.TRUE.equals(call.getValue().get(remaining, TimeUnit.NANOSECONDS));
                if (!ok) error = "channel refused delivery";
            } catch (TimeoutException e) {
                call.getValue().cancel(true);
                error = "timed out after " + channelTimeout;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                error = cause.getClass().getSimpleName() + ": " + cause.getMessage();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                error = "interrupted";
            }

            if (ok) {
                accepted.add(channel);
            } else {
                failed.add(channel);
                log.warn("delivery failed channel={}, alert={}, user={}, kind={}: {}",
                        channel, alert.getId(), userId, kind, error);
            }
            recordQuietly(alert.getId(), userId, channel, kind, ok, error);
        }
        return new DispatchResult(List.copyOf(accepted), List.copyOf(failed));
    }

    private Future<Boolean> submit(NotificationChannel channel, Alert alert, String userId) {
        try {
            return channelExecutors.forChannel(channel.name()).submit(() -> channel.deliver(alert, userId));
        } catch (RejectedExecutionException e) {
            // channel saturated, fail this attempt without waiting
            return CompletableFuture.failedFuture(e);
        }
    }

    private void recordQuietly(Long alertId, String userId, String channel, DeliveryKind kind,
                               boolean success, String error) {
        try {
            deliveryLog.record(alertId, userId, channel, kind, success, error);
        } catch (RuntimeException e) {
            log.error("could not record delivery attempt channel={}, alert={}, user={}",
                    channel, alertId, userId, e);
        }
    }
}
