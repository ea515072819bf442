package alerting.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One bounded pool per channel. A channel that hangs can only exhaust its own threads and queue;
 * once both are full its calls are rejected immediately instead of starving the other channels.
 */
@Slf4j
public class ChannelExecutors implements DisposableBean {

    private final AlertingProperties.Dispatch settings;
    private final Map<String, ThreadPoolTaskExecutor> executors = new ConcurrentHashMap<>();

    public ChannelExecutors(AlertingProperties.Dispatch settings) {
        this.settings = settings;
    }

    public ThreadPoolTaskExecutor forChannel(String channel) {
        return executors.computeIfAbsent(channel, this::create);
    }

    private ThreadPoolTaskExecutor create(String channel) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int size = Math.max(1, settings.getPoolSize());
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(Math.max(0, settings.getQueueCapacity()));
        executor.setThreadNamePrefix("channel-" + channel + "-");
        // hung deliveries are interrupted on shutdown rather than awaited
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        log.debug("channel executor created channel={}, threads={}, queue={}",
                channel, size, settings.getQueueCapacity());
        return executor;
    }

    @Override
    public void destroy() {
        executors.values().forEach(ThreadPoolTaskExecutor::shutdown);
        executors.clear();
    }
}
