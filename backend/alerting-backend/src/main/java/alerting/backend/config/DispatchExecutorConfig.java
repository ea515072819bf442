package alerting.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DispatchExecutorConfig {

    @Bean
    public ChannelExecutors channelExecutors(AlertingProperties properties) {
        return new ChannelExecutors(properties.getDispatch());
    }
}
