package dev.gazettemonitor.config;

import dev.gazettemonitor.service.WindowResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MonitorClientConfig {

    /**
     * All trigger dates are calendar days in São Paulo.
     */
    @Bean
    public Clock monitorClock() {
        return Clock.system(WindowResolver.ZONE);
    }
}
