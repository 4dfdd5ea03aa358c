package dev.gazettemonitor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Connection settings for the search backend and the identity server.
 * Loaded from application.yml under 'monitor.api' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "monitor.api")
public class ApiConfig {

    private String baseUrl = "http://localhost:5000";

    private String identityBaseUrl = "http://localhost:5000";

    private int requestTimeoutSeconds = 30;

    private int maxInMemoryBytes = 10 * 1024 * 1024;
}
