package dev.gazettemonitor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the unattended operator run.
 * Loaded from application.yml under 'monitor.operator' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "monitor.operator")
public class OperatorConfig {

    private String username;
    private String password;

    /**
     * Terms for a manual search run at startup. Empty disables the search.
     */
    private List<String> searchTerms = new ArrayList<>();

    private String searchEmail;

    /**
     * Days before today covered by the startup search.
     */
    private int searchLookbackDays = 0;

    private String activityLogPath;

    public boolean hasCredentials() {
        return username != null && !username.isBlank() && password != null && !password.isEmpty();
    }
}
