package dev.gazettemonitor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class GazetteMonitorApplication implements CommandLineRunner {

    private final OperatorRunner operatorRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(GazetteMonitorApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            operatorRunner.execute();
            exitManager.exit(0);
        } catch (Exception e) {
            log.error("Gazette monitor failed: {}", e.getMessage(), e);
            exitManager.exit(1);
        }
    }
}
