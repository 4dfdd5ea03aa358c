package dev.gazettemonitor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Ends the process once the operator run is over.
 * Kept out of the application class so tests can replace it.
 */
@Slf4j
@Component
public class ExitManager {

    @Value("${monitor.exit-on-completion:true}")
    private boolean exitOnCompletion = true;

    public void exit(int status) {
        if (!exitOnCompletion || runningUnderTests()) {
            log.debug("Exit with status {} suppressed", status);
            return;
        }
        log.info("Gazette monitor exiting with status {}", status);
        System.exit(status);
    }

    protected boolean runningUnderTests() {
        String cp = System.getProperty("java.class.path", "");
        return cp.contains("junit") || cp.contains("surefire");
    }
}
