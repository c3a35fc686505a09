package dev.jobdesk;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Ends the process once the runner is done. Kept behind a bean so tests can
 * switch it off.
 */
@Slf4j
@Component
public class ExitManager {

    @Value("${desk.exit-on-finish:true}")
    private boolean exitOnFinish;

    public void exit(int status) {
        if (exitOnFinish) {
            System.exit(status);
        }
        log.debug("Exit {} suppressed", status);
    }
}
