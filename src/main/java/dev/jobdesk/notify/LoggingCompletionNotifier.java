package dev.jobdesk.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Writes completion notices to the log. Used when mail is not enabled.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "desk.notify.mail", havingValue = "false", matchIfMissing = true)
public class LoggingCompletionNotifier implements CompletionNotifier {

    public LoggingCompletionNotifier() {
        log.info("Completion mail disabled - notices go to the log");
    }

    @Override
    public Mono<Boolean> jobCompleted(CompletionNotice notice) {
        log.info("{} completed by {}, due by {}, drawings: {} ({} not completed), issued documents: {}",
                notice.jobNumber(), notice.closedBy(), notice.latestDueDate(), notice.drawingCount(),
                notice.incompleteDrawings(), notice.documentsFound());
        return Mono.just(true);
    }
}
