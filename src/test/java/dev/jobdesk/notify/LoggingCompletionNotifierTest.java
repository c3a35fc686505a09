package dev.jobdesk.notify;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class LoggingCompletionNotifierTest {

    @Test
    void reportsNoticeAsDelivered() {
        LoggingCompletionNotifier notifier = new LoggingCompletionNotifier();

        StepVerifier.create(notifier.jobCompleted(new CompletionNotice("105000", "bkelly", "not found", 0, 0, 0, 0)))
                .expectNext(true)
                .verifyComplete();
    }
}
