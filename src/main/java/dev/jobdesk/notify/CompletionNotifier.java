package dev.jobdesk.notify;

import reactor.core.publisher.Mono;

/**
 * Channel for job completion confirmations.
 */
public interface CompletionNotifier {

    /**
     * @return Mono emitting whether the notice was delivered
     */
    Mono<Boolean> jobCompleted(CompletionNotice notice);
}
