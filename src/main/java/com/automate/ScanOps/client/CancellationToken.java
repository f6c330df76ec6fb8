package com.automate.ScanOps.client;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Cooperative cancellation signal shared by the caller and an in-flight execution.
 * Cancelling is idempotent; late subscribers still see the signal.
 */
public class CancellationToken {

    private final Sinks.One<Boolean> signal = Sinks.one();
    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
        signal.tryEmitValue(Boolean.TRUE);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Mono<Boolean> whenCancelled() {
        return signal.asMono();
    }

    /** A token nobody will ever cancel. */
    public static CancellationToken none() {
        return new CancellationToken();
    }
}
