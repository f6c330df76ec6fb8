package com.automate.ScanOps.Service;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single admission token for smart scans. Only the session that holds it may be RUNNING.
 */
@Component
public class ScanAdmissionGate {

    private final AtomicReference<UUID> holder = new AtomicReference<>();

    /** @return true if the token was free and is now held by {@code sessionId} */
    public boolean tryAcquire(UUID sessionId) {
        return holder.compareAndSet(null, sessionId);
    }

    /** Releasing a token held by another session is a no-op. */
    public boolean release(UUID sessionId) {
        return holder.compareAndSet(sessionId, null);
    }

    public Optional<UUID> holder() {
        return Optional.ofNullable(holder.get());
    }
}
