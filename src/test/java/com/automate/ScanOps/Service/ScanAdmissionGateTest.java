package com.automate.ScanOps.Service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ScanAdmissionGateTest {

    @Test
    void secondSessionIsRejectedWhileTokenHeld() {
        ScanAdmissionGate gate = new ScanAdmissionGate();
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();

        assertTrue(gate.tryAcquire(a));
        assertFalse(gate.tryAcquire(b));
        assertFalse(gate.tryAcquire(a));
        assertEquals(Optional.of(a), gate.holder());
    }

    @Test
    void releaseOnlyByHolder() {
        ScanAdmissionGate gate = new ScanAdmissionGate();
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        gate.tryAcquire(a);

        assertFalse(gate.release(b));
        assertTrue(gate.release(a));
        assertTrue(gate.holder().isEmpty());
        assertTrue(gate.tryAcquire(b));
    }

    @Test
    void exactlyOneConcurrentAcquireWins() throws Exception {
        ScanAdmissionGate gate = new ScanAdmissionGate();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> attempts = new ArrayList<>();
        try {
            for (int i = 0; i < 16; i++) {
                UUID id = UUID.randomUUID();
                attempts.add(pool.submit(() -> {
                    go.await();
                    return gate.tryAcquire(id);
                }));
            }
            go.countDown();
            int winners = 0;
            for (Future<Boolean> f : attempts) {
                if (f.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
    }
}
