package com.p14n.pgbus;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PublishRetryPolicyTest {

    private static TransientStoreException transientFailure() {
        return new TransientStoreException("down", "08006", null);
    }

    @Test
    void noneMakesASingleAttempt() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(TransientStoreException.class, () -> PublishRetryPolicy.none().execute(() -> {
            calls.incrementAndGet();
            throw transientFailure();
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void exponentialRetriesTransientFailures() {
        AtomicInteger calls = new AtomicInteger();
        var policy = PublishRetryPolicy.exponential(3, Duration.ofMillis(1), Duration.ofMillis(5));

        String result = policy.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw transientFailure();
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void exponentialGivesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        var policy = PublishRetryPolicy.exponential(2, Duration.ofMillis(1), Duration.ofMillis(5));

        assertThrows(TransientStoreException.class, () -> policy.execute(() -> {
            calls.incrementAndGet();
            throw transientFailure();
        }));
        assertEquals(2, calls.get());
    }

    @Test
    void otherFailuresAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        var policy = PublishRetryPolicy.exponential(5, Duration.ofMillis(1), Duration.ofMillis(5));

        assertThrows(EventBusException.class, () -> policy.execute(() -> {
            calls.incrementAndGet();
            throw new EventBusException("bad sql");
        }));
        assertEquals(1, calls.get());
    }
}
