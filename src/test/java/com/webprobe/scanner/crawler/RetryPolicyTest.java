package com.webprobe.scanner.crawler;

import com.webprobe.scanner.support.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void backoffIsPowerOfTwoSeconds() {
        RetryPolicy policy = RetryPolicy.defaults();
        assertEquals(Duration.ofSeconds(1), policy.backoff(0));
        assertEquals(Duration.ofSeconds(2), policy.backoff(1));
        assertEquals(Duration.ofSeconds(4), policy.backoff(2));
        assertEquals(2, policy.getMaxRetries());
    }

    @Test
    void succeedsAfterTransientFailures() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        RetryPolicy policy = new RetryPolicy(2, sleeper);
        AtomicInteger calls = new AtomicInteger();
        List<Integer> retries = new ArrayList<>();

        String value = policy.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("connection reset");
            }
            return "ok";
        }, (attempt, pause, cause) -> retries.add(attempt));

        assertEquals("ok", value);
        assertEquals(3, calls.get());
        assertEquals(List.of(1, 2), retries);
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.getPauses());
    }

    @Test
    void rethrowsLastFailureWhenBudgetExhausted() {
        RecordingSleeper sleeper = new RecordingSleeper();
        RetryPolicy policy = new RetryPolicy(2, sleeper);
        AtomicInteger calls = new AtomicInteger();

        IOException error = assertThrows(IOException.class, () -> policy.execute(() -> {
            throw new IOException("refused " + calls.incrementAndGet());
        }));

        assertEquals("refused 3", error.getMessage());
        assertEquals(2, sleeper.getPauses().size());
    }

    @Test
    void zeroRetriesMeansSingleAttempt() {
        RecordingSleeper sleeper = new RecordingSleeper();
        RetryPolicy policy = new RetryPolicy(0, sleeper);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IOException.class, () -> policy.execute(() -> {
            calls.incrementAndGet();
            throw new IOException("down");
        }));
        assertEquals(1, calls.get());
        assertTrue(sleeper.getPauses().isEmpty());
    }

    @Test
    void negativeBudgetRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, Sleeper.SYSTEM));
    }
}
