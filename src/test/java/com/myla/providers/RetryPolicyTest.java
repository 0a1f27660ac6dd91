package com.myla.providers;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final ArrayList<Long> sleeps = new ArrayList<>();
    private final RetryPolicy policy = new RetryPolicy(2, 100, sleeps::add);

    @Test
    void retriesTransientFailuresWithBackoff() {
        var calls = new AtomicInteger();

        var result = policy.execute(() -> {
            if (calls.incrementAndGet() < 3) throw new ModelException("LLM API error 503: overloaded");
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(2, sleeps.size());
        assertEquals(100L, sleeps.get(0));
        assertEquals(200L, sleeps.get(1));
    }

    @Test
    void clientErrorsAreNotRetried() {
        var calls = new AtomicInteger();

        var e = assertThrows(ModelException.class, () -> policy.execute(() -> {
            calls.incrementAndGet();
            throw new ModelException("Anthropic API error 401: invalid x-api-key");
        }));

        assertEquals(1, calls.get());
        assertTrue(e.getMessage().startsWith("All retries exhausted"));
    }

    @Test
    void rateLimitHonoursRetryAfter() {
        var calls = new AtomicInteger();

        policy.execute(() -> {
            if (calls.incrementAndGet() == 1) throw new ModelException("API error 429: retry-after: 2");
            return "ok";
        });

        assertEquals(2000L, sleeps.get(0));
    }
}
