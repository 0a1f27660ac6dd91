package com.myla.providers;

import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exponential-backoff retry for model calls. Client errors other than 408/429 are not retried;
 * a rate-limit response waits at least as long as its Retry-After hint.
 */
public class RetryPolicy {

    private static final long MAX_BACKOFF_MS = 10_000;
    private static final long RETRY_AFTER_CAP_MS = 30_000;
    private static final Pattern STATUS_CODE = Pattern.compile("\\b(\\d{3})\\b");
    private static final Pattern RETRY_AFTER = Pattern.compile("(?i)retry[_-]after[:\\s]+([\\d.]+)");

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxRetries;
    private final long baseDelayMs;
    private final Sleeper sleeper;

    public RetryPolicy(int maxRetries, long baseDelayMs) {
        this(maxRetries, baseDelayMs, Thread::sleep);
    }

    RetryPolicy(int maxRetries, long baseDelayMs, Sleeper sleeper) {
        this.maxRetries = Math.max(0, maxRetries);
        this.baseDelayMs = Math.max(1, baseDelayMs);
        this.sleeper = sleeper;
    }

    public <T> T execute(Supplier<T> action) {
        RuntimeException last = null;
        long delay = baseDelayMs;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                last = e;
                if (isNonRetryable(e)) break;
                if (attempt < maxRetries) {
                    long wait = isRateLimited(e) ? Math.max(delay, parseRetryAfterMs(e)) : delay;
                    sleep(wait);
                    delay = Math.min(delay * 2, MAX_BACKOFF_MS);
                }
            }
        }
        throw new ModelException("All retries exhausted: " + last.getMessage(), last);
    }

    static boolean isNonRetryable(Exception e) {
        int code = extractStatusCode(e);
        return code >= 400 && code < 500 && code != 429 && code != 408;
    }

    static boolean isRateLimited(Exception e) {
        return extractStatusCode(e) == 429;
    }

    static long parseRetryAfterMs(Exception e) {
        if (e.getMessage() == null) return 0;
        Matcher m = RETRY_AFTER.matcher(e.getMessage());
        if (m.find()) {
            try {
                double secs = Double.parseDouble(m.group(1));
                if (Double.isFinite(secs) && secs >= 0) {
                    return Math.min((long) (secs * 1000), RETRY_AFTER_CAP_MS);
                }
            } catch (NumberFormatException nfe) {
                return 0;
            }
        }
        return 0;
    }

    private static int extractStatusCode(Exception e) {
        if (e.getMessage() == null) return 0;
        Matcher m = STATUS_CODE.matcher(e.getMessage());
        while (m.find()) {
            int code = Integer.parseInt(m.group(1));
            if (code >= 100 && code < 600) return code;
        }
        return 0;
    }

    private void sleep(long ms) {
        try {
            sleeper.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ModelException("Interrupted during retry", ie);
        }
    }
}
