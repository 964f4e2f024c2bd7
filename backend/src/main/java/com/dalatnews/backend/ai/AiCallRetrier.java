package com.dalatnews.backend.ai;

import java.util.List;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded exponential retry for calls to the text-generation service. Only rate-limit,
 * overload and server errors are retried.
 */
@Slf4j
public final class AiCallRetrier {

    private static final List<String> TRANSIENT_MARKERS =
            List.of("rate_limit", "429", "overloaded", "500", "503", "529");

    private AiCallRetrier() {
    }

    /**
     * Run {@code call} up to {@code maxAttempts} times, waiting {@code baseDelayMs * 2^attempt}
     * between transient failures.
     *
     * @throws RuntimeException the last failure, once it is permanent or attempts run out
     */
    public static <T> T execute(String operation, int maxAttempts, long baseDelayMs, Supplier<T> call) {
        int attempts = Math.max(1, maxAttempts);
        RuntimeException lastError = null;

        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                lastError = e;
                if (!isTransient(e) || attempt == attempts - 1) {
                    break;
                }
                long delay = baseDelayMs * (1L << attempt);
                log.warn("{}: retry {}/{} after {}ms: {}", operation, attempt + 1, attempts, delay, e.getMessage());
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new AiResponseException(operation + " interrupted during retry backoff", e);
                }
            }
        }
        throw lastError;
    }

    /**
     * Whether the error, or any of its causes, reads like a rate limit or server-side failure.
     * A malformed reply is never transient.
     */
    public static boolean isTransient(Throwable error) {
        if (error instanceof AiResponseException) {
            return false;
        }
        Throwable current = error;
        while (current != null) {
            String message = current.getMessage();
            if (message != null) {
                for (String marker : TRANSIENT_MARKERS) {
                    if (message.contains(marker)) {
                        return true;
                    }
                }
            }
            if (current.getCause() == current) break;
            current = current.getCause();
        }
        return false;
    }
}
