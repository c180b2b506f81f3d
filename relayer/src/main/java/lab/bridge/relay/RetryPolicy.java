package lab.bridge.relay;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Bounded retry for tracker contract calls. The bound is a number of attempts; {@code backoff} only
 * spaces them out.
 */
public record RetryPolicy(int maxAttempts, Duration backoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be zero or positive");
        }
    }

    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO);
    }

    Executor nextAttemptExecutor() {
        if (backoff.isZero()) {
            return Runnable::run;
        }
        return CompletableFuture.delayedExecutor(backoff.toMillis(), TimeUnit.MILLISECONDS);
    }
}
