package io.crusher.budget;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Spaces outbound requests to at most {@code permitsPerSecond} without parking the caller: each
 * grant is a stage that completes once its slot arrives.
 */
public class RequestThrottle {
    private final long intervalNanos;
    private final AtomicLong nextSlotNanos = new AtomicLong(Long.MIN_VALUE);

    public RequestThrottle(long permitsPerSecond) {
        this.intervalNanos = permitsPerSecond <= 0 ? 0 : TimeUnit.SECONDS.toNanos(1) / permitsPerSecond;
    }

    public static RequestThrottle unlimited() { return new RequestThrottle(0); }

    public boolean limited() { return intervalNanos > 0; }

    public CompletionStage<Void> acquire() {
        if (intervalNanos == 0) return CompletableFuture.completedFuture(null);
        long now = System.nanoTime();
        long slot = nextSlotNanos.getAndUpdate(prev -> Math.max(prev == Long.MIN_VALUE ? now : prev, now) + intervalNanos);
        long start = slot == Long.MIN_VALUE ? now : Math.max(slot, now);
        long delay = start - now;
        if (delay <= 0) return CompletableFuture.completedFuture(null);
        return CompletableFuture.runAsync(() -> { }, CompletableFuture.delayedExecutor(delay, TimeUnit.NANOSECONDS));
    }
}
