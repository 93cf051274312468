package io.crusher.budget;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RequestThrottleTest {
    @Test
    void acquires_with_spacing() throws Exception {
        RequestThrottle throttle = new RequestThrottle(10); // 100ms per permit
        throttle.acquire().toCompletableFuture().get();
        long t1 = System.nanoTime();
        throttle.acquire().toCompletableFuture().get();
        long t2 = System.nanoTime();
        long dt = (t2 - t1) / 1_000_000;
        assertTrue(dt >= 60, "expected spacing >= 60ms but was " + dt + "ms");
    }

    @Test
    void unlimited_never_waits() {
        RequestThrottle throttle = RequestThrottle.unlimited();
        assertFalse(throttle.limited());
        for (int i = 0; i < 100; i++) {
            assertTrue(throttle.acquire().toCompletableFuture().isDone());
        }
    }
}
