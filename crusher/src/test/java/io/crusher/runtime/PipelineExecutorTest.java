package io.crusher.runtime;

import com.codahale.metrics.MetricRegistry;
import io.crusher.core.GzipSize;
import io.crusher.core.Task;
import io.crusher.error.CrushException;
import io.crusher.error.UnknownCrusherException;
import io.crusher.metrics.Metrics;
import io.crusher.registry.CrusherKind;
import io.crusher.registry.CrusherRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineExecutorTest {
    final MetricRegistry registry = new MetricRegistry();
    final ExecutorService loop = Executors.newSingleThreadExecutor(r -> new Thread(r, "loop-test"));

    @AfterEach
    void shutdown() { loop.shutdownNow(); }

    private Reply run(CrusherRegistry crushers, Task task) throws Exception {
        PipelineExecutor executor = new PipelineExecutor(crushers, new Metrics(registry));
        return executor.execute(task, loop).toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    @Test
    void applies_crushers_in_order_and_times_each() throws Exception {
        CrusherRegistry crushers = CrusherRegistry.builder()
                .register(CrusherKind.JSMIN, FakeCrusher.appending(CrusherKind.JSMIN, "1"))
                .register(CrusherKind.YUI, FakeCrusher.appending(CrusherKind.YUI, "2"))
                .build();
        Reply reply = run(crushers, Task.of("jsmin, yui", "js", "x"));
        assertNull(reply.error());
        assertEquals("x12", reply.task().content());
        assertEquals(List.of("jsmin", "yui"), List.copyOf(reply.task().individual().keySet()));
        assertEquals(1, registry.timer("crusher.jsmin.time").getCount());
        assertEquals(1, registry.timer("crusher.yui.time").getCount());
    }

    @Test
    void failed_step_restores_content_and_stops() throws Exception {
        AtomicBoolean closureCalled = new AtomicBoolean();
        CrusherRegistry crushers = CrusherRegistry.builder()
                .register(CrusherKind.JSMIN, FakeCrusher.appending(CrusherKind.JSMIN, "1"))
                .register(CrusherKind.YUI, FakeCrusher.failing(CrusherKind.YUI, new CrushException("boom")))
                .register(CrusherKind.CLOSURE, new FakeCrusher(CrusherKind.CLOSURE, c -> {
                    closureCalled.set(true);
                    return CompletableFuture.completedFuture(c);
                }))
                .build();
        Reply reply = run(crushers, Task.of("jsmin, yui, closure", "js", "x"));
        assertEquals("boom", reply.error().getMessage());
        assertEquals("x1", reply.task().content());
        assertEquals(List.of("jsmin", "yui"), List.copyOf(reply.task().individual().keySet()));
        assertFalse(closureCalled.get());
        assertEquals(1, registry.meter(Metrics.PIPELINE_ERRORS).getCount());
    }

    @Test
    void unknown_crusher_fails_without_timing_entry() throws Exception {
        CrusherRegistry crushers = CrusherRegistry.builder()
                .register(CrusherKind.JSMIN, FakeCrusher.appending(CrusherKind.JSMIN, "1"))
                .build();
        Reply reply = run(crushers, Task.of("jsmin, nonexistent", "js", "x"));
        assertInstanceOf(UnknownCrusherException.class, reply.error());
        assertTrue(reply.error().getMessage().contains("nonexistent"));
        assertEquals("x1", reply.task().content());
        assertEquals(List.of("jsmin"), List.copyOf(reply.task().individual().keySet()));
    }

    @Test
    void crusher_not_applicable_to_type_is_unknown() throws Exception {
        CrusherRegistry crushers = CrusherRegistry.builder()
                .register(CrusherKind.SQWISH, FakeCrusher.appending(CrusherKind.SQWISH, "1"))
                .build();
        Reply reply = run(crushers, Task.of("sqwish", "js", "x"));
        assertInstanceOf(UnknownCrusherException.class, reply.error());
        assertEquals("x", reply.task().content());
        assertTrue(reply.task().individual().isEmpty());
    }

    @Test
    void asynchronous_failure_is_wrapped_and_continues_on_loop() throws Exception {
        AtomicReference<String> thread = new AtomicReference<>();
        CrusherRegistry crushers = CrusherRegistry.builder()
                .register(CrusherKind.JSMIN, new FakeCrusher(CrusherKind.JSMIN, c -> CompletableFuture.supplyAsync(() -> c + "1")))
                .register(CrusherKind.YUI, new FakeCrusher(CrusherKind.YUI, c -> {
                    thread.set(Thread.currentThread().getName());
                    return CompletableFuture.supplyAsync(() -> { throw new IllegalStateException("late"); });
                }))
                .build();
        Reply reply = run(crushers, Task.of("jsmin, yui", "js", "x"));
        assertEquals("loop-test", thread.get());
        assertEquals("Crusher yui failed: late", reply.error().getMessage());
        assertEquals("x1", reply.task().content());
    }

    @Test
    void null_result_is_a_failure() throws Exception {
        CrusherRegistry crushers = CrusherRegistry.builder()
                .register(CrusherKind.JSMIN, new FakeCrusher(CrusherKind.JSMIN, c -> CompletableFuture.completedFuture(null)))
                .build();
        Reply reply = run(crushers, Task.of("jsmin", "js", "x"));
        assertNotNull(reply.error());
        assertEquals("x", reply.task().content());
    }

    @Test
    void duration_covers_every_step() throws Exception {
        CrusherRegistry crushers = CrusherRegistry.builder()
                .register(CrusherKind.JSMIN, new FakeCrusher(CrusherKind.JSMIN, c -> CompletableFuture.supplyAsync(
                        () -> c, CompletableFuture.delayedExecutor(20, TimeUnit.MILLISECONDS))))
                .register(CrusherKind.YUI, new FakeCrusher(CrusherKind.YUI, c -> CompletableFuture.supplyAsync(
                        () -> c, CompletableFuture.delayedExecutor(20, TimeUnit.MILLISECONDS))))
                .build();
        Reply reply = run(crushers, Task.of("jsmin, yui", "js", "x"));
        long sum = reply.task().individual().values().stream().mapToLong(Long::longValue).sum();
        assertTrue(reply.task().individual().get("jsmin") >= 20);
        assertTrue(reply.task().duration() >= sum, "duration " + reply.task().duration() + " < " + sum);
    }

    @Test
    void repeated_crusher_accumulates_under_one_entry() throws Exception {
        CrusherRegistry crushers = CrusherRegistry.builder()
                .register(CrusherKind.JSMIN, FakeCrusher.appending(CrusherKind.JSMIN, "1"))
                .build();
        Reply reply = run(crushers, Task.of("jsmin, jsmin", "js", "x"));
        assertEquals("x11", reply.task().content());
        assertEquals(1, reply.task().individual().size());
        assertEquals(2, registry.timer("crusher.jsmin.time").getCount());
    }

    @Test
    void measures_gzip_only_when_requested() throws Exception {
        CrusherRegistry crushers = CrusherRegistry.builder()
                .register(CrusherKind.JSMIN, FakeCrusher.appending(CrusherKind.JSMIN, "!"))
                .build();
        Reply measured = run(crushers, Task.of("jsmin", "js", "var a = 1;".repeat(50), true));
        assertNull(measured.error());
        assertEquals(Long.valueOf(GzipSize.of(measured.task().content())), measured.task().gzipSize());

        Reply plain = run(crushers, Task.of("jsmin", "js", "var a = 1;"));
        assertNull(plain.task().gzipSize());
    }

    @Test
    void failed_pipeline_skips_gzip() throws Exception {
        CrusherRegistry crushers = CrusherRegistry.builder()
                .register(CrusherKind.JSMIN, FakeCrusher.failing(CrusherKind.JSMIN, new CrushException("nope")))
                .build();
        Reply reply = run(crushers, Task.of("jsmin", "js", "x", true));
        assertNotNull(reply.error());
        assertNull(reply.task().gzipSize());
    }
}
