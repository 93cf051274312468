package io.crusher.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.crusher.core.ContentType;
import io.crusher.core.Crusher;
import io.crusher.core.GzipSize;
import io.crusher.core.Task;
import io.crusher.error.CrushException;
import io.crusher.error.UnknownCrusherException;
import io.crusher.metrics.Metrics;
import io.crusher.registry.CrusherRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Folds a task's content through its crushers left to right. The fold stops at the first failure
 * and leaves the content as it was before the failing step; timings of every attempted step are
 * kept either way.
 */
public class PipelineExecutor {
    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final CrusherRegistry registry;
    private final Metrics metrics;
    private final Meter errorMeter;

    public PipelineExecutor(CrusherRegistry registry, Metrics metrics) {
        this.registry = Objects.requireNonNull(registry);
        this.metrics = Objects.requireNonNull(metrics);
        this.errorMeter = metrics.meter(Metrics.PIPELINE_ERRORS);
    }

    /**
     * Runs the pipeline. Continuations after asynchronous steps run on {@code loop}, so a worker
     * that passes its own single thread keeps every mutation of the task on that thread.
     */
    public CompletionStage<Reply> execute(Task task, Executor loop) {
        CompletableFuture<Reply> done = new CompletableFuture<>();
        long started = System.nanoTime();
        ContentType type = ContentType.fromTag(task.extension()).orElse(null);
        step(task, type, 0, loop, started, done);
        return done;
    }

    private void step(Task task, ContentType type, int index, Executor loop, long started, CompletableFuture<Reply> done) {
        if (index >= task.engines().size()) {
            finish(task, null, started, done);
            return;
        }
        String engine = task.engines().get(index);
        Optional<Crusher> crusher = registry.lookup(engine, type);
        if (crusher.isEmpty()) {
            finish(task, new UnknownCrusherException(engine, task.extension()), started, done);
            return;
        }

        String backup = task.content();
        long stepStarted = System.nanoTime();
        Timer.Context timer = metrics.crusherTimer(engine).time();
        CompletionStage<String> result;
        try {
            result = crusher.get().crush(type, backup);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        result.whenCompleteAsync((content, failure) -> {
            timer.stop();
            task.recordIndividual(engine, millisSince(stepStarted));
            if (failure == null && content == null) {
                failure = new CrushException("Crusher " + engine + " returned no content");
            }
            if (failure != null) {
                task.content(backup);
                finish(task, CrushException.of(engine, failure), started, done);
                return;
            }
            task.content(content);
            step(task, type, index + 1, loop, started, done);
        }, loop);
    }

    private void finish(Task task, CrushException error, long started, CompletableFuture<Reply> done) {
        task.duration(millisSince(started));
        if (error != null) {
            errorMeter.mark();
            log.debug("Task {} failed after {}ms: {}", task.id(), task.duration(), error.getMessage());
            done.complete(new Reply(error, task));
            return;
        }
        if (task.gzip()) {
            try {
                task.gzipSize(GzipSize.of(task.content()));
            } catch (IOException e) {
                errorMeter.mark();
                done.complete(new Reply(new CrushException("Unable to measure gzip size: " + e.getMessage(), e), task));
                return;
            }
        }
        log.debug("Task {} crushed in {}ms {}", task.id(), task.duration(), task.individual());
        done.complete(Reply.ok(task));
    }

    private static long millisSince(long nanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - nanos);
    }
}
