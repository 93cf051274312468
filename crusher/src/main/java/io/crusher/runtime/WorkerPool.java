package io.crusher.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import io.crusher.core.Task;
import io.crusher.error.CorrelationException;
import io.crusher.error.CrushException;
import io.crusher.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Owns the workers, hands out tasks by rotation and routes replies back to their callbacks by task
 * id.
 *
 * <p>Every mutation of the rotation list and of the worker queues happens on a single control
 * thread, so {@link #send} and {@link #kill} are serialized with each other and with reply
 * correlation. Callbacks also run on that thread.
 *
 * <p>Assignment is pure rotation: the worker at the tail of the list gets the task and moves to the
 * head. A worker may receive another task before answering the previous one.
 *
 * <p>A worker that dies on its own is replaced, and each of its unanswered tasks is failed back to
 * its callback.
 */
public class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final WorkerChannelFactory factory;
    private final int defaultWorkers;
    private final Consumer<CorrelationException> correlationFailureHandler;
    private final ExecutorService control;
    private final Deque<WorkerHandle> workers = new ArrayDeque<>();
    private volatile boolean ready;
    private int spawned;

    private final Meter dispatchMeter;
    private final Meter replyMeter;
    private final Counter inflight;
    private final Counter correlationFailures;
    private final Counter killed;
    private final Counter lost;

    WorkerPool(WorkerChannelFactory factory, int defaultWorkers, Metrics metrics,
               Consumer<CorrelationException> correlationFailureHandler) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.defaultWorkers = Math.max(1, defaultWorkers);
        this.correlationFailureHandler = correlationFailureHandler;
        this.control = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "crusher-control");
            t.setDaemon(true);
            return t;
        });
        this.dispatchMeter = metrics.meter(Metrics.POOL_DISPATCH);
        this.replyMeter = metrics.meter(Metrics.POOL_REPLY);
        this.inflight = metrics.counter(Metrics.POOL_INFLIGHT);
        this.correlationFailures = metrics.counter(Metrics.POOL_CORRELATION_FAILURES);
        this.killed = metrics.counter(Metrics.POOL_WORKERS_KILLED);
        this.lost = metrics.counter(Metrics.POOL_WORKERS_LOST);
    }

    public boolean isReady() { return ready; }

    public void initialize() { initialize(defaultWorkers); }

    /**
     * Spawns {@code count} workers with empty queues and marks the pool ready. Does nothing when the
     * pool is already ready.
     */
    public void initialize(int count) {
        if (ready) return;
        try {
            CompletableFuture.runAsync(() -> start(count), control).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Unable to initialize worker pool", e.getCause());
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Worker pool is closed", e);
        }
    }

    /**
     * Queues the task for the next worker in rotation and returns immediately, starting the default
     * number of workers first if the pool is not ready. A task without an id gets a random one. The
     * callback receives {@code (error, task)} once the worker replies.
     */
    public void send(Task task, TaskCallback callback) {
        Objects.requireNonNull(task, "task");
        if (task.id() == null || task.id().isBlank()) task.id(UUID.randomUUID().toString());
        Task message = task.copy();
        TaskCallback cb = callback == null ? TaskCallback.noop() : callback;
        try {
            control.execute(() -> dispatch(message, cb));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Worker pool is closed", e);
        }
    }

    /** Kills every worker. The next {@link #send} or {@link #initialize} starts a fresh set. */
    public CompletableFuture<Void> kill() {
        return kill(null);
    }

    /**
     * Removes the given workers from rotation and terminates them. Callbacks of their unanswered
     * tasks are never invoked.
     */
    public CompletableFuture<Void> kill(Collection<WorkerHandle> targets) {
        return CompletableFuture.runAsync(() -> {
            List<WorkerHandle> victims = new ArrayList<>(targets == null ? workers : targets);
            for (WorkerHandle worker : victims) abandon(worker);
            if (workers.isEmpty()) ready = false;
        }, control);
    }

    /** Workers in rotation order, head first; the last one receives the next task. */
    public List<WorkerHandle> workers() {
        return CompletableFuture.supplyAsync(() -> List.copyOf(workers), control).join();
    }

    /** Unanswered tasks across all live workers. */
    public int pending() {
        return CompletableFuture.supplyAsync(() -> workers.stream().mapToInt(WorkerHandle::queued).sum(), control).join();
    }

    private void start(int count) {
        if (ready) return;
        int n = Math.max(1, count);
        List<WorkerHandle> started = new ArrayList<>(n);
        try {
            for (int i = 0; i < n; i++) started.add(spawn());
        } catch (RuntimeException e) {
            for (WorkerHandle worker : started) terminate(worker);
            throw e;
        }
        workers.addAll(started);
        ready = true;
        log.info("Worker pool ready with {} workers", workers.size());
    }

    private WorkerHandle spawn() {
        WorkerChannel channel;
        try {
            channel = factory.create(spawned++);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        WorkerHandle worker = new WorkerHandle(channel);
        channel.onReply(reply -> {
            try {
                control.execute(() -> correlate(worker, reply));
            } catch (RejectedExecutionException e) {
                log.debug("Pool closed, dropping reply from {}", worker.name());
            }
        });
        channel.onLost(() -> {
            try {
                control.execute(() -> workerLost(worker));
            } catch (RejectedExecutionException e) {
                log.debug("Pool closed, ignoring loss of {}", worker.name());
            }
        });
        log.debug("Spawned worker {}", worker.name());
        return worker;
    }

    private void dispatch(Task task, TaskCallback callback) {
        if (!ready) {
            try {
                start(defaultWorkers);
            } catch (RuntimeException e) {
                log.error("Unable to start workers for task {}", task.id(), e);
                invoke(callback, new CrushException("Unable to start workers: " + e.getMessage(), e), task);
                return;
            }
        }
        WorkerHandle worker = workers.pollLast();
        if (worker == null) {
            invoke(callback, new CrushException("No workers available"), task);
            return;
        }
        try {
            if (worker.pending(task.id())) {
                invoke(callback, new CrushException("Task " + task.id() + " is already in flight on " + worker.name()), task);
                return;
            }
            worker.register(task, callback);
            inflight.inc();
            dispatchMeter.mark();
            try {
                worker.channel().transmit(task.copy());
            } catch (IOException | RuntimeException e) {
                worker.remove(task.id());
                inflight.dec();
                log.warn("Unable to transmit task {} to {}", task.id(), worker.name(), e);
                invoke(callback, new CrushException("Unable to transmit task to " + worker.name() + ": " + e.getMessage(), e), task);
            }
        } finally {
            workers.addFirst(worker);
        }
    }

    private void correlate(WorkerHandle worker, Reply reply) {
        if (!worker.alive()) {
            log.debug("Ignoring reply from terminated worker {}", worker.name());
            return;
        }
        String id = reply.task() == null ? null : reply.task().id();
        TaskCallback callback = id == null ? null : worker.remove(id);
        if (callback == null) {
            correlationFailure(worker, id, reply);
            return;
        }
        inflight.dec();
        replyMeter.mark();
        invoke(callback, reply.error(), reply.task());
    }

    private void correlationFailure(WorkerHandle worker, String id, Reply reply) {
        CorrelationException failure = new CorrelationException(worker.name(), id);
        correlationFailures.inc();
        log.error("{}; error={}, task={}", failure.getMessage(),
                reply.error() == null ? null : reply.error().getMessage(), reply.task());
        abandon(worker);
        replace(worker);
        if (correlationFailureHandler != null) correlationFailureHandler.accept(failure);
    }

    private void workerLost(WorkerHandle worker) {
        if (!worker.alive()) return;
        lost.inc();
        List<WorkerHandle.Pending> stranded = terminate(worker);
        log.error("Worker {} died with {} unanswered tasks", worker.name(), stranded.size());
        replace(worker);
        for (WorkerHandle.Pending p : stranded) {
            invoke(p.callback(), new CrushException("Worker " + worker.name() + " exited before answering task "
                    + p.task().id()), p.task());
        }
    }

    private void replace(WorkerHandle worker) {
        try {
            WorkerHandle replacement = spawn();
            workers.addFirst(replacement);
            log.warn("Replaced worker {} with {}", worker.name(), replacement.name());
        } catch (UncheckedIOException e) {
            log.error("Unable to replace worker {}", worker.name(), e);
            if (workers.isEmpty()) ready = false;
        }
    }

    /** Terminates the worker without ever invoking the callbacks of its unanswered tasks. */
    private void abandon(WorkerHandle worker) {
        List<WorkerHandle.Pending> dropped = terminate(worker);
        if (!dropped.isEmpty()) {
            log.warn("Worker {} terminated with {} unanswered tasks; their callbacks will not be invoked",
                    worker.name(), dropped.size());
        }
    }

    private List<WorkerHandle.Pending> terminate(WorkerHandle worker) {
        if (!worker.alive()) return List.of();
        workers.remove(worker);
        List<WorkerHandle.Pending> stranded = worker.drain();
        if (!stranded.isEmpty()) inflight.dec(stranded.size());
        killed.inc();
        worker.channel().destroy();
        log.info("Worker {} terminated", worker.name());
        return stranded;
    }

    private static void invoke(TaskCallback callback, CrushException error, Task task) {
        try {
            callback.onReply(error, task);
        } catch (RuntimeException e) {
            log.error("Callback for task {} threw", task == null ? null : task.id(), e);
        }
    }

    @Override
    public void close() {
        if (!control.isShutdown()) {
            kill().join();
            control.shutdown();
        }
    }
}
