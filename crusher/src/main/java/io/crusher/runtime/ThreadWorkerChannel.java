package io.crusher.runtime;

import io.crusher.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * In-JVM worker: a single-threaded event loop running the pipeline.
 */
public class ThreadWorkerChannel implements WorkerChannel {
    private static final Logger log = LoggerFactory.getLogger(ThreadWorkerChannel.class);

    private final String name;
    private final PipelineExecutor executor;
    private final ExecutorService loop;
    private volatile Consumer<Reply> listener;
    private volatile boolean destroyed;

    public ThreadWorkerChannel(String name, PipelineExecutor executor) {
        this.name = name;
        this.executor = Objects.requireNonNull(executor);
        this.loop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    public static WorkerChannelFactory factory(PipelineExecutor executor) {
        return index -> new ThreadWorkerChannel("crusher-worker-" + index, executor);
    }

    @Override
    public String name() { return name; }

    @Override
    public void onReply(Consumer<Reply> listener) { this.listener = listener; }

    @Override
    public void transmit(Task task) {
        try {
            loop.execute(() -> executor.execute(task, loop).whenComplete((reply, failure) -> {
                if (failure != null) {
                    log.error("Worker {} lost task {}", name, task.id(), failure);
                    return;
                }
                deliver(reply);
            }));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Worker " + name + " is destroyed", e);
        }
    }

    private void deliver(Reply reply) {
        Consumer<Reply> l = listener;
        if (destroyed || l == null) {
            log.debug("Worker {} dropped reply for task {}", name, reply.task().id());
            return;
        }
        l.accept(reply);
    }

    @Override
    public void destroy() {
        destroyed = true;
        loop.shutdownNow();
    }

    @Override
    public String toString() { return name; }
}
