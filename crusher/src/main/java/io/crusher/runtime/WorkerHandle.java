package io.crusher.runtime;

import io.crusher.core.Task;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A worker channel plus the tasks it has not answered yet, each with its callback. Only the pool's
 * control thread reads or writes the queue.
 */
public final class WorkerHandle {
    private final WorkerChannel channel;
    private final Map<String, Pending> queue = new HashMap<>();
    private boolean alive = true;

    WorkerHandle(WorkerChannel channel) {
        this.channel = channel;
    }

    public String name() { return channel.name(); }

    WorkerChannel channel() { return channel; }

    boolean alive() { return alive; }

    boolean pending(String taskId) { return queue.containsKey(taskId); }

    void register(Task task, TaskCallback callback) { queue.put(task.id(), new Pending(task, callback)); }

    TaskCallback remove(String taskId) {
        Pending pending = queue.remove(taskId);
        return pending == null ? null : pending.callback();
    }

    /** Marks the worker dead and hands back its unanswered tasks in no particular order. */
    List<Pending> drain() {
        alive = false;
        List<Pending> stranded = new ArrayList<>(queue.values());
        queue.clear();
        return stranded;
    }

    int queued() { return queue.size(); }

    record Pending(Task task, TaskCallback callback) {
    }

    @Override
    public String toString() { return "WorkerHandle{" + name() + ", queued=" + queue.size() + '}'; }
}
