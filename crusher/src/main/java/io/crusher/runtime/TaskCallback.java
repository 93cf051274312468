package io.crusher.runtime;

import io.crusher.core.Task;
import io.crusher.error.CrushException;

/**
 * Receives the outcome of a dispatched task. Invoked at most once, on the pool's control thread.
 */
@FunctionalInterface
public interface TaskCallback {
    void onReply(CrushException error, Task task);

    static TaskCallback noop() { return (error, task) -> { }; }
}
