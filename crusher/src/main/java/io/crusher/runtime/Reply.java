package io.crusher.runtime;

import io.crusher.core.Task;
import io.crusher.error.CrushException;

/**
 * What a worker sends back for one task: the enriched task and, when the pipeline failed, the
 * error.
 */
public record Reply(CrushException error, Task task) {
    public static Reply ok(Task task) { return new Reply(null, task); }

    public boolean failed() { return error != null; }
}
