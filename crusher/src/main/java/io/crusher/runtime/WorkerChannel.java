package io.crusher.runtime;

import io.crusher.core.Task;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Message channel to one isolated worker. Tasks go in, replies come back asynchronously on a
 * thread owned by the channel.
 */
public interface WorkerChannel {
    String name();

    /** Registers the reply listener; called once before the first {@link #transmit}. */
    void onReply(Consumer<Reply> listener);

    /**
     * Registers a listener fired once, on the channel's thread, if the worker dies without being
     * destroyed. Channels whose workers cannot die on their own ignore it.
     */
    default void onLost(Runnable listener) {
    }

    /**
     * Hands the task to the worker without waiting for it to run. The worker owns the instance from
     * here on.
     */
    void transmit(Task task) throws IOException;

    /** Terminates the worker. Replies still in flight are not delivered. */
    void destroy();
}
