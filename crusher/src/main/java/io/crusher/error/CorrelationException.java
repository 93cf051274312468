package io.crusher.error;

/**
 * A worker replied with a task id that has no pending callback. The worker's state can no longer
 * be reasoned about; the pool treats this as fatal to that worker.
 */
public class CorrelationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String worker;
    private final String taskId;

    public CorrelationException(String worker, String taskId) {
        super("Unable to process message from worker " + worker + ", can't locate the callback for task " + taskId);
        this.worker = worker;
        this.taskId = taskId;
    }

    public String worker() { return worker; }
    public String taskId() { return taskId; }
}
