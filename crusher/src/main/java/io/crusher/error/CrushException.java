package io.crusher.error;

/**
 * Error carried back to the caller on a task reply. Never thrown across the pool boundary; the
 * pool hands it to the task callback instead.
 */
public class CrushException extends Exception {
    private static final long serialVersionUID = 1L;

    public CrushException(String message) {
        super(message);
    }

    public CrushException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Wraps a failure raised by a crusher, unwrapping completion wrappers. */
    public static CrushException of(String engine, Throwable failure) {
        Throwable t = failure;
        while ((t instanceof java.util.concurrent.CompletionException
                || t instanceof java.util.concurrent.ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof CrushException ce) return ce;
        String msg = t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
        return new CrushException("Crusher " + engine + " failed: " + msg, t);
    }
}
