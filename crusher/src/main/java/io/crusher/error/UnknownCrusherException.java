package io.crusher.error;

/** Requested crusher is not registered for the task's content type. */
public class UnknownCrusherException extends CrushException {
    private static final long serialVersionUID = 1L;

    private final String engine;

    public UnknownCrusherException(String engine, String extension) {
        super("The crusher " + engine + " does not exist for extension " + extension);
        this.engine = engine;
    }

    public String engine() { return engine; }
}
