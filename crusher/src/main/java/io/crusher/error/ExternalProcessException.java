package io.crusher.error;

/**
 * Failure of an external executable. The kind tells "the tool complained" from "the tool crashed"
 * from "the tool produced nothing".
 */
public class ExternalProcessException extends CrushException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** The executable could not be started. */
        SPAWN,
        /** Something was written to the diagnostic stream. */
        DIAGNOSTIC,
        /** Non-zero exit code. */
        EXIT_CODE,
        /** Clean exit but nothing on the primary output. */
        NO_OUTPUT
    }

    private final Kind kind;
    private final int exitCode;

    public ExternalProcessException(Kind kind, int exitCode, String message) {
        super(message);
        this.kind = kind;
        this.exitCode = exitCode;
    }

    public ExternalProcessException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.exitCode = -1;
    }

    public Kind kind() { return kind; }

    /** Exit code of the process, or -1 when it never ran. */
    public int exitCode() { return exitCode; }
}
