package io.crusher.error;

/** A remote crushing service could not be reached or answered with a non-success status. */
public class RemoteServiceException extends CrushException {
    private static final long serialVersionUID = 1L;

    private final int status;

    public RemoteServiceException(String message, int status) {
        super(message);
        this.status = status;
    }

    public RemoteServiceException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    /** HTTP status, or -1 for transport failures. */
    public int status() { return status; }
}
