package io.crusher.error;

import io.crusher.core.ContentType;

/** A crusher was invoked with a content type it does not accept. */
public class UnsupportedTypeException extends CrushException {
    private static final long serialVersionUID = 1L;

    public UnsupportedTypeException(String engine, ContentType type) {
        super("Type " + type + " is not supported by " + engine);
    }
}
