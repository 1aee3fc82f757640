package org.twistmodal.logic.common;

import java.util.Objects;

/**
 * Base of all errors raised by the algebra, the model and the formula layer.
 * Callers switch on {@link #kind()} rather than on the concrete class.
 */
public abstract class LogicException extends RuntimeException {
    private final ErrorKind kind;

    protected LogicException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind);
    }

    protected LogicException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind);
    }

    public ErrorKind kind() {
        return kind;
    }
}
