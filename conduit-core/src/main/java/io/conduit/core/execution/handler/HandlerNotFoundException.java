package io.conduit.core.execution.handler;

import java.io.Serial;

/// Thrown when no handler matches a node's type or shape and no default is set.
public class HandlerNotFoundException extends RuntimeException {
    @Serial private static final long serialVersionUID = 6240918173058342291L;

    public HandlerNotFoundException(String message) {
        super(message);
    }
}
