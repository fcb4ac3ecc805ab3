package org.iceforge.tabula.core.query;

import java.util.Objects;

public record QueryError(ErrorKind kind, String message) {
    public QueryError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }
}
