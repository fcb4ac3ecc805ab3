package org.iceforge.tabula.core.query;

import java.util.Locale;
import java.util.Optional;

/**
 * Comparison operators allowed in a filter clause. Tokens are rendered into SQL verbatim.
 */
public enum FilterOperator {
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    EQ("="),
    NEQ("!="),
    IN("IN"),
    NOT_IN("NOT IN");

    private final String token;

    FilterOperator(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /** List operators take a comma-separated string and expand into one placeholder per member. */
    public boolean isList() {
        return this == IN || this == NOT_IN;
    }

    /**
     * Case-insensitive exact match against the allowlist. Surrounding or inner whitespace is not normalized,
     * so {@code "not  in"} or {@code " = "} are rejected.
     */
    public static Optional<FilterOperator> parse(String input) {
        if (input == null) return Optional.empty();
        String upper = input.toUpperCase(Locale.ROOT);
        for (FilterOperator op : values()) {
            if (op.token.equals(upper)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
