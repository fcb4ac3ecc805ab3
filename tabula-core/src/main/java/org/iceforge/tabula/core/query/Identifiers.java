package org.iceforge.tabula.core.query;

import java.util.regex.Pattern;

/**
 * Allowlist for names that end up as literal SQL text (project, dataset, table and column names).
 */
public final class Identifiers {
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9_-]+$");

    private Identifiers() {}

    public static boolean isValid(String candidate) {
        return candidate != null && IDENTIFIER.matcher(candidate).matches();
    }

    /** Backtick-quotes an identifier that already passed {@link #isValid(String)}. */
    static String quote(String identifier) {
        if (!isValid(identifier)) {
            throw new IllegalArgumentException("Refusing to quote invalid identifier: " + identifier);
        }
        return "`" + identifier + "`";
    }
}
