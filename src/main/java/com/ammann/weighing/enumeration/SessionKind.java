/* (C)2026 */
package com.ammann.weighing.enumeration;

import java.util.Locale;

/**
 * Role of a manual weighing session in the base/final ratio workflow.
 *
 * <p>The base session weighs the sample before treatment, the final session after.
 * A ratio result is only available once both have been completed.
 */
public enum SessionKind
{
    BASE,
    FINAL;

    /**
     * Resolves a path or query value such as {@code "base"} to a session kind.
     *
     * @param value case-insensitive kind name
     * @return the matching kind
     * @throws IllegalArgumentException if the value does not name a kind
     */
    public static SessionKind fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Session kind must not be null");
        }
        return SessionKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
