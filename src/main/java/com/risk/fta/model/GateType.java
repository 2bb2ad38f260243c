package com.risk.fta.model;

import java.util.Locale;

/**
 * Logical operators supported by gates. All operators are coherent: adding a
 * failed input never repairs the output.
 */
public enum GateType {
    /** All children must fail. */
    AND,
    /** Any child failing is enough. */
    OR,
    /** At least k of n children must fail (voting gate). */
    ATLEAST,
    /** AND of an event and its enabling condition. */
    INHIBIT,
    /** Pass-through of a single child. */
    NULL;

    /**
     * Resolves a case-insensitive operator name. Accepts "vote" as an alias of
     * {@link #ATLEAST}.
     */
    public static GateType of(String name) {
        String upper = name.trim().toUpperCase(Locale.ROOT);
        if (upper.equals("VOTE"))
            return ATLEAST;
        return valueOf(upper);
    }
}
