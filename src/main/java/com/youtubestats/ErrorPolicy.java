package com.youtubestats;

import java.util.Locale;

/**
 * How data-quality errors (parse, missing field, coercion, missing partition key)
 * are handled. There is deliberately no default constant: the caller picks one.
 */
public enum ErrorPolicy {
    /** Abort the run on the first rejected record. */
    STRICT,
    /** Write rejected records to the quarantine path and keep going. */
    LENIENT;
    
    public static ErrorPolicy fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Error policy must be set explicitly (strict or lenient)");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown error policy '" + name + "', expected strict or lenient", e);
        }
    }
}
