package org.prisma.runtime;

import java.util.Locale;

/**
 * How frames are spread over workers.
 */
public enum ExecutionMode {
    /** Detect a multi-node launch; run locally without one. */
    AUTO,
    /** Thread pool in this process. */
    LOCAL,
    /** Worker ranks connected through the coordinator's message broker. */
    DISTRIBUTED;

    /**
     * @param value mode name, case-insensitive.
     * @return the mode.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static ExecutionMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown execution mode '" + value + "', expected auto, local or distributed");
        }
    }
}
