package org.github.zzf.router.mux;

import java.util.Arrays;

/**
 * which subscriptions receive a message when several patterns match its topic
 */
public enum DispatchMode {

    /**
     * only the highest priority pattern: exact level before '+' before '#'
     */
    FIRST_MATCH,

    /**
     * every matching pattern, in priority order. what a broker fanning out to subscribers needs
     */
    ALL_MATCHES,

    ;

    static final String PROPERTY = "topic.router.mux.dispatchMode";

    /**
     * case-insensitive, {@link #FIRST_MATCH} when unset
     *
     * @throws IllegalArgumentException the property names no mode
     */
    static DispatchMode fromSystemProperty() {
        String value = System.getProperty(PROPERTY);
        if (value == null || value.isBlank()) {
            return FIRST_MATCH;
        }
        for (DispatchMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException(
            "unknown " + PROPERTY + ": " + value + ", expected one of " + Arrays.toString(values()));
    }

}
