package dev.pagestack.service;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Output forms of a snapshot comparison.
 */
public enum DiffFormat {
    UNIFIED,
    SIDE_BY_SIDE,
    JSON_PATCH,
    SUMMARY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Unknown or missing names fall back to {@link #UNIFIED}.
     */
    public static DiffFormat fromWireName(String value) {
        if (value != null) {
            for (DiffFormat format : values()) {
                if (format.wireName().equalsIgnoreCase(value.trim())) {
                    return format;
                }
            }
        }
        return UNIFIED;
    }
}
