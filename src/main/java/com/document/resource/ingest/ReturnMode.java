package com.document.resource.ingest;

import java.util.Locale;

/**
 * How a fetch operation hands back what it fetched.
 */
public enum ReturnMode {
    /** Cache the full text and return metadata plus the addresses to read it from. */
    SUMMARY,
    /** Return the text immediately, bounded by the truncation guard. */
    FULL;

    public static final ReturnMode DEFAULT = SUMMARY;

    /**
     * Parses {@code "summary"} or {@code "full"}, ignoring case. Null yields {@link #DEFAULT}.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static ReturnMode parse(String value) {
        if (value == null) {
            return DEFAULT;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "summary":
                return SUMMARY;
            case "full":
                return FULL;
            default:
                throw new IllegalArgumentException("returnMode must be 'summary' or 'full', got: " + value);
        }
    }
}
