package com.document.resource.ingest;

import com.document.resource.core.model.ResourcePayload;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Cache key conventions. A key must equal the resource ID that addresses for it carry, so keys
 * never contain '/'.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    /**
     * Key for a resource cached as a whole: its ID.
     */
    public static String forResource(String resourceId) {
        return Objects.requireNonNull(resourceId, "resourceId is required");
    }

    /**
     * Key for a whole fetched payload.
     */
    public static String forPayload(ResourcePayload payload) {
        Objects.requireNonNull(payload, "payload is required");
        return forResource(payload.resourceId());
    }

    /**
     * Key for specific value ranges of a spreadsheet, so that several queried range sets of one
     * spreadsheet can be cached side by side: {@code <id>:<url-encoded ranges joined by ','>}.
     * No ranges yields the bare ID.
     */
    public static String forSheetRanges(String spreadsheetId, List<String> ranges) {
        Objects.requireNonNull(spreadsheetId, "spreadsheetId is required");
        if (ranges == null || ranges.isEmpty()) {
            return spreadsheetId;
        }
        return spreadsheetId + ":" + URLEncoder.encode(String.join(",", ranges), StandardCharsets.UTF_8);
    }

    /**
     * Whether {@code key} was derived from {@code resourceId}, either as the bare ID or a composite.
     */
    public static boolean belongsTo(String key, String resourceId) {
        return key.equals(resourceId) || key.startsWith(resourceId + ":");
    }
}
