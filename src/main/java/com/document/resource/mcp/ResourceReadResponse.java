package com.document.resource.mcp;

import java.util.Objects;

/**
 * Body of a resource read: plain text on success, a JSON error object otherwise.
 *
 * @param uri      the address that was read
 * @param mimeType {@code text/plain} or {@code application/json}
 * @param text     the content or the serialized error
 */
public record ResourceReadResponse(String uri, String mimeType, String text) {

    public static final String TEXT_PLAIN = "text/plain";
    public static final String APPLICATION_JSON = "application/json";

    public ResourceReadResponse {
        Objects.requireNonNull(mimeType, "mimeType is required");
        Objects.requireNonNull(text, "text is required");
    }

    public boolean isError() {
        return APPLICATION_JSON.equals(mimeType);
    }
}
