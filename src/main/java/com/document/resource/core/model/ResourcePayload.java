package com.document.resource.core.model;

/**
 * Raw payload returned by a remote document API, one shape per {@link ResourceKind}.
 * Each payload knows how to flatten itself into the display text that chunk addressing
 * operates over.
 */
public sealed interface ResourcePayload permits DocumentPayload, SpreadsheetPayload, FilePayload {

    /**
     * Identifier of the remote resource (document, spreadsheet or file ID).
     */
    String resourceId();

    /**
     * Human-readable name of the resource.
     */
    String displayName();

    ResourceKind kind();

    /**
     * Flattened, display-oriented text extracted from this payload.
     */
    String extractText();
}
