package com.document.resource.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A text document as returned by the documents API, reduced to its paragraph text.
 *
 * @param documentId the document ID
 * @param title      the document title
 * @param revisionId the revision the paragraphs were read from, may be null
 * @param paragraphs paragraph text in document order
 */
public record DocumentPayload(
        String documentId,
        String title,
        String revisionId,
        List<String> paragraphs
) implements ResourcePayload {

    public DocumentPayload {
        Objects.requireNonNull(documentId, "documentId is required");
        title = title != null ? title : "Untitled";
        paragraphs = paragraphs != null ? List.copyOf(paragraphs) : List.of();
    }

    @Override
    public String resourceId() {
        return documentId;
    }

    @Override
    public String displayName() {
        return title;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.DOCUMENT;
    }

    @Override
    public String extractText() {
        return String.join("\n", paragraphs);
    }
}
