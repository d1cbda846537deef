package com.document.resource.core.model;

import java.util.Objects;

/**
 * A file downloaded or exported from drive storage, already decoded to text.
 *
 * @param fileId   the file ID
 * @param name     the file name
 * @param mimeType the MIME type of {@code body}
 * @param body     decoded file content
 */
public record FilePayload(String fileId, String name, String mimeType, String body) implements ResourcePayload {

    public FilePayload {
        Objects.requireNonNull(fileId, "fileId is required");
        name = name != null ? name : "Untitled";
        mimeType = mimeType != null ? mimeType : "application/octet-stream";
        body = body != null ? body : "";
    }

    @Override
    public String resourceId() {
        return fileId;
    }

    @Override
    public String displayName() {
        return name;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.FILE;
    }

    @Override
    public String extractText() {
        return body;
    }
}
