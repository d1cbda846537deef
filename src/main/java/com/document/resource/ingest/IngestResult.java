package com.document.resource.ingest;

import com.document.resource.core.model.ResourceKind;
import com.document.resource.truncation.TruncationResult;

import java.time.Instant;
import java.util.Objects;

/**
 * What an ingest operation returns to the caller, depending on the {@link ReturnMode}.
 */
public sealed interface IngestResult permits IngestResult.Summary, IngestResult.Full {

    String resourceId();

    ResourceKind kind();

    /**
     * Metadata and read addresses for content that was cached instead of returned.
     *
     * @param resourceId        the remote resource ID
     * @param cacheKey          the key the text was stored under
     * @param name              the resource title or file name
     * @param kind              the resource kind
     * @param textLength        length of the cached text
     * @param fetchedAt         when the text was cached
     * @param contentAddress    address returning the whole text
     * @param firstChunkAddress address returning the first chunk
     * @param chunkSize         characters per suggested chunk
     * @param chunkCount        number of chunks of {@code chunkSize} covering the text
     */
    record Summary(
            String resourceId,
            String cacheKey,
            String name,
            ResourceKind kind,
            int textLength,
            Instant fetchedAt,
            String contentAddress,
            String firstChunkAddress,
            int chunkSize,
            int chunkCount
    ) implements IngestResult {
        public Summary {
            Objects.requireNonNull(resourceId, "resourceId is required");
            Objects.requireNonNull(cacheKey, "cacheKey is required");
            Objects.requireNonNull(kind, "kind is required");
            Objects.requireNonNull(contentAddress, "contentAddress is required");
        }
    }

    /**
     * Content returned inline, bounded by the truncation guard.
     */
    record Full(String resourceId, ResourceKind kind, TruncationResult content) implements IngestResult {
        public Full {
            Objects.requireNonNull(resourceId, "resourceId is required");
            Objects.requireNonNull(content, "content is required");
        }
    }
}
