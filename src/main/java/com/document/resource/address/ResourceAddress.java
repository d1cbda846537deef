package com.document.resource.address;

import java.util.Objects;
import java.util.Optional;

/**
 * A validated content address. Legacy addresses name a remote resource directly and are served
 * outside the cache; the other variants address text held in the content cache.
 */
public sealed interface ResourceAddress permits ResourceAddress.Legacy, ResourceAddress.CacheBacked {

    /**
     * The resource ID, which is also the cache key for cache-backed addresses.
     */
    String resourceId();

    /**
     * Address served from the content cache.
     */
    sealed interface CacheBacked extends ResourceAddress permits Document, Spreadsheet, File {

        AddressType type();

        AddressAction action();

        /**
         * The character range requested, if any.
         */
        Optional<ChunkRange> range();
    }

    /**
     * {@code <scheme>:///<id>}
     */
    record Legacy(String resourceId) implements ResourceAddress {
        public Legacy {
            Objects.requireNonNull(resourceId, "resourceId is required");
        }
    }

    /**
     * {@code <scheme>://docs/<id>/content|structure|chunk/<start>-<end>}
     */
    record Document(String resourceId, AddressAction action, ChunkRange chunk) implements CacheBacked {
        public Document {
            Objects.requireNonNull(resourceId, "resourceId is required");
            Objects.requireNonNull(action, "action is required");
            if (action == AddressAction.CHUNK && chunk == null) {
                throw new IllegalArgumentException("chunk action requires a range");
            }
        }

        @Override
        public AddressType type() {
            return AddressType.DOCS;
        }

        @Override
        public Optional<ChunkRange> range() {
            return Optional.ofNullable(chunk);
        }
    }

    /**
     * {@code <scheme>://sheets/<id>/values/<url-encoded-range>}
     *
     * @param sheetRange the decoded A1-notation range
     */
    record Spreadsheet(String resourceId, String sheetRange) implements CacheBacked {
        public Spreadsheet {
            Objects.requireNonNull(resourceId, "resourceId is required");
            Objects.requireNonNull(sheetRange, "sheetRange is required");
        }

        @Override
        public AddressType type() {
            return AddressType.SHEETS;
        }

        @Override
        public AddressAction action() {
            return AddressAction.VALUES;
        }

        @Override
        public Optional<ChunkRange> range() {
            return Optional.empty();
        }
    }

    /**
     * {@code <scheme>://files/<id>/content[/<start>-<end>]}
     */
    record File(String resourceId, ChunkRange chunk) implements CacheBacked {
        public File {
            Objects.requireNonNull(resourceId, "resourceId is required");
        }

        @Override
        public AddressType type() {
            return AddressType.FILES;
        }

        @Override
        public AddressAction action() {
            return AddressAction.CONTENT;
        }

        @Override
        public Optional<ChunkRange> range() {
            return Optional.ofNullable(chunk);
        }
    }
}
