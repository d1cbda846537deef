package com.document.resource.address;

import com.document.resource.core.model.ResourceKind;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Builds address strings that {@link AddressParser} accepts for the same scheme.
 * Ingest operations use it to tell callers where the text they just cached can be read.
 */
public class ResourceAddresses {

    private final String scheme;

    public ResourceAddresses() {
        this(AddressParser.DEFAULT_SCHEME);
    }

    public ResourceAddresses(String scheme) {
        this.scheme = Objects.requireNonNull(scheme, "scheme is required");
    }

    public String legacy(String resourceId) {
        return scheme + ":///" + resourceId;
    }

    public String documentContent(String resourceId) {
        return structured(AddressType.DOCS, resourceId, AddressAction.CONTENT);
    }

    public String documentStructure(String resourceId) {
        return structured(AddressType.DOCS, resourceId, AddressAction.STRUCTURE);
    }

    public String documentChunk(String resourceId, ChunkRange range) {
        return structured(AddressType.DOCS, resourceId, AddressAction.CHUNK) + "/" + range.toSegment();
    }

    public String sheetValues(String resourceId, String sheetRange) {
        String encoded = URLEncoder.encode(sheetRange, StandardCharsets.UTF_8).replace("+", "%20");
        return structured(AddressType.SHEETS, resourceId, AddressAction.VALUES) + "/" + encoded;
    }

    public String fileContent(String resourceId) {
        return structured(AddressType.FILES, resourceId, AddressAction.CONTENT);
    }

    public String fileRange(String resourceId, ChunkRange range) {
        return fileContent(resourceId) + "/" + range.toSegment();
    }

    /**
     * Returns the address that reads the whole cached text stored under {@code key}.
     * Documents use the docs form; spreadsheets and files use the files form, whose content
     * action serves any cached text.
     */
    public String contentAddress(ResourceKind kind, String key) {
        return kind == ResourceKind.DOCUMENT ? documentContent(key) : fileContent(key);
    }

    /**
     * Returns the address that reads one range of the cached text stored under {@code key}.
     */
    public String rangeAddress(ResourceKind kind, String key, ChunkRange range) {
        return kind == ResourceKind.DOCUMENT ? documentChunk(key, range) : fileRange(key, range);
    }

    private String structured(AddressType type, String resourceId, AddressAction action) {
        Objects.requireNonNull(resourceId, "resourceId is required");
        return scheme + "://" + type.segment() + "/" + resourceId + "/" + action.segment();
    }
}
