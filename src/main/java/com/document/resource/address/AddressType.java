package com.document.resource.address;

import com.document.resource.core.model.ResourceKind;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resource type segment of a structured content address ({@code <scheme>://<type>/...}).
 */
public enum AddressType {
    DOCS("docs", ResourceKind.DOCUMENT),
    SHEETS("sheets", ResourceKind.SPREADSHEET),
    FILES("files", ResourceKind.FILE);

    private final String segment;
    private final ResourceKind kind;

    AddressType(String segment, ResourceKind kind) {
        this.segment = segment;
        this.kind = kind;
    }

    public String segment() {
        return segment;
    }

    public ResourceKind kind() {
        return kind;
    }

    public static Optional<AddressType> fromSegment(String segment) {
        return Arrays.stream(values())
                .filter(t -> t.segment.equals(segment))
                .findFirst();
    }

    /**
     * Returns the supported segments, comma separated ("docs, sheets, files").
     */
    public static String supportedSegments() {
        return Arrays.stream(values()).map(AddressType::segment).collect(Collectors.joining(", "));
    }
}
