package com.document.resource.address;

import java.util.Arrays;
import java.util.Optional;

/**
 * Action segment of a structured content address.
 */
public enum AddressAction {
    CONTENT("content"),
    CHUNK("chunk"),
    STRUCTURE("structure"),
    VALUES("values");

    private final String segment;

    AddressAction(String segment) {
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }

    public static Optional<AddressAction> fromSegment(String segment) {
        return Arrays.stream(values())
                .filter(a -> a.segment.equals(segment))
                .findFirst();
    }
}
