package com.document.resource.address;

import java.util.Objects;

/**
 * Outcome of parsing an address string: either a valid {@link ResourceAddress}, or a
 * {@link ParseFailure} with a human-readable message. Never both, never neither.
 *
 * @param address the parsed address, null when invalid
 * @param failure the rejection reason, null when valid
 * @param error   the rejection message, null when valid
 */
public record ParsedAddress(ResourceAddress address, ParseFailure failure, String error) {

    public ParsedAddress {
        if ((address == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of address or failure is required");
        }
        if (failure != null) {
            Objects.requireNonNull(error, "error is required for an invalid address");
        }
    }

    public static ParsedAddress of(ResourceAddress address) {
        return new ParsedAddress(Objects.requireNonNull(address, "address is required"), null, null);
    }

    public static ParsedAddress invalid(ParseFailure failure, String error) {
        return new ParsedAddress(null, Objects.requireNonNull(failure, "failure is required"), error);
    }

    public boolean valid() {
        return address != null;
    }
}
