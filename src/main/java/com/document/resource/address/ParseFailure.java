package com.document.resource.address;

/**
 * Reason an address string was rejected by {@link AddressParser}.
 */
public enum ParseFailure {
    INVALID_SCHEME,
    EMPTY_IDENTIFIER,
    MISSING_TYPE_OR_ID,
    UNKNOWN_TYPE,
    MISSING_ACTION,
    UNKNOWN_ACTION,
    MISSING_RANGE,
    MALFORMED_RANGE,
    NEGATIVE_START,
    EMPTY_RANGE,
    MALFORMED_ENCODING
}
