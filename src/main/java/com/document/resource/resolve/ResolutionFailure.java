package com.document.resource.resolve;

/**
 * Why an address did not resolve to text.
 */
public enum ResolutionFailure {
    /** The address string was rejected by the parser. */
    INVALID_ADDRESS,
    /** A legacy address; it is served by a direct fetch, not from the cache. */
    NOT_CACHE_BACKED,
    /** No live cache entry for the resource: never stored, or expired. */
    CACHE_MISS,
    /** A recognised action that is not implemented ({@code structure}, {@code values}). */
    UNSUPPORTED_ACTION
}
