package com.document.resource.mcp;

/**
 * Direct fetch path for legacy {@code <scheme>:///<id>} addresses, which are not served from the
 * cache. Implemented by the host on top of the remote document API.
 */
@FunctionalInterface
public interface LegacyResourceReader {

    /**
     * Fetches and returns the resource.
     *
     * @param uri        the legacy address as received
     * @param resourceId the resource ID taken from the address
     */
    ResourceReadResponse read(String uri, String resourceId);
}
