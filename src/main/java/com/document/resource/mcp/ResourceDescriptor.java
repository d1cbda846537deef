package com.document.resource.mcp;

/**
 * A readable resource advertised to agents.
 *
 * @param uri         the address to read
 * @param name        display name
 * @param mimeType    MIME type of the content served at {@code uri}
 * @param description short description of what is cached
 */
public record ResourceDescriptor(String uri, String name, String mimeType, String description) {
}
