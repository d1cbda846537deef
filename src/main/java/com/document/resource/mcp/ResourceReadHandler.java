package com.document.resource.mcp;

import com.document.resource.address.AddressParser;
import com.document.resource.address.ParsedAddress;
import com.document.resource.address.ResourceAddress;
import com.document.resource.address.ResourceAddresses;
import com.document.resource.cache.CacheSnapshot;
import com.document.resource.cache.ContentCache;
import com.document.resource.logging.LogContext;
import com.document.resource.resolve.ContentResolver;
import com.document.resource.resolve.ResolvedContent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Serves MCP resource reads for content addresses.
 *
 * <p>A read returns the resolved text as {@code text/plain}. Any failure is returned as an
 * {@code application/json} body {@code {"error": ..., "hint": ..., "suggestion": ...}} (absent
 * fields omitted) so that the agent can act on it; nothing is thrown for a bad address or a miss.
 * Legacy addresses go to the {@link LegacyResourceReader} when one is configured.</p>
 */
public class ResourceReadHandler {
    private static final Logger log = LoggerFactory.getLogger(ResourceReadHandler.class);

    private static final String SERIALIZATION_FALLBACK = "{\"error\":\"Failed to serialize error details\"}";

    private final AddressParser parser;
    private final ContentResolver resolver;
    private final ContentCache cache;
    private final ResourceAddresses addresses;
    private final LegacyResourceReader legacyReader;
    private final ObjectMapper objectMapper;

    public ResourceReadHandler(AddressParser parser, ContentResolver resolver, ContentCache cache,
                               ResourceAddresses addresses, LegacyResourceReader legacyReader) {
        this.parser = Objects.requireNonNull(parser, "parser is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.addresses = Objects.requireNonNull(addresses, "addresses is required");
        this.legacyReader = legacyReader;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Reads one address.
     */
    public ResourceReadResponse read(String uri) {
        try (LogContext ignored = LogContext.forRead(uri)) {
            ParsedAddress parsed = parser.parse(uri);
            if (legacyReader != null && parsed.address() instanceof ResourceAddress.Legacy legacy) {
                log.debug("read.legacy resourceId={}", legacy.resourceId());
                return legacyReader.read(uri, legacy.resourceId());
            }
            ResolvedContent result = resolver.resolve(parsed);
            if (result.found()) {
                return new ResourceReadResponse(uri, ResourceReadResponse.TEXT_PLAIN, result.content());
            }
            log.debug("read.failed failure={} error={}", result.failure(), result.error());
            return new ResourceReadResponse(uri, ResourceReadResponse.APPLICATION_JSON, errorBody(result));
        }
    }

    /**
     * Lists the live cache entries as readable resources. Stale entries are swept first.
     */
    public List<ResourceDescriptor> listCachedResources() {
        cache.sweep();
        List<ResourceDescriptor> resources = new ArrayList<>();
        for (CacheSnapshot.EntrySummary entry : cache.stats().entries()) {
            resources.add(new ResourceDescriptor(
                    addresses.contentAddress(entry.kind(), entry.key()),
                    entry.key(),
                    ResourceReadResponse.TEXT_PLAIN,
                    entry.kind().name().toLowerCase(Locale.ROOT) + ", " + entry.textLength()
                            + " characters, cached " + entry.ageSeconds() + "s ago"));
        }
        return resources;
    }

    String errorBody(ResolvedContent result) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (result.error() != null) {
            body.put("error", result.error());
        }
        if (result.hint() != null) {
            body.put("hint", result.hint());
        }
        if (result.suggestion() != null) {
            body.put("suggestion", result.suggestion());
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize read error: {}", e.getMessage());
            return SERIALIZATION_FALLBACK;
        }
    }
}
