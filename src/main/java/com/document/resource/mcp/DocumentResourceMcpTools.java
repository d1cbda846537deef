package com.document.resource.mcp;

import com.document.resource.address.AddressParser;
import com.document.resource.address.AddressRule;
import com.document.resource.api.DocumentResourceCache;
import com.document.resource.cache.CacheSnapshot;
import com.document.resource.cache.CacheStats;
import com.document.resource.resolve.ResolvedContent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds MCP tool definitions over the content cache.
 *
 * <p>Available tools:</p>
 * <ul>
 *   <li>{@code read_resource} -- read cached text, or a chunk of it, by address</li>
 *   <li>{@code list_address_formats} -- the address forms this server accepts</li>
 *   <li>{@code cache_stats} -- entries currently cached, with age and size</li>
 *   <li>{@code cache_sweep} -- drop stale entries now</li>
 * </ul>
 */
public final class DocumentResourceMcpTools {

    private final DocumentResourceCache resources;

    public DocumentResourceMcpTools(DocumentResourceCache resources) {
        this.resources = Objects.requireNonNull(resources, "resources is required");
    }

    public List<McpToolDefinition> getToolDefinitions() {
        return List.of(
                buildReadResourceTool(),
                buildListAddressFormatsTool(),
                buildCacheStatsTool(),
                buildCacheSweepTool()
        );
    }

    /**
     * Finds a tool definition by name.
     */
    public Optional<McpToolDefinition> getTool(String name) {
        return getToolDefinitions().stream()
                .filter(t -> t.name().equals(name))
                .findFirst();
    }

    private McpToolDefinition buildReadResourceTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "uri", Map.of("type", "string", "description",
                                "Content address, e.g. " + resources.getParser().scheme() + "://docs/{id}/chunk/0-5000")
                ),
                "required", List.of("uri")
        );

        return new McpToolDefinition(
                "read_resource",
                "Read cached document text by address. Fetch the document with returnMode 'summary' first; "
                        + "the summary lists the addresses to read. Supported forms: " + formats(),
                schema,
                params -> {
                    String uri = (String) params.get("uri");
                    ResolvedContent result = resources.read(uri);
                    Map<String, Object> response = new LinkedHashMap<>();
                    response.put("uri", String.valueOf(uri));
                    if (result.found()) {
                        response.put("found", true);
                        response.put("length", result.content().length());
                        response.put("content", result.content());
                        return response;
                    }
                    response.put("found", false);
                    response.put("failure", result.failure().name());
                    if (result.error() != null) {
                        response.put("error", result.error());
                    }
                    if (result.hint() != null) {
                        response.put("hint", result.hint());
                    }
                    if (result.suggestion() != null) {
                        response.put("suggestion", result.suggestion());
                    }
                    return response;
                }
        );
    }

    private McpToolDefinition buildListAddressFormatsTool() {
        return new McpToolDefinition(
                "list_address_formats",
                "List the content address forms this server accepts.",
                Map.of("type", "object", "properties", Map.of()),
                params -> {
                    String scheme = resources.getParser().scheme();
                    List<Map<String, Object>> formats = AddressParser.supportedRules().stream()
                            .map(rule -> Map.<String, Object>of(
                                    "type", rule.type().segment(),
                                    "action", rule.action().segment(),
                                    "format", scheme + "://" + rule.usage()
                            ))
                            .toList();
                    return Map.of("scheme", scheme, "count", formats.size(), "formats", formats);
                }
        );
    }

    private McpToolDefinition buildCacheStatsTool() {
        return new McpToolDefinition(
                "cache_stats",
                "Show the cached resources with their kind, age in seconds and text length. Read-only.",
                Map.of("type", "object", "properties", Map.of()),
                params -> {
                    CacheSnapshot snapshot = resources.stats();
                    CacheStats counters = resources.cacheStats();
                    List<Map<String, Object>> entries = snapshot.entries().stream()
                            .map(e -> Map.<String, Object>of(
                                    "key", e.key(),
                                    "kind", e.kind().name(),
                                    "ageSeconds", e.ageSeconds(),
                                    "textLength", e.textLength()
                            ))
                            .toList();
                    return Map.of(
                            "size", snapshot.size(),
                            "entries", entries,
                            "hitCount", counters.hitCount(),
                            "missCount", counters.missCount(),
                            "hitRate", counters.hitRate(),
                            "ttlSeconds", resources.getCacheConfig().ttl().toSeconds()
                    );
                }
        );
    }

    private McpToolDefinition buildCacheSweepTool() {
        return new McpToolDefinition(
                "cache_sweep",
                "Remove cached resources whose time-to-live has elapsed.",
                Map.of("type", "object", "properties", Map.of()),
                params -> Map.of("removed", resources.sweep(), "remaining", resources.stats().size())
        );
    }

    private String formats() {
        String scheme = resources.getParser().scheme();
        return AddressParser.supportedRules().stream()
                .map(AddressRule::usage)
                .map(usage -> scheme + "://" + usage)
                .collect(Collectors.joining(", "));
    }
}
