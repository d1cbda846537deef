package com.document.resource.mcp;

import com.document.resource.address.AddressParser;
import com.document.resource.address.ResourceAddresses;
import com.document.resource.cache.CacheConfig;
import com.document.resource.cache.CaffeineContentCache;
import com.document.resource.core.model.DocumentPayload;
import com.document.resource.core.model.FilePayload;
import com.document.resource.metrics.NoOpMetricsService;
import com.document.resource.resolve.ContentResolver;
import com.document.resource.resolve.ResolutionFailure;
import com.document.resource.resolve.ResolvedContent;
import com.document.resource.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("ResourceReadHandler Tests")
class ResourceReadHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private CaffeineContentCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        cache = new CaffeineContentCache(CacheConfig.defaults(), clock, new NoOpMetricsService());
    }

    private ResourceReadHandler handler(LegacyResourceReader legacyReader) {
        ResourceAddresses addresses = new ResourceAddresses();
        return new ResourceReadHandler(new AddressParser(),
                new ContentResolver(cache, addresses, new NoOpMetricsService()),
                cache, addresses, legacyReader);
    }

    @Nested
    @DisplayName("Reads")
    class ReadTests {

        @Test
        @DisplayName("Should return resolved text as text/plain")
        void returnsText() {
            cache.store("doc1", new DocumentPayload("doc1", "Doc", null, List.of("Hello world")));

            ResourceReadResponse response = handler(null).read("gdrive://docs/doc1/chunk/6-11");

            assertEquals("gdrive://docs/doc1/chunk/6-11", response.uri());
            assertEquals(ResourceReadResponse.TEXT_PLAIN, response.mimeType());
            assertEquals("world", response.text());
            assertFalse(response.isError());
        }

        @Test
        @DisplayName("Should return a miss as a JSON error body")
        void returnsMissAsJson() throws Exception {
            ResourceReadResponse response = handler(null).read("gdrive://files/unknown/content");

            assertTrue(response.isError());
            JsonNode body = objectMapper.readTree(response.text());
            assertEquals("cache miss for unknown", body.get("error").asText());
            assertFalse(body.get("hint").asText().isEmpty());
            assertTrue(body.has("suggestion"));
        }

        @Test
        @DisplayName("Should omit absent fields from the error body")
        void omitsNulls() throws Exception {
            ResourceReadResponse response = handler(null).read("gdrive:///file1");

            JsonNode body = objectMapper.readTree(response.text());
            assertFalse(body.has("error"));
            assertFalse(body.has("suggestion"));
            assertEquals("Legacy URI format - use standard resource fetch", body.get("hint").asText());
        }

        @Test
        @DisplayName("Should delegate legacy addresses to the legacy reader")
        void delegatesLegacy() {
            LegacyResourceReader legacyReader = mock(LegacyResourceReader.class);
            ResourceReadResponse fetched = new ResourceReadResponse("gdrive:///file1", "text/plain", "fetched");
            when(legacyReader.read("gdrive:///file1", "file1")).thenReturn(fetched);

            ResourceReadResponse response = handler(legacyReader).read("gdrive:///file1");

            assertSame(fetched, response);
            verify(legacyReader).read("gdrive:///file1", "file1");
        }

        @Test
        @DisplayName("Should not call the legacy reader for structured addresses")
        void structuredSkipsLegacy() {
            LegacyResourceReader legacyReader = mock(LegacyResourceReader.class);
            handler(legacyReader).read("gdrive://docs/doc1/content");
            verify(legacyReader, never()).read(anyString(), anyString());
        }

        @Test
        @DisplayName("Should serialize a parse failure")
        void serializesParseFailure() throws Exception {
            ResourceReadHandler handler = handler(null);
            String body = handler.errorBody(ResolvedContent.failed(ResolutionFailure.INVALID_ADDRESS,
                    "Missing resource ID", "Supported address formats: docs/{id}/content", null));

            assertEquals("{\"error\":\"Missing resource ID\",\"hint\":\"Supported address formats: docs/{id}/content\"}",
                    body);
        }
    }

    @Nested
    @DisplayName("Listing")
    class ListTests {

        @Test
        @DisplayName("Should list live entries with their read address")
        void listsLiveEntries() {
            cache.store("old", new FilePayload("old", "old.txt", "text/plain", "stale"));
            clock.advance(Duration.ofMinutes(20));
            cache.store("doc1", new DocumentPayload("doc1", "Doc", null, List.of("Hello")));
            cache.store("f1", new FilePayload("f1", "f.txt", "text/plain", "abc"));
            clock.advance(Duration.ofMinutes(15));

            List<ResourceDescriptor> resources = handler(null).listCachedResources();

            assertEquals(2, resources.size());
            assertEquals("gdrive://docs/doc1/content", resources.get(0).uri());
            assertEquals("doc1", resources.get(0).name());
            assertEquals("document, 5 characters, cached 900s ago", resources.get(0).description());
            assertEquals("gdrive://files/f1/content", resources.get(1).uri());
            assertEquals(2, cache.stats().size());
        }
    }
}
