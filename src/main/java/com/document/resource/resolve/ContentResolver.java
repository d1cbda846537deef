package com.document.resource.resolve;

import com.document.resource.address.AddressParser;
import com.document.resource.address.AddressRule;
import com.document.resource.address.ParsedAddress;
import com.document.resource.address.ResourceAddress;
import com.document.resource.address.ResourceAddresses;
import com.document.resource.cache.CacheEntry;
import com.document.resource.cache.ContentCache;
import com.document.resource.metrics.MetricsService;
import com.document.resource.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Serves text slices for parsed addresses from the {@link ContentCache}.
 *
 * <p>Addresses arrive fully validated, so resolution is only a cache lookup followed by an
 * optional slice. A chunk whose end lies past the text is clamped rather than rejected, letting
 * callers page through content without knowing its length. Failures are returned as values.</p>
 */
public class ContentResolver {
    private static final Logger log = LoggerFactory.getLogger(ContentResolver.class);

    static final String LEGACY_HINT = "Legacy URI format - use standard resource fetch";
    static final String MISS_HINT = "Fetch the resource via its ingest operation first to populate the cache";

    private final ContentCache cache;
    private final ResourceAddresses addresses;
    private final MetricsService metricsService;
    private final String addressFormats;

    public ContentResolver(ContentCache cache) {
        this(cache, new ResourceAddresses(), new NoOpMetricsService());
    }

    public ContentResolver(ContentCache cache, ResourceAddresses addresses, MetricsService metricsService) {
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.addresses = Objects.requireNonNull(addresses, "addresses is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.addressFormats = AddressParser.supportedRules().stream()
                .map(AddressRule::usage)
                .collect(Collectors.joining(", "));
    }

    /**
     * Resolves a parsed address against the cache.
     */
    public ResolvedContent resolve(ParsedAddress parsed) {
        Objects.requireNonNull(parsed, "parsed is required");
        long startNanos = System.nanoTime();
        ResolvedContent result = doResolve(parsed);
        String outcome = result.found() ? "hit" : result.failure().name();
        metricsService.recordResolveDuration(outcome, Duration.ofNanos(System.nanoTime() - startNanos));
        return result;
    }

    private ResolvedContent doResolve(ParsedAddress parsed) {
        if (!parsed.valid()) {
            metricsService.recordInvalidAddress(parsed.failure());
            log.debug("resolve.invalid reason={} error={}", parsed.failure(), parsed.error());
            return ResolvedContent.failed(ResolutionFailure.INVALID_ADDRESS, parsed.error(),
                    "Supported address formats: " + addressFormats, null);
        }

        ResourceAddress address = parsed.address();
        if (!(address instanceof ResourceAddress.CacheBacked cacheBacked)) {
            log.debug("resolve.legacy resourceId={}", address.resourceId());
            return ResolvedContent.failed(ResolutionFailure.NOT_CACHE_BACKED, null, LEGACY_HINT, null);
        }

        String key = cacheBacked.resourceId();
        Optional<CacheEntry> entry = cache.get(key);
        if (entry.isEmpty()) {
            log.debug("resolve.miss resourceId={}", key);
            return ResolvedContent.failed(ResolutionFailure.CACHE_MISS,
                    "cache miss for " + key,
                    MISS_HINT,
                    "Fetch " + cacheBacked.type().kind().name().toLowerCase(Locale.ROOT) + " '" + key
                            + "' with returnMode 'summary', then read this address again");
        }

        String text = entry.get().text();
        switch (cacheBacked.action()) {
            case CONTENT:
            case CHUNK:
                String slice = cacheBacked.range().map(range -> range.sliceOf(text)).orElse(text);
                log.debug("resolve.hit resourceId={} action={} length={}", key, cacheBacked.action(), slice.length());
                return ResolvedContent.of(slice);
            case STRUCTURE:
                return unsupported(key, "Structure extraction not yet implemented",
                        "Use content or chunk actions to access document text",
                        addresses.documentContent(key));
            case VALUES:
                return unsupported(key, "Sheet values extraction not yet implemented",
                        "Use the value-range fetch operation for specific ranges, or read the cached text instead",
                        addresses.fileContent(key));
            default:
                throw new IllegalStateException("Unhandled action: " + cacheBacked.action());
        }
    }

    private ResolvedContent unsupported(String key, String error, String hint, String suggestion) {
        log.debug("resolve.unsupported resourceId={} error={}", key, error);
        return ResolvedContent.failed(ResolutionFailure.UNSUPPORTED_ACTION, error, hint, suggestion);
    }
}
