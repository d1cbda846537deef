package com.document.resource.truncation;

import com.document.resource.metrics.MetricsService;
import com.document.resource.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bounds a response payload to a character limit.
 *
 * <p>Text within the limit is returned as is. Longer text is cut to the limit and followed by a
 * footer stating both lengths and what the caller can do instead:</p>
 * <pre>
 * ...first 25,000 characters...
 *
 * --- TRUNCATED ---
 * Response truncated from 80,412 to 25,000 characters.
 * Use returnMode: 'summary' or narrower parameters to manage response size.
 * </pre>
 *
 * <p>Output of this guard, a prefix within the limit followed by the footer and nothing longer
 * than the hint, is returned unchanged, so applying the guard twice with the same hint cuts only
 * once. A footer anywhere else in the text does not exempt it.</p>
 */
public class TruncationGuard {
    private static final Logger log = LoggerFactory.getLogger(TruncationGuard.class);

    public static final int DEFAULT_LIMIT = 25_000;
    public static final String DEFAULT_HINT =
            "Use returnMode: 'summary' or narrower parameters to manage response size.";
    public static final String MARKER = "--- TRUNCATED ---";

    private static final Pattern FOOTER = Pattern.compile(
            "\n\n" + Pattern.quote(MARKER) + "\nResponse truncated from ([\\d,]+) to ([\\d,]+) characters\\.\n");

    private final int defaultLimit;
    private final MetricsService metricsService;

    public TruncationGuard() {
        this(DEFAULT_LIMIT, new NoOpMetricsService());
    }

    public TruncationGuard(int defaultLimit, MetricsService metricsService) {
        this.defaultLimit = requireLimit(defaultLimit);
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    public int defaultLimit() {
        return defaultLimit;
    }

    public TruncationResult truncate(String text) {
        return truncate(text, defaultLimit, DEFAULT_HINT);
    }

    public TruncationResult truncate(String text, int limit) {
        return truncate(text, limit, DEFAULT_HINT);
    }

    /**
     * Truncates with the default limit and a caller-specific hint.
     */
    public TruncationResult truncateWithHint(String text, String hint) {
        return truncate(text, defaultLimit, hint);
    }

    /**
     * Bounds {@code text} to {@code limit} characters.
     *
     * @param text  the payload
     * @param limit maximum characters kept from the payload, >= 0
     * @param hint  advice appended to the footer; an empty hint is kept empty
     */
    public TruncationResult truncate(String text, int limit, String hint) {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(hint, "hint is required");
        requireLimit(limit);

        if (text.length() <= limit || alreadyTruncated(text, limit, hint)) {
            return TruncationResult.unchanged(text);
        }

        String bounded = text.substring(0, limit) + footer(text.length(), limit, hint);
        metricsService.recordTruncation(text.length());
        log.debug("truncation.applied originalLength={} limit={}", text.length(), limit);
        return TruncationResult.truncated(bounded, text.length());
    }

    static String footer(int originalLength, int limit, String hint) {
        return "\n\n" + MARKER + "\n"
                + "Response truncated from " + group(originalLength) + " to " + group(limit) + " characters.\n"
                + hint;
    }

    /**
     * The footer must start right after the kept prefix, and only the hint may follow it.
     */
    private static boolean alreadyTruncated(String text, int limit, String hint) {
        Matcher matcher = FOOTER.matcher(text);
        while (matcher.find()) {
            long keptLength;
            try {
                keptLength = Long.parseLong(matcher.group(2).replace(",", ""));
            } catch (NumberFormatException e) {
                continue;
            }
            if (matcher.start() != keptLength || keptLength > limit) {
                continue;
            }
            String rest = text.substring(matcher.end());
            if (rest.length() <= hint.length() && !rest.contains(MARKER)) {
                return true;
            }
        }
        return false;
    }

    private static String group(int value) {
        return String.format(Locale.US, "%,d", value);
    }

    private static int requireLimit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        return limit;
    }
}
