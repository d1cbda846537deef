package com.document.resource.address;

import com.document.resource.address.AddressRule.ParamPolicy;
import com.document.resource.address.AddressRule.Params;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses content address strings into {@link ParsedAddress} values.
 *
 * <p>Grammar, for scheme {@code gdrive}:</p>
 * <pre>
 * gdrive:///&lt;id&gt;                              legacy, not cache-backed
 * gdrive://docs/&lt;id&gt;/content
 * gdrive://docs/&lt;id&gt;/chunk/&lt;start&gt;-&lt;end&gt;
 * gdrive://docs/&lt;id&gt;/structure
 * gdrive://sheets/&lt;id&gt;/values/&lt;url-encoded-range&gt;
 * gdrive://files/&lt;id&gt;/content[/&lt;start&gt;-&lt;end&gt;]
 * </pre>
 *
 * <p>The supported {@code (type, action)} pairs live in {@link #supportedRules()}; the parser only
 * splits the string and applies the matching rule. Parsing never throws: every rejection is an
 * invalid {@link ParsedAddress} carrying a {@link ParseFailure} and a message.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public class AddressParser {

    public static final String DEFAULT_SCHEME = "gdrive";

    private static final Pattern RANGE_PATTERN = Pattern.compile("^(\\d+)-(\\d+)$");

    private static final List<AddressRule> RULES = List.of(
            new AddressRule(AddressType.DOCS, AddressAction.CONTENT, ParamPolicy.NONE,
                    (id, p) -> new ResourceAddress.Document(id, AddressAction.CONTENT, null)),
            new AddressRule(AddressType.DOCS, AddressAction.CHUNK, ParamPolicy.RANGE_REQUIRED,
                    (id, p) -> new ResourceAddress.Document(id, AddressAction.CHUNK, p.chunk())),
            new AddressRule(AddressType.DOCS, AddressAction.STRUCTURE, ParamPolicy.NONE,
                    (id, p) -> new ResourceAddress.Document(id, AddressAction.STRUCTURE, null)),
            new AddressRule(AddressType.SHEETS, AddressAction.VALUES, ParamPolicy.SHEET_RANGE_REQUIRED,
                    (id, p) -> new ResourceAddress.Spreadsheet(id, p.sheetRange())),
            new AddressRule(AddressType.FILES, AddressAction.CONTENT, ParamPolicy.RANGE_OPTIONAL,
                    (id, p) -> new ResourceAddress.File(id, p.chunk()))
    );

    private final String scheme;
    private final String legacyPrefix;
    private final String structuredPrefix;

    public AddressParser() {
        this(DEFAULT_SCHEME);
    }

    public AddressParser(String scheme) {
        Objects.requireNonNull(scheme, "scheme is required");
        if (scheme.isBlank() || scheme.contains(":") || scheme.contains("/")) {
            throw new IllegalArgumentException("scheme must be a bare name such as 'gdrive'");
        }
        this.scheme = scheme;
        this.legacyPrefix = scheme + ":///";
        this.structuredPrefix = scheme + "://";
    }

    public String scheme() {
        return scheme;
    }

    /**
     * Returns every supported {@code (type, action)} combination, in grammar order.
     */
    public static List<AddressRule> supportedRules() {
        return RULES;
    }

    /**
     * Parses an address string.
     *
     * @param uri the address, may be null
     * @return a valid address, or the reason it was rejected
     */
    public ParsedAddress parse(String uri) {
        if (uri == null) {
            return invalidScheme();
        }
        if (uri.startsWith(legacyPrefix)) {
            String id = uri.substring(legacyPrefix.length());
            if (id.isEmpty()) {
                return ParsedAddress.invalid(ParseFailure.EMPTY_IDENTIFIER, "Empty file ID in legacy URI");
            }
            return ParsedAddress.of(new ResourceAddress.Legacy(id));
        }
        if (!uri.startsWith(structuredPrefix)) {
            return invalidScheme();
        }

        String[] segments = uri.substring(structuredPrefix.length()).split("/", -1);
        if (segments.length < 2 || segments[0].isEmpty()) {
            return ParsedAddress.invalid(ParseFailure.MISSING_TYPE_OR_ID,
                    "URI must have at least type and resource ID");
        }
        String typeSegment = segments[0];
        String resourceId = segments[1];
        String actionSegment = segment(segments, 2);
        String paramSegment = segment(segments, 3);

        if (resourceId.isEmpty()) {
            return ParsedAddress.invalid(ParseFailure.MISSING_TYPE_OR_ID, "Missing resource ID");
        }

        Optional<AddressType> type = AddressType.fromSegment(typeSegment);
        if (type.isEmpty()) {
            return ParsedAddress.invalid(ParseFailure.UNKNOWN_TYPE,
                    "Unknown resource type: " + typeSegment + ". Valid types: " + AddressType.supportedSegments());
        }

        List<AddressRule> typeRules = rulesFor(type.get());
        if (actionSegment == null) {
            return ParsedAddress.invalid(ParseFailure.MISSING_ACTION, missingActionMessage(type.get(), typeRules));
        }
        Optional<AddressRule> rule = typeRules.stream()
                .filter(r -> r.action().segment().equals(actionSegment))
                .findFirst();
        if (rule.isEmpty()) {
            return ParsedAddress.invalid(ParseFailure.UNKNOWN_ACTION,
                    unknownActionMessage(type.get(), typeRules, actionSegment));
        }

        return apply(rule.get(), resourceId, paramSegment);
    }

    private ParsedAddress apply(AddressRule rule, String resourceId, String paramSegment) {
        String label = rangeLabel(rule.action());
        switch (rule.params()) {
            case NONE:
                return ParsedAddress.of(rule.factory().apply(resourceId, Params.NONE));
            case RANGE_OPTIONAL:
                if (paramSegment == null) {
                    return ParsedAddress.of(rule.factory().apply(resourceId, Params.NONE));
                }
                return parseRange(paramSegment, label, rule, resourceId);
            case RANGE_REQUIRED:
                if (paramSegment == null) {
                    return ParsedAddress.invalid(ParseFailure.MISSING_RANGE,
                            capitalize(label) + " action requires range parameter (e.g., 0-5000)");
                }
                return parseRange(paramSegment, label, rule, resourceId);
            case SHEET_RANGE_REQUIRED:
                if (paramSegment == null) {
                    return ParsedAddress.invalid(ParseFailure.MISSING_RANGE,
                            "Sheets values action requires range parameter (e.g., Sheet1!A1:B10)");
                }
                return decodeSheetRange(paramSegment)
                        .map(range -> ParsedAddress.of(rule.factory().apply(resourceId, Params.ofSheetRange(range))))
                        .orElseGet(() -> ParsedAddress.invalid(ParseFailure.MALFORMED_ENCODING,
                                "Invalid URL encoding in range parameter: " + paramSegment));
            default:
                throw new IllegalStateException("Unhandled parameter policy: " + rule.params());
        }
    }

    private ParsedAddress parseRange(String paramSegment, String label, AddressRule rule, String resourceId) {
        Matcher matcher = RANGE_PATTERN.matcher(paramSegment);
        if (!matcher.matches()) {
            return ParsedAddress.invalid(ParseFailure.MALFORMED_RANGE,
                    "Invalid " + label + " range format. Use: {start}-{end} (e.g., 0-5000)");
        }
        int start;
        int end;
        try {
            start = Integer.parseInt(matcher.group(1));
            end = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            return ParsedAddress.invalid(ParseFailure.MALFORMED_RANGE,
                    capitalize(label) + " range offsets must not exceed " + Integer.MAX_VALUE);
        }
        if (start < 0) {
            return ParsedAddress.invalid(ParseFailure.NEGATIVE_START,
                    capitalize(label) + " start index cannot be negative");
        }
        if (end <= start) {
            return ParsedAddress.invalid(ParseFailure.EMPTY_RANGE,
                    capitalize(label) + " end index must be greater than start index");
        }
        return ParsedAddress.of(rule.factory().apply(resourceId, Params.ofChunk(new ChunkRange(start, end))));
    }

    /**
     * Percent-decodes a range segment. A literal '+' is kept as is, matching URI component decoding.
     */
    private static Optional<String> decodeSheetRange(String segment) {
        try {
            return Optional.of(URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private ParsedAddress invalidScheme() {
        return ParsedAddress.invalid(ParseFailure.INVALID_SCHEME,
                "Invalid URI scheme - must start with " + structuredPrefix);
    }

    private static List<AddressRule> rulesFor(AddressType type) {
        return RULES.stream().filter(r -> r.type() == type).toList();
    }

    private static String missingActionMessage(AddressType type, List<AddressRule> typeRules) {
        if (typeRules.size() == 1) {
            return capitalize(type.segment()) + " URI requires \"" + typeRules.get(0).action().segment() + "\" action";
        }
        return capitalize(type.segment()) + " URI requires action: " + actionList(typeRules);
    }

    private static String unknownActionMessage(AddressType type, List<AddressRule> typeRules, String action) {
        if (typeRules.size() == 1) {
            return capitalize(type.segment()) + " URI requires \"" + typeRules.get(0).action().segment()
                    + "\" action, got: " + action;
        }
        return "Unknown " + type.segment() + " action: " + action + ". Valid actions: " + actionList(typeRules);
    }

    private static String actionList(List<AddressRule> typeRules) {
        return typeRules.stream().map(r -> r.action().segment()).collect(Collectors.joining(", "));
    }

    private static String rangeLabel(AddressAction action) {
        return action == AddressAction.CHUNK ? "chunk" : "content";
    }

    private static String segment(String[] segments, int index) {
        if (index >= segments.length || segments[index].isEmpty()) {
            return null;
        }
        return segments[index];
    }

    private static String capitalize(String s) {
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1);
    }
}
