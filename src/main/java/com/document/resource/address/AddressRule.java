package com.document.resource.address;

import java.util.Objects;
import java.util.function.BiFunction;

/**
 * One supported {@code (type, action)} combination of the address grammar: which parameter
 * segment it takes and how the validated parts become a {@link ResourceAddress}.
 *
 * @param type    the type segment
 * @param action  the action segment
 * @param params  what the parameter segment must hold
 * @param factory builds the address from the resource ID and the validated parameters
 */
public record AddressRule(
        AddressType type,
        AddressAction action,
        ParamPolicy params,
        BiFunction<String, Params, ResourceAddress> factory
) {

    public AddressRule {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(params, "params is required");
        Objects.requireNonNull(factory, "factory is required");
    }

    public enum ParamPolicy {
        /** No parameter segment; one given is ignored. */
        NONE,
        /** A {@code start-end} range is mandatory. */
        RANGE_REQUIRED,
        /** A {@code start-end} range may follow; absent means the whole text. */
        RANGE_OPTIONAL,
        /** A URL-encoded spreadsheet range is mandatory. */
        SHEET_RANGE_REQUIRED
    }

    /**
     * Validated parameters; at most one is non-null.
     *
     * @param chunk      character range, for range policies
     * @param sheetRange decoded spreadsheet range, for {@link ParamPolicy#SHEET_RANGE_REQUIRED}
     */
    public record Params(ChunkRange chunk, String sheetRange) {

        static final Params NONE = new Params(null, null);

        static Params ofChunk(ChunkRange chunk) {
            return new Params(chunk, null);
        }

        static Params ofSheetRange(String sheetRange) {
            return new Params(null, sheetRange);
        }
    }

    /**
     * Returns the address shape this rule accepts, e.g. {@code docs/{id}/chunk/{start}-{end}}.
     */
    public String usage() {
        String base = type.segment() + "/{id}/" + action.segment();
        return switch (params) {
            case NONE -> base;
            case RANGE_REQUIRED -> base + "/{start}-{end}";
            case RANGE_OPTIONAL -> base + "[/{start}-{end}]";
            case SHEET_RANGE_REQUIRED -> base + "/{url-encoded-range}";
        };
    }
}
