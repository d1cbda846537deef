package com.document.resource.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A spreadsheet as returned by the spreadsheets API: its title and the value ranges that were read.
 *
 * @param spreadsheetId the spreadsheet ID
 * @param title         the spreadsheet title
 * @param values        value ranges, in request order
 */
public record SpreadsheetPayload(
        String spreadsheetId,
        String title,
        List<SheetValues> values
) implements ResourcePayload {

    public SpreadsheetPayload {
        Objects.requireNonNull(spreadsheetId, "spreadsheetId is required");
        title = title != null ? title : "Untitled";
        values = values != null ? List.copyOf(values) : List.of();
    }

    @Override
    public String resourceId() {
        return spreadsheetId;
    }

    @Override
    public String displayName() {
        return title;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.SPREADSHEET;
    }

    /**
     * Returns the ranges covered by this payload.
     */
    public List<String> ranges() {
        return values.stream().map(SheetValues::range).toList();
    }

    /**
     * Renders each range as a {@code ## range} header followed by tab-separated rows.
     */
    @Override
    public String extractText() {
        StringBuilder sb = new StringBuilder();
        for (SheetValues range : values) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("## ").append(range.range()).append('\n');
            for (List<String> row : range.rows()) {
                sb.append(String.join("\t", row)).append('\n');
            }
        }
        return sb.toString();
    }
}
