package com.document.resource.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Cell values of one queried range of a spreadsheet.
 *
 * @param range the A1-notation range the values were read from (e.g. {@code Sheet1!A1:B2})
 * @param rows  cell values, row-major
 */
public record SheetValues(String range, List<List<String>> rows) {

    public SheetValues {
        Objects.requireNonNull(range, "range is required");
        rows = rows != null ? rows.stream().map(row -> List.copyOf(row)).toList() : List.of();
    }
}
