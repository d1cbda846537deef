package com.document.resource.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResourcePayload Tests")
class ResourcePayloadTest {

    @Test
    @DisplayName("Document text should join paragraphs with newlines")
    void documentText() {
        DocumentPayload doc = new DocumentPayload("d1", null, null, List.of("One", "Two"));
        assertEquals("One\nTwo", doc.extractText());
        assertEquals("Untitled", doc.displayName());
        assertEquals(ResourceKind.DOCUMENT, doc.kind());
    }

    @Test
    @DisplayName("Spreadsheet text should render each range as a tab-separated block")
    void spreadsheetText() {
        SpreadsheetPayload sheet = new SpreadsheetPayload("s1", "Budget", List.of(
                new SheetValues("Sheet1!A1:B2", List.of(List.of("a", "b"), List.of("1", "2"))),
                new SheetValues("Sheet2!A1", List.of(List.of("x")))
        ));

        assertEquals("## Sheet1!A1:B2\na\tb\n1\t2\n\n## Sheet2!A1\nx\n", sheet.extractText());
        assertEquals(List.of("Sheet1!A1:B2", "Sheet2!A1"), sheet.ranges());
        assertEquals(ResourceKind.SPREADSHEET, sheet.kind());
    }

    @Test
    @DisplayName("File payload should default name, type and body")
    void fileDefaults() {
        FilePayload file = new FilePayload("f1", null, null, null);
        assertAll(
                () -> assertEquals("Untitled", file.name()),
                () -> assertEquals("application/octet-stream", file.mimeType()),
                () -> assertEquals("", file.extractText()),
                () -> assertEquals("f1", file.resourceId())
        );
    }

    @Test
    @DisplayName("Should require an ID")
    void requiresId() {
        assertThrows(NullPointerException.class, () -> new DocumentPayload(null, "t", null, List.of()));
        assertThrows(NullPointerException.class, () -> new SpreadsheetPayload(null, "t", List.of()));
    }
}
