package com.document.resource.address;

import com.document.resource.core.model.ResourceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AddressParser Tests")
class AddressParserTest {

    private final AddressParser parser = new AddressParser();

    private ResourceAddress parseValid(String uri) {
        ParsedAddress parsed = parser.parse(uri);
        assertTrue(parsed.valid(), () -> "expected valid: " + uri + " but got " + parsed.error());
        assertNull(parsed.failure());
        assertNull(parsed.error());
        return parsed.address();
    }

    private ParsedAddress parseInvalid(String uri, ParseFailure expected) {
        ParsedAddress parsed = parser.parse(uri);
        assertFalse(parsed.valid(), () -> "expected invalid: " + uri);
        assertNull(parsed.address());
        assertEquals(expected, parsed.failure());
        assertNotNull(parsed.error());
        return parsed;
    }

    @Nested
    @DisplayName("Legacy addresses")
    class LegacyTests {

        @Test
        @DisplayName("Should parse gdrive:///<id> as legacy")
        void parsesLegacy() {
            ResourceAddress address = parseValid("gdrive:///1AbCdEf");
            ResourceAddress.Legacy legacy = assertInstanceOf(ResourceAddress.Legacy.class, address);
            assertEquals("1AbCdEf", legacy.resourceId());
            assertFalse(address instanceof ResourceAddress.CacheBacked);
        }

        @Test
        @DisplayName("Should reject an empty legacy ID")
        void rejectsEmptyId() {
            ParsedAddress parsed = parseInvalid("gdrive:///", ParseFailure.EMPTY_IDENTIFIER);
            assertEquals("Empty file ID in legacy URI", parsed.error());
        }
    }

    @Nested
    @DisplayName("Document addresses")
    class DocumentTests {

        @Test
        @DisplayName("Should parse content")
        void parsesContent() {
            ResourceAddress.Document doc = assertInstanceOf(ResourceAddress.Document.class,
                    parseValid("gdrive://docs/doc1/content"));
            assertEquals("doc1", doc.resourceId());
            assertEquals(AddressType.DOCS, doc.type());
            assertEquals(AddressAction.CONTENT, doc.action());
            assertTrue(doc.range().isEmpty());
        }

        @Test
        @DisplayName("Should parse structure")
        void parsesStructure() {
            ResourceAddress.Document doc = assertInstanceOf(ResourceAddress.Document.class,
                    parseValid("gdrive://docs/doc1/structure"));
            assertEquals(AddressAction.STRUCTURE, doc.action());
        }

        @Test
        @DisplayName("Should parse chunk with its range")
        void parsesChunk() {
            ResourceAddress.Document doc = assertInstanceOf(ResourceAddress.Document.class,
                    parseValid("gdrive://docs/doc1/chunk/0-5000"));
            assertEquals(AddressAction.CHUNK, doc.action());
            assertEquals(new ChunkRange(0, 5000), doc.range().orElseThrow());
        }

        @Test
        @DisplayName("Should reject a reversed chunk range")
        void rejectsReversedRange() {
            ParsedAddress parsed = parseInvalid("gdrive://docs/xyz/chunk/10-5", ParseFailure.EMPTY_RANGE);
            assertTrue(parsed.error().contains("end"));
            assertTrue(parsed.error().contains("start"));
        }

        @Test
        @DisplayName("Should reject an empty chunk range")
        void rejectsEmptyRange() {
            ParsedAddress parsed = parseInvalid("gdrive://docs/xyz/chunk/5-5", ParseFailure.EMPTY_RANGE);
            assertEquals("Chunk end index must be greater than start index", parsed.error());
        }

        @Test
        @DisplayName("Should reject a chunk without range")
        void rejectsMissingRange() {
            ParsedAddress parsed = parseInvalid("gdrive://docs/doc1/chunk", ParseFailure.MISSING_RANGE);
            assertEquals("Chunk action requires range parameter (e.g., 0-5000)", parsed.error());
            parseInvalid("gdrive://docs/doc1/chunk/", ParseFailure.MISSING_RANGE);
        }

        @ParameterizedTest
        @ValueSource(strings = {"abc", "0-", "-5", "0_5", "1-2-3", "0-5x"})
        @DisplayName("Should reject malformed chunk ranges")
        void rejectsMalformedRange(String range) {
            ParsedAddress parsed = parseInvalid("gdrive://docs/doc1/chunk/" + range, ParseFailure.MALFORMED_RANGE);
            assertEquals("Invalid chunk range format. Use: {start}-{end} (e.g., 0-5000)", parsed.error());
        }

        @Test
        @DisplayName("Should reject offsets beyond the int range")
        void rejectsHugeOffsets() {
            ParsedAddress parsed = parseInvalid("gdrive://docs/doc1/chunk/0-99999999999", ParseFailure.MALFORMED_RANGE);
            assertEquals("Chunk range offsets must not exceed 2147483647", parsed.error());
        }

        @Test
        @DisplayName("Should reject a missing action")
        void rejectsMissingAction() {
            ParsedAddress parsed = parseInvalid("gdrive://docs/doc1", ParseFailure.MISSING_ACTION);
            assertEquals("Docs URI requires action: content, chunk, structure", parsed.error());
        }

        @Test
        @DisplayName("Should reject an unknown action")
        void rejectsUnknownAction() {
            ParsedAddress parsed = parseInvalid("gdrive://docs/doc1/outline", ParseFailure.UNKNOWN_ACTION);
            assertEquals("Unknown docs action: outline. Valid actions: content, chunk, structure", parsed.error());
        }

        @Test
        @DisplayName("Should ignore segments after the parameter")
        void ignoresExtraSegments() {
            ResourceAddress.Document doc = assertInstanceOf(ResourceAddress.Document.class,
                    parseValid("gdrive://docs/doc1/chunk/0-10/extra"));
            assertEquals(new ChunkRange(0, 10), doc.chunk());
        }
    }

    @Nested
    @DisplayName("Spreadsheet addresses")
    class SpreadsheetTests {

        @Test
        @DisplayName("Should parse values with a decoded range")
        void parsesValues() {
            ResourceAddress.Spreadsheet sheet = assertInstanceOf(ResourceAddress.Spreadsheet.class,
                    parseValid("gdrive://sheets/abc123/values/Sheet1%21A1%3AB2"));
            assertEquals("abc123", sheet.resourceId());
            assertEquals(AddressType.SHEETS, sheet.type());
            assertEquals(ResourceKind.SPREADSHEET, sheet.type().kind());
            assertEquals(AddressAction.VALUES, sheet.action());
            assertEquals("Sheet1!A1:B2", sheet.sheetRange());
        }

        @Test
        @DisplayName("Should keep a literal plus sign")
        void keepsPlus() {
            ResourceAddress.Spreadsheet sheet = assertInstanceOf(ResourceAddress.Spreadsheet.class,
                    parseValid("gdrive://sheets/abc/values/Q1+Q2%21A1"));
            assertEquals("Q1+Q2!A1", sheet.sheetRange());
        }

        @Test
        @DisplayName("Should reject values without range")
        void rejectsMissingRange() {
            ParsedAddress parsed = parseInvalid("gdrive://sheets/abc/values", ParseFailure.MISSING_RANGE);
            assertEquals("Sheets values action requires range parameter (e.g., Sheet1!A1:B10)", parsed.error());
        }

        @Test
        @DisplayName("Should reject a missing action")
        void rejectsMissingAction() {
            ParsedAddress parsed = parseInvalid("gdrive://sheets/abc", ParseFailure.MISSING_ACTION);
            assertEquals("Sheets URI requires \"values\" action", parsed.error());
        }

        @Test
        @DisplayName("Should reject a bad percent-encoding")
        void rejectsBadEncoding() {
            ParsedAddress parsed = parseInvalid("gdrive://sheets/abc/values/Sheet1%ZZ", ParseFailure.MALFORMED_ENCODING);
            assertTrue(parsed.error().startsWith("Invalid URL encoding in range parameter"));
        }
    }

    @Nested
    @DisplayName("File addresses")
    class FileTests {

        @Test
        @DisplayName("Should parse content without range")
        void parsesContent() {
            ResourceAddress.File file = assertInstanceOf(ResourceAddress.File.class,
                    parseValid("gdrive://files/f1/content"));
            assertEquals("f1", file.resourceId());
            assertTrue(file.range().isEmpty());
        }

        @Test
        @DisplayName("Should parse content with range")
        void parsesContentRange() {
            ResourceAddress.File file = assertInstanceOf(ResourceAddress.File.class,
                    parseValid("gdrive://files/f1/content/100-200"));
            assertEquals(new ChunkRange(100, 200), file.range().orElseThrow());
        }

        @Test
        @DisplayName("Should validate an optional range")
        void validatesRange() {
            ParsedAddress parsed = parseInvalid("gdrive://files/f1/content/9-3", ParseFailure.EMPTY_RANGE);
            assertEquals("Content end index must be greater than start index", parsed.error());
        }

        @Test
        @DisplayName("Should reject any action other than content")
        void rejectsOtherActions() {
            ParsedAddress parsed = parseInvalid("gdrive://files/f1/data", ParseFailure.UNKNOWN_ACTION);
            assertEquals("Files URI requires \"content\" action, got: data", parsed.error());
        }
    }

    @Nested
    @DisplayName("Malformed addresses")
    class MalformedTests {

        @ParameterizedTest
        @ValueSource(strings = {"", "http://docs/x/content", "gdrive:/docs/x", "GDRIVE://docs/x/content"})
        @DisplayName("Should reject a foreign scheme")
        void rejectsScheme(String uri) {
            ParsedAddress parsed = parseInvalid(uri, ParseFailure.INVALID_SCHEME);
            assertEquals("Invalid URI scheme - must start with gdrive://", parsed.error());
        }

        @Test
        @DisplayName("Should reject null")
        void rejectsNull() {
            parseInvalid(null, ParseFailure.INVALID_SCHEME);
        }

        @Test
        @DisplayName("Should reject a type without ID")
        void rejectsTypeOnly() {
            ParsedAddress parsed = parseInvalid("gdrive://docs", ParseFailure.MISSING_TYPE_OR_ID);
            assertEquals("URI must have at least type and resource ID", parsed.error());
            parseInvalid("gdrive://", ParseFailure.MISSING_TYPE_OR_ID);
        }

        @Test
        @DisplayName("Should reject an empty ID")
        void rejectsEmptyId() {
            ParsedAddress parsed = parseInvalid("gdrive://docs//content", ParseFailure.MISSING_TYPE_OR_ID);
            assertEquals("Missing resource ID", parsed.error());
        }

        @Test
        @DisplayName("Should reject an unknown type")
        void rejectsUnknownType() {
            ParsedAddress parsed = parseInvalid("gdrive://slides/abc/content", ParseFailure.UNKNOWN_TYPE);
            assertEquals("Unknown resource type: slides. Valid types: docs, sheets, files", parsed.error());
        }
    }

    @Nested
    @DisplayName("Custom scheme and rule table")
    class SchemeTests {

        @Test
        @DisplayName("Should parse addresses under a custom scheme only")
        void customScheme() {
            AddressParser custom = new AddressParser("drive");
            assertTrue(custom.parse("drive://docs/d/content").valid());
            ParsedAddress parsed = custom.parse("gdrive://docs/d/content");
            assertEquals(ParseFailure.INVALID_SCHEME, parsed.failure());
            assertEquals("Invalid URI scheme - must start with drive://", parsed.error());
        }

        @Test
        @DisplayName("Should reject a scheme that is not a bare name")
        void rejectsBadScheme() {
            assertThrows(IllegalArgumentException.class, () -> new AddressParser("gdrive://"));
            assertThrows(IllegalArgumentException.class, () -> new AddressParser(" "));
        }

        @Test
        @DisplayName("Should enumerate every supported combination in order")
        void enumeratesRules() {
            List<String> usages = AddressParser.supportedRules().stream().map(AddressRule::usage).toList();
            assertEquals(List.of(
                    "docs/{id}/content",
                    "docs/{id}/chunk/{start}-{end}",
                    "docs/{id}/structure",
                    "sheets/{id}/values/{url-encoded-range}",
                    "files/{id}/content[/{start}-{end}]"
            ), usages);
        }
    }
}
