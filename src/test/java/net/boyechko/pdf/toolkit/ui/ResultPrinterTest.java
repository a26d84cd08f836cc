/*
 * PDF-Toolkit - Command-line PDF page assembly and extraction
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.toolkit.ui;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import net.boyechko.pdf.toolkit.core.Bookmark;
import net.boyechko.pdf.toolkit.engine.ActionKind;
import net.boyechko.pdf.toolkit.extract.Attachment;
import net.boyechko.pdf.toolkit.extract.DocumentInfo;
import net.boyechko.pdf.toolkit.extract.FormField;
import net.boyechko.pdf.toolkit.extract.PageObject;
import net.boyechko.pdf.toolkit.extract.PageText;
import org.junit.jupiter.api.Test;

class ResultPrinterTest {
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private ResultPrinter printer(OutputFormat format) {
        return new ResultPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8), format);
    }

    private List<String> lines() {
        return buffer.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private JsonNode json() throws Exception {
        return new ObjectMapper().readTree(buffer.toString(StandardCharsets.UTF_8));
    }

    // ── Text format ─────────────────────────────────────────────────

    @Test
    void bookmarksShowLevelTitleAndTarget() {
        printer(OutputFormat.TEXT)
                .printBookmarks(
                        List.of(
                                new Bookmark("Intro", 0, ActionKind.PAGE, 1),
                                new Bookmark("Site", 1, ActionKind.URI, null)));
        assertEquals(List.of("0> Intro\t[Page 1]", "1> Site\t[URI ]"), lines());
    }

    @Test
    void bookmarkWithoutActionPrintsEmptyTarget() {
        printer(OutputFormat.TEXT).printBookmarks(List.of(new Bookmark("Label", 0, null, null)));
        assertEquals(List.of("0> Label\t[ ]"), lines());
    }

    @Test
    void emptyBookmarks() {
        printer(OutputFormat.TEXT).printBookmarks(List.of());
        assertEquals(List.of("No bookmarks found"), lines());
    }

    @Test
    void attachmentsUseGroupedSizes() {
        printer(OutputFormat.TEXT)
                .printAttachments(
                        List.of(new Attachment(0, "big.bin", null, 1234567, null, null, "Blob")));
        assertEquals(
                List.of(
                        "Found 1 attachment(s):",
                        "",
                        "Attachment 0:",
                        "  Name: big.bin",
                        "  Size: 1,234,567 bytes",
                        "  MIME Type: ",
                        "  Description: Blob",
                        ""),
                lines());
    }

    @Test
    void noAttachments() {
        printer(OutputFormat.TEXT).printAttachments(List.of());
        assertEquals(List.of("No attachments found in the PDF document."), lines());
    }

    @Test
    void objectsShowBoundsWithTwoDecimals() {
        printer(OutputFormat.TEXT)
                .printObjects(List.of(new PageObject(2, PageObject.Type.IMAGE, 1f, 2.5f, 3.125f, 4f)));
        assertEquals(
                List.of(
                        "Found 1 objects:",
                        " - Page: 2, Type: Image, Bounds: [L: 1.00, B: 2.50, R: 3.13, T: 4.00]"),
                lines());
    }

    @Test
    void infoListsEveryKey() {
        printer(OutputFormat.TEXT)
                .printInfo(
                        new DocumentInfo(
                                3, "Ann", null, null, null, "iText", null, null, "T", "1.7", null));
        List<String> lines = lines();
        assertEquals(11, lines.size());
        assertEquals("Pages = 3", lines.get(0));
        assertEquals("Author = Ann", lines.get(1));
        assertEquals("Version = 1.7", lines.get(9));
        assertEquals("Trapped = ", lines.get(10));
    }

    // ── JSON format ─────────────────────────────────────────────────

    @Test
    void textAsJsonCarriesCounts() throws Exception {
        printer(OutputFormat.JSON).printText(List.of(PageText.of(4, "two words")));
        JsonNode page = json().get(0);
        assertEquals(4, page.get("page").asInt());
        assertEquals(2, page.get("words").asInt());
        assertEquals("two words", page.get("text").asText());
    }

    @Test
    void bookmarksAsJsonUseActionLabels() throws Exception {
        printer(OutputFormat.JSON)
                .printBookmarks(List.of(new Bookmark("Web", 0, ActionKind.REMOTE_GOTO, null)));
        JsonNode bookmark = json().get(0);
        assertEquals("REMOTEGOTO", bookmark.get("action").asText());
        assertTrue(bookmark.get("page").isNull());
    }

    @Test
    void bookmarkWithoutActionIsJsonNull() throws Exception {
        printer(OutputFormat.JSON).printBookmarks(List.of(new Bookmark("Label", 0, null, null)));
        assertTrue(json().get(0).get("action").isNull());
    }

    @Test
    void formFieldsAsJson() throws Exception {
        printer(OutputFormat.JSON)
                .printFormFields(List.of(new FormField(null, "sig", "Signature", null, "")));
        JsonNode field = json().get(0);
        assertEquals("sig", field.get("name").asText());
        assertTrue(field.get("page").isNull());
    }

    @Test
    void formatNames() {
        assertEquals(OutputFormat.TEXT, OutputFormat.fromName(null));
        assertEquals(OutputFormat.JSON, OutputFormat.fromName("JSON"));
        IllegalArgumentException e =
                assertThrows(IllegalArgumentException.class, () -> OutputFormat.fromName("xml"));
        assertEquals("Invalid output format: xml. Valid formats are: text, json", e.getMessage());
    }
}
