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
package net.boyechko.pdf.toolkit.core;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ToolkitDefaultsTest {
    @TempDir Path tempDir;

    private Path yaml(String content) throws Exception {
        Path file = tempDir.resolve("defaults.yaml");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void builtInValues() {
        ToolkitDefaults defaults = ToolkitDefaults.builtIn();
        assertEquals(200, defaults.dpi);
        assertEquals("png", defaults.image_format);
        assertNull(defaults.name_template);
        assertEquals(612f, defaults.blank_page_width);
        assertEquals(792f, defaults.blank_page_height);
        assertFalse(defaults.strict_merge);
        assertEquals("255,0,0", defaults.watermark.color);
        assertTrue(defaults.validateConsistency().isEmpty());
    }

    @Test
    void bundledResourceMatchesBuiltIns() {
        ToolkitDefaults defaults = ToolkitDefaults.loadDefault();
        assertEquals(200, defaults.dpi);
        assertEquals("png", defaults.image_format);
        assertEquals(100, defaults.bookmark_title_max_length);
        assertEquals(50f, defaults.watermark.font_size);
        assertEquals(45f, defaults.watermark.rotation);
        assertEquals(50, defaults.watermark.opacity);
    }

    @Test
    void partialFileKeepsBuiltInsForMissingKeys() throws Exception {
        ToolkitDefaults defaults =
                ToolkitDefaults.fromFile(yaml("dpi: 300\nwatermark:\n  opacity: 128\n"));
        assertEquals(300, defaults.dpi);
        assertEquals("png", defaults.image_format);
        assertEquals(128, defaults.watermark.opacity);
        assertEquals("Helvetica", defaults.watermark.font);
        assertEquals(1.0f, defaults.watermark.scale);
    }

    @Test
    void emptyFileYieldsBuiltIns() throws Exception {
        ToolkitDefaults defaults = ToolkitDefaults.fromFile(yaml(""));
        assertEquals(200, defaults.dpi);
        assertEquals(612f, defaults.blank_page_width);
    }

    @Test
    void unusableValuesAreReplacedAndReported() {
        ToolkitDefaults defaults = ToolkitDefaults.builtIn();
        defaults.dpi = 0;
        defaults.image_format = "svg";
        defaults.name_template = "  ";
        defaults.watermark.color = "300,0,0";
        defaults.watermark.opacity = -1;

        List<String> warnings = defaults.validateConsistency();

        assertEquals(4, warnings.size());
        assertEquals(200, defaults.dpi);
        assertEquals("png", defaults.image_format);
        assertNull(defaults.name_template);
        assertEquals("255,0,0", defaults.watermark.color);
        assertEquals(50, defaults.watermark.opacity);
        assertTrue(warnings.get(0).startsWith("dpi 0 is outside 1-2400"));
    }

    @Test
    void invalidValuesInFileFallBack() throws Exception {
        ToolkitDefaults defaults =
                ToolkitDefaults.fromFile(yaml("dpi: 5000\nblank_page_width: -3\n"));
        assertEquals(200, defaults.dpi);
        assertEquals(612f, defaults.blank_page_width);
    }

    @Test
    void unknownKeyIsAParseError() throws Exception {
        Path file = yaml("resolution: 300\n");
        assertThrows(IllegalStateException.class, () -> ToolkitDefaults.fromFile(file));
    }

    @Test
    void missingSources() {
        assertThrows(
                IllegalArgumentException.class,
                () -> ToolkitDefaults.fromFile(tempDir.resolve("absent.yaml")));
        IllegalArgumentException e =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> ToolkitDefaults.fromResource("/absent.yaml"));
        assertEquals("Resource not found: /absent.yaml", e.getMessage());
    }
}
