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
package net.boyechko.pdf.toolkit.extract;

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.io.font.constants.StandardFonts;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class WatermarkOptionsTest {

    private static WatermarkOptions.WatermarkOptionsBuilder text() {
        return new WatermarkOptions.WatermarkOptionsBuilder().withText("DRAFT");
    }

    @Test
    void defaultsApply() {
        WatermarkOptions options = text().build();
        assertTrue(options.isText());
        assertEquals(StandardFonts.HELVETICA, options.font());
        assertEquals(50f, options.fontSize());
        assertEquals(255, options.red());
        assertEquals(0, options.green());
        assertEquals(50, options.opacity());
        assertEquals(45f, options.rotation());
    }

    @Test
    void textOrImageIsRequired() {
        IllegalArgumentException e =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> new WatermarkOptions.WatermarkOptionsBuilder().build());
        assertEquals("Either --text or --image must be specified for watermarking.", e.getMessage());
    }

    @Test
    void textAndImageAreExclusive() {
        IllegalArgumentException e =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> text().withImage(Path.of("logo.png")).build());
        assertEquals("Both --text and --image cannot be specified simultaneously.", e.getMessage());
    }

    @Test
    void rangesAreChecked() {
        assertThrows(IllegalArgumentException.class, () -> text().withOpacity(256).build());
        assertThrows(IllegalArgumentException.class, () -> text().withColor(0, -1, 0).build());
        assertThrows(IllegalArgumentException.class, () -> text().withFontSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> text().withScale(-1).build());
    }

    @Test
    void fontNamesMatchCaseInsensitively() {
        assertEquals(StandardFonts.TIMES_BOLD, text().withFont("times-bold").build().font());
        assertThrows(IllegalArgumentException.class, () -> text().withFont("Comic Sans").build());
    }

    @Test
    void parsesColors() {
        assertArrayEquals(new int[] {10, 20, 30}, WatermarkOptions.parseColor(" 10, 20 ,30"));
        assertThrows(IllegalArgumentException.class, () -> WatermarkOptions.parseColor("1,2"));
        assertThrows(IllegalArgumentException.class, () -> WatermarkOptions.parseColor("1,2,x"));
        assertThrows(IllegalArgumentException.class, () -> WatermarkOptions.parseColor("1,2,300"));
    }
}
