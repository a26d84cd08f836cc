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

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NamingStrategyTest {
    private final NamingStrategy naming = new NamingStrategy();

    // ── Precedence ──────────────────────────────────────────────────

    @Test
    void defaultNameIsOriginalDashPaddedPage() {
        assertEquals("report-007", naming.resolve(7, "report", null, null, null));
    }

    @Test
    void overrideWinsOverEverything() {
        String name =
                naming.resolve(
                        2, "report", Map.of(2, "Cover"), Map.of(2, "Bookmark"), "{original}_{page}");
        assertEquals("Cover", name);
    }

    @Test
    void bookmarkTitleWinsOverTemplate() {
        String name = naming.resolve(2, "report", Map.of(), Map.of(2, "Intro"), "{page}");
        assertEquals("Intro", name);
    }

    @Test
    void templateReplacesPlaceholders() {
        assertEquals("report_page012", naming.resolve(12, "report", null, null, "{original}_page{page}"));
    }

    @Test
    void unusableOverrideFallsThroughToTheNextSource() {
        assertEquals("report-001", naming.resolve(1, "report", Map.of(1, "???"), null, null));
    }

    @Test
    void bookmarkTitlesAreSanitizedAndTruncated() {
        NamingStrategy shortTitles = new NamingStrategy(5);
        assertEquals("Chapt", shortTitles.resolve(1, "doc", null, Map.of(1, "Chapter/One"), null));
    }

    @Test
    void originalStemIsSanitized() {
        assertEquals("mydoc-001", naming.resolve(1, "my:doc", null, null, null));
    }

    @Test
    void resolvedNamesAreAlwaysValid() {
        String name = naming.resolve(3, "a*b", Map.of(3, "x/y"), null, null);
        assertTrue(FilenameSanitizer.isValid(name));
    }

    @Test
    void titleLimitMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new NamingStrategy(0));
    }

    // ── Helpers ─────────────────────────────────────────────────────

    @Test
    void padsPagesToThreeDigitsWithoutTruncating() {
        assertEquals("001", NamingStrategy.padPage(1));
        assertEquals("1234", NamingStrategy.padPage(1234));
    }

    @Test
    void stemDropsOnlyTheLastExtension() {
        assertEquals("archive.tar", NamingStrategy.stem(Path.of("/tmp/archive.tar.gz")));
        assertEquals(".hidden", NamingStrategy.stem(Path.of(".hidden")));
    }

    // ── Name lists ──────────────────────────────────────────────────

    @Test
    void nameListAssignsConsecutivePages() {
        assertEquals(
                Map.of(1, "Cover", 2, "Contents"),
                NamingStrategy.parseNameList(List.of("Cover", "Contents")));
    }

    @Test
    void explicitEntryMovesTheCounter() {
        Map<Integer, String> names =
                NamingStrategy.parseNameList(List.of("Cover", "5=Appendix", "Index"));
        assertEquals(Map.of(1, "Cover", 5, "Appendix", 6, "Index"), names);
    }

    @Test
    void blankLinesAdvanceTheCounter() {
        assertEquals(
                Map.of(1, "A", 3, "C"), NamingStrategy.parseNameList(List.of("A", "", "C")));
    }

    @Test
    void firstAssignmentOfAPageWins() {
        Map<Integer, String> names = NamingStrategy.parseNameList(List.of("2=First", "1=One", "Second"));
        assertEquals("First", names.get(2));
    }

    @Test
    void malformedKeysAreIgnored() {
        Map<Integer, String> names = NamingStrategy.parseNameList(List.of("x=Nope", "Two"));
        assertEquals(Map.of(2, "Two"), names);
    }
}
