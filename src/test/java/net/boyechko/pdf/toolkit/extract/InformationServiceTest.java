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

import com.itextpdf.kernel.pdf.PdfName;
import java.nio.file.Path;
import net.boyechko.pdf.toolkit.PdfTestBase;
import net.boyechko.pdf.toolkit.core.PdfOperationException;
import net.boyechko.pdf.toolkit.document.PdfCustodian;
import org.junit.jupiter.api.Test;

class InformationServiceTest extends PdfTestBase {

    @Test
    void readsInformationDictionary() throws Exception {
        Path input =
                createNumberedPdf(
                        "info.pdf",
                        2,
                        pdf ->
                                pdf.getDocumentInfo()
                                        .setTitle("Annual Report")
                                        .setAuthor("R. Roe")
                                        .setSubject("Finances")
                                        .setKeywords("budget, 2025")
                                        .setCreator("Test Suite")
                                        .setTrapped(PdfName.True));

        DocumentInfo info = new InformationService().read(new PdfCustodian(input));

        assertEquals(2, info.pages());
        assertEquals("Annual Report", info.title());
        assertEquals("R. Roe", info.author());
        assertEquals("Finances", info.subject());
        assertEquals("budget, 2025", info.keywords());
        assertEquals("Test Suite", info.creator());
        assertEquals("True", info.trapped());
        assertEquals("1.7", info.version());
        assertNotNull(info.producer());
        assertTrue(info.creationDate().startsWith("D:"));
    }

    @Test
    void missingEntriesAreNull() throws Exception {
        Path input = createNumberedPdf("plain.pdf", 1);

        DocumentInfo info = new InformationService().read(new PdfCustodian(input));

        assertEquals(1, info.pages());
        assertNull(info.title());
        assertNull(info.author());
        assertNull(info.trapped());
    }

    @Test
    void trappedWrittenAsStringIsRead() throws Exception {
        Path input =
                createNumberedPdf(
                        "trapped.pdf",
                        1,
                        pdf -> pdf.getDocumentInfo().setMoreInfo("Trapped", "Unknown"));

        assertEquals("Unknown", new InformationService().read(new PdfCustodian(input)).trapped());
    }

    @Test
    void readsEncryptedDocumentWithPassword() throws Exception {
        Path input = createEncryptedPdf("locked.pdf", 2);

        DocumentInfo info = new InformationService().read(new PdfCustodian(input, USER_PASSWORD));

        assertEquals(2, info.pages());
        assertNull(info.trapped());
    }

    @Test
    void wrongPasswordFails() throws Exception {
        Path input = createEncryptedPdf("locked.pdf", 1);
        assertThrows(
                PdfOperationException.class,
                () -> new InformationService().read(new PdfCustodian(input, "nope")));
    }
}
