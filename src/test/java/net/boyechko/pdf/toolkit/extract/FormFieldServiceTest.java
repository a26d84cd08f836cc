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

import com.itextpdf.kernel.geom.Rectangle;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.pdf.toolkit.PdfTestBase;
import net.boyechko.pdf.toolkit.document.PdfCustodian;
import org.junit.jupiter.api.Test;

class FormFieldServiceTest extends PdfTestBase {

    @Test
    void listsTextFieldsByPage() throws Exception {
        Path input =
                createNumberedPdf(
                        "form.pdf",
                        2,
                        pdf -> {
                            addTextField(pdf, "city", "Seattle", 2, new Rectangle(72, 500, 200, 20));
                            addTextField(pdf, "name", "Alice", 1, new Rectangle(100, 600, 200, 30));
                        });

        List<FormField> fields = new FormFieldService().list(new PdfCustodian(input));

        assertEquals(2, fields.size());
        assertEquals(
                new FormField(1, "name", "Text", "Alice", "100.00,600.00,300.00,630.00"),
                fields.get(0));
        assertEquals(
                new FormField(2, "city", "Text", "Seattle", "72.00,500.00,272.00,520.00"),
                fields.get(1));
    }

    @Test
    void documentWithoutFormHasNoFields() throws Exception {
        Path input = createNumberedPdf("plain.pdf", 1);
        assertTrue(new FormFieldService().list(new PdfCustodian(input)).isEmpty());
    }
}
