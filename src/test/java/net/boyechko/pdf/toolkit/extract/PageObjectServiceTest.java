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
import com.itextpdf.kernel.pdf.canvas.PdfCanvas;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.pdf.toolkit.PdfTestBase;
import net.boyechko.pdf.toolkit.core.PageSelection;
import net.boyechko.pdf.toolkit.document.PdfCustodian;
import org.junit.jupiter.api.Test;

class PageObjectServiceTest extends PdfTestBase {

    @Test
    void listsTextPathsAndAnnotationsInOrder() throws Exception {
        Path input =
                createNumberedPdf(
                        "objects.pdf",
                        2,
                        pdf -> {
                            new PdfCanvas(pdf.getPage(1))
                                    .rectangle(100, 100, 50, 40)
                                    .fill()
                                    .release();
                            addTextField(pdf, "field", "x", 1, new Rectangle(300, 300, 100, 20));
                        });

        List<PageObject> objects =
                new PageObjectService().list(new PdfCustodian(input), PageSelection.parse("1"));

        assertEquals(
                List.of(PageObject.Type.TEXT, PageObject.Type.PATH, PageObject.Type.ANNOTATION),
                objects.stream().map(PageObject::type).toList());
        assertTrue(objects.stream().allMatch(o -> o.page() == 1));

        PageObject path = objects.get(1);
        assertEquals(100f, path.left(), 0.01f);
        assertEquals(100f, path.bottom(), 0.01f);
        assertEquals(150f, path.right(), 0.01f);
        assertEquals(140f, path.top(), 0.01f);

        PageObject text = objects.get(0);
        assertEquals(72f, text.left(), 0.5f);
        assertTrue(text.top() > 700f && text.bottom() < 700f, "text box straddles the baseline");

        PageObject annotation = objects.get(2);
        assertEquals(300f, annotation.left(), 0.01f);
        assertEquals(320f, annotation.top(), 0.01f);
    }

    @Test
    void everyPageIsListedWhenNoRangeIsGiven() throws Exception {
        Path input = createNumberedPdf("objects.pdf", 3);

        List<PageObject> objects =
                new PageObjectService().list(new PdfCustodian(input), PageSelection.all());

        assertEquals(List.of(1, 2, 3), objects.stream().map(PageObject::page).toList());
    }
}
