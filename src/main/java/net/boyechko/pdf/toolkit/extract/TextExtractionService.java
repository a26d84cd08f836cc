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

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.canvas.parser.PdfTextExtractor;
import com.itextpdf.kernel.pdf.canvas.parser.listener.LocationTextExtractionStrategy;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import net.boyechko.pdf.toolkit.core.PageSelection;
import net.boyechko.pdf.toolkit.core.PdfOperationException;
import net.boyechko.pdf.toolkit.core.ProgressListener;
import net.boyechko.pdf.toolkit.document.PdfCustodian;
import net.boyechko.pdf.toolkit.engine.EngineException;
import net.boyechko.pdf.toolkit.engine.EngineLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Extracts the text layer of selected pages in reading order. */
public class TextExtractionService {
    private static final Logger logger = LoggerFactory.getLogger(TextExtractionService.class);

    private final ProgressListener listener;

    public TextExtractionService() {
        this(ProgressListener.NONE);
    }

    public TextExtractionService(ProgressListener listener) {
        this.listener = ProgressListener.safe(listener);
    }

    public List<PageText> extract(PdfCustodian custodian, PageSelection selection)
            throws PdfOperationException {
        List<PageText> result = new ArrayList<>();
        try (EngineLock.Guard guard = EngineLock.acquire();
                PdfDocument document = custodian.openForReading()) {
            int total = document.getNumberOfPages();
            SortedSet<Integer> pages = Extraction.selectedPages(selection, total);
            logger.info("Extracting text from {} of {} page(s)", pages.size(), total);
            for (int page : pages) {
                String text;
                try {
                    text =
                            PdfTextExtractor.getTextFromPage(
                                    document.getPage(page), new LocationTextExtractionStrategy());
                } catch (RuntimeException e) {
                    throw new PdfOperationException("Failed to extract text of page " + page, e);
                }
                PageText pageText = PageText.of(page, text);
                logger.debug("Page {}: {} characters", page, pageText.characters());
                result.add(pageText);
                listener.onProgress(page, total, "page " + page);
            }
        } catch (EngineException e) {
            throw new PdfOperationException("Failed to read " + custodian.inputPath(), e);
        }
        return result;
    }
}
