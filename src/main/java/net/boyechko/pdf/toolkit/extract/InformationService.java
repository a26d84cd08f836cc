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

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfDocumentInfo;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfString;
import net.boyechko.pdf.toolkit.core.PdfOperationException;
import net.boyechko.pdf.toolkit.document.PdfCustodian;
import net.boyechko.pdf.toolkit.engine.EngineException;
import net.boyechko.pdf.toolkit.engine.EngineLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads the page count, PDF version and the document information dictionary. */
public class InformationService {
    private static final Logger logger = LoggerFactory.getLogger(InformationService.class);

    public DocumentInfo read(PdfCustodian custodian) throws PdfOperationException {
        try (EngineLock.Guard guard = EngineLock.acquire();
                PdfDocument document = custodian.openForReading()) {
            PdfDocumentInfo info = document.getDocumentInfo();
            DocumentInfo result =
                    new DocumentInfo(
                            document.getNumberOfPages(),
                            info.getAuthor(),
                            info.getMoreInfo("CreationDate"),
                            info.getCreator(),
                            info.getKeywords(),
                            info.getProducer(),
                            info.getMoreInfo("ModDate"),
                            info.getSubject(),
                            info.getTitle(),
                            versionOf(document),
                            trappedOf(document));
            logger.info(
                    "Read information: {} pages, version {}", result.pages(), result.version());
            return result;
        } catch (EngineException e) {
            throw new PdfOperationException("Failed to read " + custodian.inputPath(), e);
        }
    }

    /** {@code "1.7"} for a PDF 1.7 file. */
    static String versionOf(PdfDocument document) {
        String version = document.getPdfVersion().toString();
        return version.startsWith("PDF-") ? version.substring(4) : version;
    }

    /** {@code /Trapped} may be a name or, in older producers, a string. */
    static String trappedOf(PdfDocument document) {
        PdfDictionary info = document.getTrailer().getAsDictionary(PdfName.Info);
        if (info == null) {
            return null;
        }
        PdfObject trapped = info.get(PdfName.Trapped);
        if (trapped instanceof PdfName name) {
            return name.getValue();
        }
        if (trapped instanceof PdfString text) {
            return text.toUnicodeString();
        }
        return null;
    }
}
