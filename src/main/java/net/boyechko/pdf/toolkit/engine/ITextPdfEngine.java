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
package net.boyechko.pdf.toolkit.engine;

import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.WriterProperties;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import net.boyechko.pdf.toolkit.document.PdfCustodian;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PdfEngine} backed by iText. {@link OpenMode#READ} handles wrap a plain reading document,
 * which is what iText requires of a {@code copyPagesTo} source. Editable handles are documents in
 * stamping mode writing into an in-memory buffer, so page-tree mutations happen in place and
 * {@link DocumentHandle#save} hands out the serialized bytes.
 */
public class ITextPdfEngine implements PdfEngine {
    private static final Logger logger = LoggerFactory.getLogger(ITextPdfEngine.class);

    @Override
    public DocumentHandle load(Path path, String password, OpenMode mode) throws EngineException {
        PdfCustodian custodian = new PdfCustodian(path, password);
        String label = path.getFileName().toString();
        ByteArrayOutputStream buffer = mode == OpenMode.READ ? null : new ByteArrayOutputStream();
        PdfDocument document =
                switch (mode) {
                    case READ -> custodian.openForReading();
                    case EDIT -> custodian.openForModification(buffer);
                    case DECRYPT -> custodian.decryptTo(buffer);
                };
        logger.debug("Loaded {} for {} ({} pages)", path, mode, document.getNumberOfPages());
        return new ITextDocumentHandle(document, buffer, label, custodian);
    }

    @Override
    public DocumentHandle create() throws EngineException {
        return newDocument(new WriterProperties(), null);
    }

    @Override
    public DocumentHandle createWithSecurityOf(DocumentHandle source) throws EngineException {
        if (!(source instanceof ITextDocumentHandle src) || src.custodian == null) {
            return create();
        }
        return newDocument(src.custodian.writerPropertiesPreservingEncryption(), src.custodian);
    }

    private static DocumentHandle newDocument(WriterProperties props, PdfCustodian custodian)
            throws EngineException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            PdfDocument document = new PdfDocument(new PdfWriter(buffer, props));
            return new ITextDocumentHandle(document, buffer, "new document", custodian);
        } catch (RuntimeException e) {
            throw EngineErrors.translate("Failed to create document", e);
        }
    }

    static final class ITextDocumentHandle implements DocumentHandle {
        private final PdfDocument document;
        private final ByteArrayOutputStream buffer;
        private final String label;
        private final PdfCustodian custodian;
        private boolean saved;
        private boolean closed;

        /** {@code buffer} is null for a read-only handle. */
        ITextDocumentHandle(
                PdfDocument document,
                ByteArrayOutputStream buffer,
                String label,
                PdfCustodian custodian) {
            this.document = document;
            this.buffer = buffer;
            this.label = label;
            this.custodian = custodian;
        }

        PdfDocument document() {
            return document;
        }

        @Override
        public int pageCount() {
            ensureOpen();
            return document.getNumberOfPages();
        }

        @Override
        public PageHandle loadPage(int index0) throws EngineException {
            ensureOpen();
            checkIndex(index0, pageCount());
            try {
                return new ITextPageHandle(document.getPage(index0 + 1), buffer != null);
            } catch (RuntimeException e) {
                throw EngineErrors.translate("Failed to load page " + (index0 + 1), e);
            }
        }

        @Override
        public void importPages(DocumentHandle source, String rangeSpec, int insertAtIndex0)
                throws EngineException {
            ensureWritable();
            if (!(source instanceof ITextDocumentHandle src)) {
                throw new IllegalArgumentException(
                        "Cannot import from " + source.getClass().getSimpleName());
            }
            int[] range = parseRangeSpec(rangeSpec);
            int sourcePages = src.pageCount();
            if (range[0] < 1 || range[1] > sourcePages || range[0] > range[1]) {
                throw new EngineException(
                        EngineError.PAGE,
                        "Range " + rangeSpec + " is outside 1-" + sourcePages + " of " + src.label);
            }
            int targetPages = pageCount();
            if (insertAtIndex0 < 0 || insertAtIndex0 > targetPages) {
                throw new EngineException(
                        EngineError.PAGE,
                        "Insert position " + insertAtIndex0 + " is outside 0-" + targetPages);
            }
            try {
                if (insertAtIndex0 == targetPages) {
                    src.document.copyPagesTo(range[0], range[1], document);
                } else {
                    src.document.copyPagesTo(range[0], range[1], document, insertAtIndex0 + 1);
                }
            } catch (RuntimeException e) {
                throw EngineErrors.translate(
                        "Failed to import pages " + rangeSpec + " from " + src.label, e);
            }
        }

        @Override
        public void deletePage(int index0) throws EngineException {
            ensureWritable();
            checkIndex(index0, pageCount());
            try {
                document.removePage(index0 + 1);
            } catch (RuntimeException e) {
                throw EngineErrors.translate("Failed to delete page " + (index0 + 1), e);
            }
        }

        @Override
        public void insertBlankPage(int index0, float width, float height)
                throws EngineException {
            ensureWritable();
            int pages = pageCount();
            if (index0 < 0 || index0 > pages) {
                throw new EngineException(
                        EngineError.PAGE, "Insert position " + index0 + " is outside 0-" + pages);
            }
            PageSize size = new PageSize(width, height);
            try {
                if (index0 == pages) {
                    document.addNewPage(size);
                } else {
                    document.addNewPage(index0 + 1, size);
                }
            } catch (RuntimeException e) {
                throw EngineErrors.translate("Failed to insert page at " + (index0 + 1), e);
            }
        }

        @Override
        public void save(OutputStream out) throws EngineException {
            ensureWritable();
            if (saved) {
                throw new IllegalStateException(label + " has already been saved");
            }
            saved = true;
            closed = true;
            try {
                document.close();
            } catch (RuntimeException e) {
                throw EngineErrors.translate("Failed to serialize " + label, e);
            }
            try {
                buffer.writeTo(out);
                out.flush();
            } catch (IOException e) {
                throw EngineErrors.translate("Failed to write " + label, e);
            }
        }

        @Override
        public OutlineEntry firstOutline() {
            ensureOpen();
            PdfDictionary outlines =
                    document.getCatalog().getPdfObject().getAsDictionary(PdfName.Outlines);
            if (outlines == null) {
                return null;
            }
            return ITextOutlineEntry.first(document, outlines);
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                document.close();
            } catch (RuntimeException e) {
                logger.warn("Failed to release {}: {}", label, e.getMessage());
            }
        }

        private void ensureOpen() {
            if (closed) {
                throw new IllegalStateException(label + " is closed");
            }
        }

        private void ensureWritable() {
            ensureOpen();
            if (buffer == null) {
                throw new IllegalStateException(label + " was opened read-only");
            }
        }

        private static void checkIndex(int index0, int pageCount) throws EngineException {
            if (index0 < 0 || index0 >= pageCount) {
                throw new EngineException(
                        EngineError.PAGE,
                        "Page index " + index0 + " is outside 0-" + (pageCount - 1));
            }
        }

        /** Parses {@code "a-b"} or {@code "a"} into a 1-based inclusive range. */
        static int[] parseRangeSpec(String rangeSpec) {
            String spec = rangeSpec.trim();
            int dash = spec.indexOf('-');
            try {
                if (dash < 0) {
                    int page = Integer.parseInt(spec);
                    return new int[] {page, page};
                }
                return new int[] {
                    Integer.parseInt(spec.substring(0, dash).trim()),
                    Integer.parseInt(spec.substring(dash + 1).trim())
                };
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid import range: " + rangeSpec, e);
            }
        }
    }

    static final class ITextPageHandle implements PageHandle {
        private final PdfPage page;
        private final boolean writable;
        private boolean closed;

        ITextPageHandle(PdfPage page, boolean writable) {
            this.page = page;
            this.writable = writable;
        }

        @Override
        public int rotation() {
            return page.getRotation();
        }

        @Override
        public void setRotation(int degrees) {
            if (closed) {
                throw new IllegalStateException("Page handle is closed");
            }
            if (!writable) {
                throw new IllegalStateException("Page belongs to a read-only document");
            }
            page.setRotation(degrees);
        }

        @Override
        public float width() {
            return page.getPageSize().getWidth();
        }

        @Override
        public float height() {
            return page.getPageSize().getHeight();
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
