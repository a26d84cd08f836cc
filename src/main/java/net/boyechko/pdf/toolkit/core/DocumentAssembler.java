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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import net.boyechko.pdf.toolkit.engine.DocumentHandle;
import net.boyechko.pdf.toolkit.engine.EngineException;
import net.boyechko.pdf.toolkit.engine.EngineLock;
import net.boyechko.pdf.toolkit.engine.ITextPdfEngine;
import net.boyechko.pdf.toolkit.engine.OpenMode;
import net.boyechko.pdf.toolkit.engine.PageHandle;
import net.boyechko.pdf.toolkit.engine.PdfEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Page-level document assembly: split, merge, reorder, remove, insert, rotate and unlock.
 *
 * <p>Pages are addressed by 1-based display numbers and converted to engine indices only at the
 * engine call. Arguments are validated before the engine is touched where possible; a source that
 * fails to load aborts the operation before any output is written. Every operation runs under
 * {@link EngineLock}.
 */
public class DocumentAssembler {
    private static final Logger logger = LoggerFactory.getLogger(DocumentAssembler.class);

    public static final float DEFAULT_PAGE_WIDTH = 612f;
    public static final float DEFAULT_PAGE_HEIGHT = 792f;

    private static final Set<Integer> VALID_ROTATIONS = Set.of(90, 180, 270);

    private final PdfEngine engine;
    private final ProgressListener listener;
    private final NamingStrategy naming;

    public static class DocumentAssemblerBuilder {
        private PdfEngine engine = new ITextPdfEngine();
        private ProgressListener listener = ProgressListener.NONE;
        private NamingStrategy naming = new NamingStrategy();

        public DocumentAssemblerBuilder withEngine(PdfEngine engine) {
            this.engine = engine;
            return this;
        }

        public DocumentAssemblerBuilder withListener(ProgressListener listener) {
            this.listener = listener;
            return this;
        }

        public DocumentAssemblerBuilder withNamingStrategy(NamingStrategy naming) {
            this.naming = naming;
            return this;
        }

        public DocumentAssembler build() {
            if (engine == null) {
                throw new IllegalStateException(
                        "PdfEngine must be provided via withEngine(...) before building DocumentAssembler");
            }
            return new DocumentAssembler(this);
        }
    }

    private DocumentAssembler(DocumentAssemblerBuilder builder) {
        this.engine = builder.engine;
        this.listener = ProgressListener.safe(builder.listener);
        this.naming = builder.naming == null ? new NamingStrategy() : builder.naming;
    }

    // ── Split ───────────────────────────────────────────────────────

    /**
     * Writes each selected page as its own document. A failure stops the split; files already
     * written stay in place.
     *
     * @return the files written, in page order
     */
    public List<Path> split(SplitRequest request, OutputTarget target)
            throws PdfOperationException {
        if (target == null) {
            throw new IllegalArgumentException("Output target is required");
        }
        String stem = NamingStrategy.stem(request.input());
        logger.info("Splitting {}", request.input());

        List<Path> written = new ArrayList<>();
        try (EngineLock.Guard guard = EngineLock.acquire();
                DocumentHandle source =
                        load(request.input(), request.password(), OpenMode.READ)) {
            int total = source.pageCount();
            SortedSet<Integer> pages = request.range().resolve(total);
            if (!request.range().isAll() && pages.isEmpty()) {
                throw new IllegalArgumentException(
                        "Page range '"
                                + request.range()
                                + "' matches no page of "
                                + request.input().getFileName()
                                + " (1-"
                                + total
                                + ")");
            }

            Map<Integer, String> titles =
                    request.useBookmarks() ? bookmarkTitles(source) : Map.of();
            NamingPlan plan = new NamingPlan();

            for (int page : pages) {
                String name =
                        plan.claim(
                                page,
                                naming.resolve(
                                        page,
                                        stem,
                                        request.overrides(),
                                        titles,
                                        request.template()));
                String fileName = name + ".pdf";
                byte[] content = extractSinglePage(source, page, fileName);
                try {
                    written.add(target.write(fileName, content));
                } catch (IOException e) {
                    throw new PdfOperationException(
                            "Failed to write page " + page + " to " + fileName, e);
                }
                logger.debug("Wrote page {} as {}", page, fileName);
                listener.onProgress(page, total, fileName);
            }
        }
        logger.info("Split {} into {} file(s)", request.input().getFileName(), written.size());
        return written;
    }

    private byte[] extractSinglePage(DocumentHandle source, int page, String fileName)
            throws PdfOperationException {
        try (DocumentHandle single = engine.create()) {
            single.importPages(source, String.valueOf(page), 0);
            return serialize(single);
        } catch (EngineException e) {
            throw new PdfOperationException(
                    "Failed to split page " + page + " into " + fileName, e);
        }
    }

    private Map<Integer, String> bookmarkTitles(DocumentHandle source) {
        try {
            return BookmarkIndex.pageTitles(BookmarkIndex.build(source));
        } catch (RuntimeException e) {
            logger.warn("Failed to read bookmarks, naming pages without them: {}", e.toString());
            return Map.of();
        }
    }

    // ── Merge ───────────────────────────────────────────────────────

    /**
     * Appends every page of each input, in order, into a new document at {@code output}. Missing
     * or unloadable inputs are skipped with a warning unless {@link MergeOptions#strict()} is set.
     *
     * @return the number of inputs merged
     */
    public int merge(List<Path> inputs, Path output, MergeOptions options)
            throws PdfOperationException {
        MergeOptions opts = options == null ? MergeOptions.DEFAULT : options;
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalArgumentException("No input files to merge");
        }
        requireOutput(output);
        if (Files.exists(output)) {
            throw new IllegalArgumentException(
                    output + " already exists, specify another location");
        }
        if (opts.strict()) {
            for (Path input : inputs) {
                if (!Files.isRegularFile(input)) {
                    throw new IllegalArgumentException("File not found: " + input);
                }
            }
        }
        logger.info("Merging {} file(s) into {}", inputs.size(), output);

        int merged = 0;
        int total = inputs.size();
        try (EngineLock.Guard guard = EngineLock.acquire();
                DocumentHandle destination = create()) {
            for (int i = 0; i < total; i++) {
                Path input = inputs.get(i);
                if (appendAll(destination, input, opts)) {
                    merged++;
                    if (opts.deleteOriginals()) {
                        deleteOriginal(input);
                    }
                }
                listener.onProgress(i + 1, total, input.getFileName().toString());
            }
            if (merged == 0 && opts.strict()) {
                throw new PdfOperationException("None of the inputs could be merged");
            }
            if (merged == 0) {
                logger.warn("No input could be merged; writing an empty document");
            }
            if (destination.pageCount() == 0) {
                // A page tree must hold at least one page to be serialized
                try {
                    destination.insertBlankPage(0, DEFAULT_PAGE_WIDTH, DEFAULT_PAGE_HEIGHT);
                } catch (EngineException e) {
                    throw new PdfOperationException("Failed to create an empty document", e);
                }
            }
            write(destination, output);
        }
        logger.info("Merged {} of {} file(s) into {}", merged, total, output);
        return merged;
    }

    private boolean appendAll(DocumentHandle destination, Path input, MergeOptions opts)
            throws PdfOperationException {
        if (!Files.isRegularFile(input)) {
            logger.warn("Skipping {}: file not found", input);
            return false;
        }
        try (DocumentHandle source = engine.load(input, opts.password())) {
            int pages = source.pageCount();
            if (pages > 0) {
                String range = pages == 1 ? "1" : "1-" + pages;
                destination.importPages(source, range, destination.pageCount());
            }
            logger.debug("Appended {} page(s) from {}", pages, input);
            return true;
        } catch (EngineException e) {
            if (opts.strict()) {
                throw new PdfOperationException("Failed to merge " + input, e);
            }
            logger.warn("Skipping {}: {}", input, e.getMessage());
            return false;
        }
    }

    private static void deleteOriginal(Path input) {
        try {
            Files.delete(input);
            logger.debug("Deleted original {}", input);
        } catch (IOException e) {
            logger.warn("Failed to delete original {}: {}", input, e.toString());
        }
    }

    // ── Reorder ─────────────────────────────────────────────────────

    /**
     * Writes a new document whose page {@code i} is source page {@code order.get(i - 1)}. The
     * order must be a permutation of {@code 1..N}; otherwise nothing is written.
     */
    public void reorder(Path input, String password, Path output, List<Integer> order)
            throws PdfOperationException {
        if (order == null || order.isEmpty()) {
            throw new IllegalArgumentException("No valid page order specified");
        }
        requireOutput(output);
        logger.info("Reordering {} as {}", input, order);

        try (EngineLock.Guard guard = EngineLock.acquire();
                DocumentHandle source = load(input, password, OpenMode.READ)) {
            validatePermutation(order, source.pageCount());
            try (DocumentHandle destination = createWithSecurityOf(source)) {
                for (int slot = 0; slot < order.size(); slot++) {
                    int page = order.get(slot);
                    try {
                        destination.importPages(source, String.valueOf(page), slot);
                    } catch (EngineException e) {
                        throw new PdfOperationException(
                                "Failed to import page " + page + " into position " + (slot + 1),
                                e);
                    }
                    listener.onProgress(slot + 1, order.size(), "page " + page);
                }
                write(destination, output);
            }
        }
    }

    /**
     * Checks that {@code order} lists every page of an {@code pageCount}-page document exactly
     * once.
     *
     * @throws IllegalArgumentException naming the first violation
     */
    public static void validatePermutation(List<Integer> order, int pageCount) {
        if (order.size() != pageCount) {
            throw new IllegalArgumentException(
                    "Page order lists "
                            + order.size()
                            + " page(s) but the document has "
                            + pageCount);
        }
        Set<Integer> seen = new HashSet<>();
        for (Integer page : order) {
            if (page == null || page < 1 || page > pageCount) {
                throw new IllegalArgumentException(
                        "Page " + page + " is outside 1-" + pageCount);
            }
            if (!seen.add(page)) {
                throw new IllegalArgumentException("Page " + page + " appears more than once");
            }
        }
    }

    // ── Remove ──────────────────────────────────────────────────────

    /** Deletes the given pages, highest first. Pages outside the document are ignored. */
    public void remove(Path input, String password, Path output, Collection<Integer> pages)
            throws PdfOperationException {
        if (pages == null || pages.isEmpty()) {
            throw new IllegalArgumentException("No valid pages specified for removal");
        }
        long requested = pages.stream().distinct().count();
        PageSelection selection =
                PageSelection.of(pages.stream().filter(p -> p != null && p >= 1).toList());
        removeSelected(input, password, output, selection, requested);
    }

    /** Deletes the selected pages, highest first. Pages outside the document are ignored. */
    public void remove(Path input, String password, Path output, PageSelection selection)
            throws PdfOperationException {
        if (selection == null || selection.isAll() || selection.isEmpty()) {
            throw new IllegalArgumentException("No valid pages specified for removal");
        }
        removeSelected(input, password, output, selection, selection.size());
    }

    private void removeSelected(
            Path input, String password, Path output, PageSelection selection, long requested)
            throws PdfOperationException {
        requireOutput(output);
        logger.info("Removing pages {} from {}", selection, input);

        try (EngineLock.Guard guard = EngineLock.acquire();
                DocumentHandle document = load(input, password, OpenMode.EDIT)) {
            int pageCount = document.pageCount();
            List<Integer> targets =
                    selection.resolve(pageCount).stream()
                            .sorted(Comparator.reverseOrder())
                            .toList();
            if (targets.size() < requested) {
                logger.warn(
                        "Ignoring {} page(s) outside 1-{}", requested - targets.size(), pageCount);
            }
            for (int i = 0; i < targets.size(); i++) {
                int page = targets.get(i);
                try {
                    document.deletePage(page - 1);
                } catch (EngineException e) {
                    throw new PdfOperationException("Failed to remove page " + page, e);
                }
                listener.onProgress(i + 1, targets.size(), "page " + page);
            }
            write(document, output);
        }
    }

    // ── Insert ──────────────────────────────────────────────────────

    /**
     * Inserts blank pages. {@code positions} maps a 1-based position to the number of pages to
     * insert there, so that the first new page becomes page {@code position}. Positions are
     * handled highest first; positions outside {@code 1..N+1} and counts below 1 are ignored.
     */
    public void insert(
            Path input,
            String password,
            Path output,
            Map<Integer, Integer> positions,
            float width,
            float height)
            throws PdfOperationException {
        if (positions == null || positions.isEmpty()) {
            throw new IllegalArgumentException("No valid insert positions specified");
        }
        if (!(width > 0) || !(height > 0)) {
            throw new IllegalArgumentException(
                    "Page size must be positive, got " + width + "x" + height);
        }
        requireOutput(output);
        logger.info("Inserting blank pages {} into {}", positions, input);

        try (EngineLock.Guard guard = EngineLock.acquire();
                DocumentHandle document = load(input, password, OpenMode.EDIT)) {
            int pageCount = document.pageCount();
            List<Map.Entry<Integer, Integer>> targets =
                    positions.entrySet().stream()
                            .filter(e -> e.getKey() != null && e.getValue() != null)
                            .filter(e -> e.getKey() >= 1 && e.getKey() <= pageCount + 1)
                            .filter(e -> e.getValue() >= 1)
                            .sorted(Map.Entry.<Integer, Integer>comparingByKey().reversed())
                            .toList();
            if (targets.size() < positions.size()) {
                logger.warn(
                        "Ignoring {} insert position(s) outside 1-{} or with no pages",
                        positions.size() - targets.size(),
                        pageCount + 1);
            }
            for (int i = 0; i < targets.size(); i++) {
                int position = targets.get(i).getKey();
                int count = targets.get(i).getValue();
                try {
                    for (int n = 0; n < count; n++) {
                        document.insertBlankPage(position - 1, width, height);
                    }
                } catch (EngineException e) {
                    throw new PdfOperationException(
                            "Failed to insert blank pages at position " + position, e);
                }
                listener.onProgress(i + 1, targets.size(), "position " + position);
            }
            write(document, output);
        }
    }

    // ── Rotate ──────────────────────────────────────────────────────

    /** Sets the absolute rotation of the selected pages to 90, 180 or 270 degrees. */
    public void rotate(
            Path input, String password, Path output, int rotation, PageSelection selection)
            throws PdfOperationException {
        if (!VALID_ROTATIONS.contains(rotation)) {
            throw new IllegalArgumentException(
                    "Rotation must be 90, 180 or 270 degrees, got " + rotation);
        }
        PageSelection pages = selection == null ? PageSelection.all() : selection;
        requireOutput(output);
        logger.info("Rotating pages of {} to {} degrees", input, rotation);

        try (EngineLock.Guard guard = EngineLock.acquire();
                DocumentHandle document = load(input, password, OpenMode.EDIT)) {
            int pageCount = document.pageCount();
            SortedSet<Integer> targets = pages.resolve(pageCount);
            if (!pages.isAll() && targets.isEmpty()) {
                throw new IllegalArgumentException(
                        "Page range '" + pages + "' matches no page (1-" + pageCount + ")");
            }
            int done = 0;
            for (int page : targets) {
                try (PageHandle handle = document.loadPage(page - 1)) {
                    handle.setRotation(rotation);
                } catch (EngineException e) {
                    throw new PdfOperationException("Failed to rotate page " + page, e);
                }
                listener.onProgress(++done, targets.size(), "page " + page);
            }
            write(document, output);
        }
    }

    // ── Unlock ──────────────────────────────────────────────────────

    /** Re-saves the document without encryption. */
    public void unlock(Path input, String password, Path output) throws PdfOperationException {
        requireOutput(output);
        logger.info("Unlocking {}", input);
        try (EngineLock.Guard guard = EngineLock.acquire();
                DocumentHandle document = load(input, password, OpenMode.DECRYPT)) {
            write(document, output);
            listener.onProgress(1, 1, output.getFileName().toString());
        }
    }

    // ── Bookmarks ───────────────────────────────────────────────────

    public List<Bookmark> bookmarks(Path input, String password) throws PdfOperationException {
        try (EngineLock.Guard guard = EngineLock.acquire();
                DocumentHandle document = load(input, password, OpenMode.READ)) {
            List<Bookmark> bookmarks = BookmarkIndex.build(document);
            logger.info("Extracted {} bookmark(s) from {}", bookmarks.size(), input);
            return bookmarks;
        }
    }

    // ── Engine helpers ──────────────────────────────────────────────

    private DocumentHandle load(Path input, String password, OpenMode mode)
            throws PdfOperationException {
        if (input == null) {
            throw new IllegalArgumentException("Input path is required");
        }
        try {
            return engine.load(input, password, mode);
        } catch (EngineException e) {
            throw new PdfOperationException("Failed to load " + input, e);
        }
    }

    private DocumentHandle create() throws PdfOperationException {
        try {
            return engine.create();
        } catch (EngineException e) {
            throw new PdfOperationException("Failed to create a new document", e);
        }
    }

    /** A new document that will be saved with the same encryption as {@code source}. */
    private DocumentHandle createWithSecurityOf(DocumentHandle source)
            throws PdfOperationException {
        try {
            return engine.createWithSecurityOf(source);
        } catch (EngineException e) {
            throw new PdfOperationException("Failed to create a new document", e);
        }
    }

    private static byte[] serialize(DocumentHandle document) throws EngineException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        document.save(buffer);
        return buffer.toByteArray();
    }

    private static void write(DocumentHandle document, Path output) throws PdfOperationException {
        byte[] content;
        try {
            content = serialize(document);
        } catch (EngineException e) {
            throw new PdfOperationException("Failed to save " + output, e);
        }
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(output, content);
        } catch (IOException e) {
            throw new PdfOperationException("Failed to write " + output, e);
        }
        logger.debug("Wrote {} byte(s) to {}", content.length, output);
    }

    private static void requireOutput(Path output) {
        if (output == null) {
            throw new IllegalArgumentException("Output path is required");
        }
    }
}
