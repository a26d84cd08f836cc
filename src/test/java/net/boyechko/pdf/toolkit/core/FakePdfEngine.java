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

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.toolkit.engine.DocumentHandle;
import net.boyechko.pdf.toolkit.engine.EngineError;
import net.boyechko.pdf.toolkit.engine.EngineException;
import net.boyechko.pdf.toolkit.engine.EngineLock;
import net.boyechko.pdf.toolkit.engine.OpenMode;
import net.boyechko.pdf.toolkit.engine.OutlineEntry;
import net.boyechko.pdf.toolkit.engine.PageHandle;
import net.boyechko.pdf.toolkit.engine.PdfEngine;

/**
 * In-memory engine whose pages are labels. Records every mutating call, and whether the engine
 * lock was held at the time, so tests can check call order and handle release. Like iText, it
 * refuses to change a document opened for reading and to import pages from an editable one.
 */
final class FakePdfEngine implements PdfEngine {
    final Map<Path, List<String>> documents = new HashMap<>();
    final List<String> calls = new ArrayList<>();
    final List<FakeDocument> opened = new ArrayList<>();
    boolean lockAlwaysHeld = true;

    FakePdfEngine withDocument(Path path, String... pages) {
        documents.put(path, List.of(pages));
        return this;
    }

    @Override
    public DocumentHandle load(Path path, String password, OpenMode mode)
            throws EngineException {
        checkLock();
        List<String> pages = documents.get(path);
        if (pages == null) {
            throw new EngineException(EngineError.FORMAT, "Cannot open " + path);
        }
        calls.add("load " + path.getFileName() + " " + mode);
        return track(new FakeDocument(new ArrayList<>(pages), mode));
    }

    @Override
    public DocumentHandle create() {
        checkLock();
        calls.add("create");
        return track(new FakeDocument(new ArrayList<>(), OpenMode.EDIT));
    }

    @Override
    public DocumentHandle createWithSecurityOf(DocumentHandle source) {
        checkLock();
        calls.add("create");
        calls.add("secure like " + ((FakeDocument) source).mode);
        return track(new FakeDocument(new ArrayList<>(), OpenMode.EDIT));
    }

    boolean allClosed() {
        return opened.stream().allMatch(doc -> doc.closed) && pagesClosed();
    }

    private boolean pagesClosed() {
        return opened.stream().flatMap(doc -> doc.pageHandles.stream()).allMatch(p -> p.closed);
    }

    private FakeDocument track(FakeDocument document) {
        opened.add(document);
        return document;
    }

    private void checkLock() {
        if (!EngineLock.isHeldByCurrentThread()) {
            lockAlwaysHeld = false;
        }
    }

    final class FakeDocument implements DocumentHandle {
        final List<String> pages;
        final OpenMode mode;
        final Map<Integer, Integer> rotations = new HashMap<>();
        final List<FakePage> pageHandles = new ArrayList<>();
        boolean closed;

        FakeDocument(List<String> pages, OpenMode mode) {
            this.pages = pages;
            this.mode = mode;
        }

        private void checkWritable() {
            if (mode == OpenMode.READ) {
                throw new IllegalStateException("Document was opened read-only");
            }
        }

        @Override
        public int pageCount() {
            return pages.size();
        }

        @Override
        public PageHandle loadPage(int index0) throws EngineException {
            checkLock();
            if (index0 < 0 || index0 >= pages.size()) {
                throw new EngineException(EngineError.PAGE, "No page " + index0);
            }
            FakePage page = new FakePage(this, index0);
            pageHandles.add(page);
            return page;
        }

        @Override
        public void importPages(DocumentHandle source, String rangeSpec, int insertAtIndex0) {
            checkLock();
            checkWritable();
            FakeDocument src = (FakeDocument) source;
            if (src.mode != OpenMode.READ) {
                throw new IllegalStateException("Cannot copy pages from a document being written");
            }
            calls.add("import " + rangeSpec + " at " + insertAtIndex0);
            String[] bounds = rangeSpec.split("-");
            int from = Integer.parseInt(bounds[0]);
            int to = bounds.length > 1 ? Integer.parseInt(bounds[1]) : from;
            pages.addAll(insertAtIndex0, src.pages.subList(from - 1, to));
        }

        @Override
        public void deletePage(int index0) {
            checkLock();
            checkWritable();
            calls.add("delete " + index0);
            pages.remove(index0);
        }

        @Override
        public void insertBlankPage(int index0, float width, float height) {
            checkLock();
            checkWritable();
            calls.add("blank " + index0);
            pages.add(index0, "blank");
        }

        @Override
        public void save(OutputStream out) {
            checkLock();
            checkWritable();
            calls.add("save");
            try {
                out.write(String.join(",", pages).getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public OutlineEntry firstOutline() {
            return null;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    final class FakePage implements PageHandle {
        private final FakeDocument document;
        private final int index0;
        boolean closed;

        FakePage(FakeDocument document, int index0) {
            this.document = document;
            this.index0 = index0;
        }

        @Override
        public int rotation() {
            return document.rotations.getOrDefault(index0, 0);
        }

        @Override
        public void setRotation(int degrees) {
            document.checkWritable();
            calls.add("rotate " + index0 + " " + degrees);
            document.rotations.put(index0, degrees);
        }

        @Override
        public float width() {
            return 612f;
        }

        @Override
        public float height() {
            return 792f;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
