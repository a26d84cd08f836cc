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

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Call ordering and resource handling of {@link DocumentAssembler}, against a fake engine. */
class DocumentAssemblerEngineTest {
    @TempDir Path tempDir;

    private FakePdfEngine engine;
    private Path input;
    private Path output;

    @BeforeEach
    void setUp() {
        input = tempDir.resolve("input.pdf");
        output = tempDir.resolve("output.pdf");
        engine = new FakePdfEngine().withDocument(input, "p1", "p2", "p3", "p4", "p5");
    }

    private DocumentAssembler assembler() {
        return new DocumentAssembler.DocumentAssemblerBuilder().withEngine(engine).build();
    }

    private String written() throws Exception {
        return Files.readString(output, StandardCharsets.UTF_8);
    }

    // ── Remove ──────────────────────────────────────────────────────

    @Test
    void removeDeletesHighestPageFirst() throws Exception {
        assembler().remove(input, null, output, List.of(2, 5, 3, 9));

        List<String> deletes =
                engine.calls.stream().filter(c -> c.startsWith("delete")).toList();
        assertEquals(List.of("delete 4", "delete 2", "delete 1"), deletes);
        assertEquals("p1,p4", written());
    }

    @Test
    void removeReleasesEveryHandleAndHoldsTheLock() throws Exception {
        assembler().remove(input, null, output, List.of(1));
        assertTrue(engine.allClosed());
        assertTrue(engine.lockAlwaysHeld);
    }

    @Test
    void removeWithoutPagesFailsBeforeLoading() {
        assertThrows(
                IllegalArgumentException.class,
                () -> assembler().remove(input, null, output, List.of()));
        assertTrue(engine.calls.isEmpty());
    }

    @Test
    void removeWithOpenEndedSelectionDeletesOnlyExistingPages() throws Exception {
        assembler().remove(input, null, output, PageSelection.parse("4-2147483647"));

        List<String> deletes =
                engine.calls.stream().filter(c -> c.startsWith("delete")).toList();
        assertEquals(List.of("delete 4", "delete 3"), deletes);
        assertEquals("p1,p2,p3", written());
    }

    @Test
    void removeRejectsAllPagesSelection() {
        assertThrows(
                IllegalArgumentException.class,
                () -> assembler().remove(input, null, output, PageSelection.all()));
        assertTrue(engine.calls.isEmpty());
    }

    // ── Open modes ──────────────────────────────────────────────────

    @Test
    void inPlaceEditsKeepTheInputEncryption() throws Exception {
        assembler().remove(input, null, output, List.of(1));
        assembler().rotate(input, null, output, 90, PageSelection.parse("1"));
        assembler().insert(input, null, output, Map.of(1, 1), 612f, 792f);

        assertEquals(
                List.of("load input.pdf EDIT", "load input.pdf EDIT", "load input.pdf EDIT"),
                engine.calls.stream().filter(c -> c.startsWith("load")).toList());
    }

    @Test
    void unlockIsTheOnlyOperationThatDecrypts() throws Exception {
        assembler().unlock(input, null, output);
        assertTrue(engine.calls.contains("load input.pdf DECRYPT"));
        assertEquals("p1,p2,p3,p4,p5", written());
    }

    @Test
    void reorderReadsItsSourceAndSecuresTheResultLikeIt() throws Exception {
        assembler().reorder(input, null, output, List.of(2, 1, 3, 4, 5));
        assertTrue(engine.calls.contains("load input.pdf READ"));
        assertTrue(engine.calls.contains("secure like READ"));
        assertEquals("p2,p1,p3,p4,p5", written());
    }

    // ── Insert ──────────────────────────────────────────────────────

    @Test
    void insertHandlesPositionsHighestFirst() throws Exception {
        Map<Integer, Integer> positions = new LinkedHashMap<>();
        positions.put(1, 1);
        positions.put(4, 2);
        positions.put(6, 1);
        positions.put(8, 1);
        positions.put(3, 0);

        assembler().insert(input, null, output, positions, 612f, 792f);

        List<String> blanks = engine.calls.stream().filter(c -> c.startsWith("blank")).toList();
        assertEquals(List.of("blank 5", "blank 3", "blank 3", "blank 0"), blanks);
        assertEquals("blank,p1,p2,p3,blank,blank,p4,p5,blank", written());
    }

    // ── Reorder ─────────────────────────────────────────────────────

    @Test
    void reorderImportsOnePagePerSlot() throws Exception {
        assembler().reorder(input, null, output, List.of(5, 4, 3, 2, 1));

        List<String> imports =
                engine.calls.stream().filter(c -> c.startsWith("import")).toList();
        assertEquals(
                List.of("import 5 at 0", "import 4 at 1", "import 3 at 2", "import 2 at 3",
                        "import 1 at 4"),
                imports);
        assertEquals("p5,p4,p3,p2,p1", written());
        assertTrue(engine.allClosed());
    }

    @Test
    void invalidPermutationWritesNothing() {
        assertThrows(
                IllegalArgumentException.class,
                () -> assembler().reorder(input, null, output, List.of(1, 2, 2, 4, 5)));
        assertFalse(Files.exists(output));
        assertFalse(engine.calls.contains("create"));
        assertTrue(engine.allClosed());
    }

    // ── Rotate ──────────────────────────────────────────────────────

    @Test
    void rotateClosesEveryPageHandle() throws Exception {
        assembler().rotate(input, null, output, 90, PageSelection.parse("2,4"));

        List<String> rotations =
                engine.calls.stream().filter(c -> c.startsWith("rotate")).toList();
        assertEquals(List.of("rotate 1 90", "rotate 3 90"), rotations);
        assertTrue(engine.allClosed());
    }

    // ── Split ───────────────────────────────────────────────────────

    @Test
    void splitCreatesOneDocumentPerPageAndReportsProgress() throws Exception {
        List<String> progress = new ArrayList<>();
        DocumentAssembler assembler =
                new DocumentAssembler.DocumentAssemblerBuilder()
                        .withEngine(engine)
                        .withListener((current, total, name) -> progress.add(current + "/" + total + " " + name))
                        .build();
        Map<String, byte[]> files = new LinkedHashMap<>();

        SplitRequest request =
                new SplitRequest(input, null, PageSelection.parse("2-3"), false, Map.of(), null);
        assembler.split(
                request,
                (fileName, content) -> {
                    files.put(fileName, content);
                    return tempDir.resolve(fileName);
                });

        assertEquals(List.of("input-002.pdf", "input-003.pdf"), List.copyOf(files.keySet()));
        assertEquals("p2", new String(files.get("input-002.pdf"), StandardCharsets.UTF_8));
        assertEquals(List.of("2/5 input-002.pdf", "3/5 input-003.pdf"), progress);
        assertTrue(engine.allClosed());
    }

    @Test
    void failingListenerDoesNotAbortTheOperation() throws Exception {
        DocumentAssembler assembler =
                new DocumentAssembler.DocumentAssemblerBuilder()
                        .withEngine(engine)
                        .withListener(
                                (current, total, name) -> {
                                    throw new IllegalStateException("listener broke");
                                })
                        .build();
        assembler.remove(input, null, output, List.of(1));
        assertEquals("p2,p3,p4,p5", written());
    }

    // ── Merge ───────────────────────────────────────────────────────

    @Test
    void mergeSkipsUnloadableInputsAndAppendsTheRest() throws Exception {
        Path first = Files.writeString(tempDir.resolve("a.pdf"), "x");
        Path broken = Files.writeString(tempDir.resolve("broken.pdf"), "x");
        Path second = Files.writeString(tempDir.resolve("b.pdf"), "x");
        engine.withDocument(first, "a1", "a2").withDocument(second, "b1");

        int merged =
                assembler().merge(List.of(first, broken, second), output, MergeOptions.DEFAULT);

        assertEquals(2, merged);
        assertEquals("a1,a2,b1", written());
        assertTrue(engine.calls.contains("import 1-2 at 0"));
        assertTrue(engine.calls.contains("import 1 at 2"));
        assertEquals(1, engine.calls.stream().filter("save"::equals).count());
        assertTrue(engine.allClosed());
    }

    @Test
    void strictMergeFailsOnTheFirstUnloadableInput() throws Exception {
        Path broken = Files.writeString(tempDir.resolve("broken.pdf"), "x");
        MergeOptions strict = new MergeOptions(null, false, true);

        assertThrows(
                PdfOperationException.class,
                () -> assembler().merge(List.of(broken), output, strict));
        assertFalse(Files.exists(output));
        assertTrue(engine.allClosed());
    }

    @Test
    void mergeOfNothingUsableStillWritesADocument() throws Exception {
        int merged =
                assembler()
                        .merge(
                                List.of(tempDir.resolve("missing.pdf")),
                                output,
                                MergeOptions.DEFAULT);
        assertEquals(0, merged);
        assertEquals("blank", written());
    }
}
