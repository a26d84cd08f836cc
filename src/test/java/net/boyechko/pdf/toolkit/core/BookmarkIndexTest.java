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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.toolkit.engine.ActionKind;
import net.boyechko.pdf.toolkit.engine.OutlineEntry;
import org.junit.jupiter.api.Test;

class BookmarkIndexTest {

    /** Hand-built outline node. */
    private static final class Node implements OutlineEntry {
        private final String title;
        private final ActionKind action;
        private final Integer actionPage;
        private final Integer destPage;
        private final List<Node> children = new ArrayList<>();
        private Node next;

        Node(String title, Integer destPage) {
            this(title, null, null, destPage);
        }

        Node(String title, ActionKind action, Integer actionPage, Integer destPage) {
            this.title = title;
            this.action = action;
            this.actionPage = actionPage;
            this.destPage = destPage;
        }

        Node children(Node... nodes) {
            children.addAll(List.of(nodes));
            link(nodes);
            return this;
        }

        @Override
        public String title() {
            return title;
        }

        @Override
        public OutlineEntry firstChild() {
            return children.isEmpty() ? null : children.get(0);
        }

        @Override
        public OutlineEntry nextSibling() {
            return next;
        }

        @Override
        public ActionKind actionKind() {
            return action;
        }

        @Override
        public Integer actionDestinationPage() {
            return actionPage;
        }

        @Override
        public Integer destinationPage() {
            return destPage;
        }
    }

    private static Node link(Node... nodes) {
        for (int i = 0; i + 1 < nodes.length; i++) {
            nodes[i].next = nodes[i + 1];
        }
        return nodes[0];
    }

    // ── Traversal ───────────────────────────────────────────────────

    @Test
    void noOutlineYieldsNoBookmarks() {
        assertTrue(BookmarkIndex.build((OutlineEntry) null).isEmpty());
    }

    @Test
    void flattensDepthFirstChildBeforeSibling() {
        Node first =
                link(
                        new Node("Part 1", 1).children(new Node("1.1", 2), new Node("1.2", 3)),
                        new Node("Part 2", 4).children(new Node("2.1", 5)));

        List<Bookmark> bookmarks = BookmarkIndex.build(first);

        assertEquals(
                List.of("Part 1", "1.1", "1.2", "Part 2", "2.1"),
                bookmarks.stream().map(Bookmark::title).toList());
        assertEquals(
                List.of(0, 1, 1, 0, 1), bookmarks.stream().map(Bookmark::level).toList());
        assertEquals(
                List.of(1, 2, 3, 4, 5), bookmarks.stream().map(Bookmark::page).toList());
    }

    @Test
    void blankTitleStopsDescentAndSiblings() {
        Node first =
                link(
                        new Node("Kept", 1),
                        new Node(" ", 2).children(new Node("Hidden child", 3)),
                        new Node("Hidden sibling", 4));

        List<Bookmark> bookmarks = BookmarkIndex.build(first);

        assertEquals(List.of("Kept", " "), bookmarks.stream().map(Bookmark::title).toList());
    }

    @Test
    void deepOutlinesDoNotOverflowTheStack() {
        Node root = new Node("level 0", 1);
        Node current = root;
        for (int i = 1; i < 10_000; i++) {
            Node child = new Node("level " + i, 1);
            current.children(child);
            current = child;
        }
        List<Bookmark> bookmarks = BookmarkIndex.build(root);
        assertEquals(10_000, bookmarks.size());
        assertEquals(9_999, bookmarks.get(9_999).level());
    }

    // ── Actions ─────────────────────────────────────────────────────

    @Test
    void entryWithoutActionUsesItsDestination() {
        Bookmark bookmark = BookmarkIndex.build(new Node("Plain", 7)).get(0);
        assertEquals(ActionKind.PAGE, bookmark.action());
        assertEquals(7, bookmark.page());
    }

    @Test
    void entryWithNeitherActionNorDestinationHasNoAction() {
        Bookmark bookmark = BookmarkIndex.build(new Node("Label only", null)).get(0);
        assertNull(bookmark.action());
        assertNull(bookmark.page());
    }

    @Test
    void gotoActionsResolveToTheActionPage() {
        Bookmark bookmark =
                BookmarkIndex.build(new Node("Go", ActionKind.GOTO, 3, 9)).get(0);
        assertEquals(ActionKind.GOTO, bookmark.action());
        assertEquals(3, bookmark.page());
    }

    @Test
    void nonPageActionsHaveNoPage() {
        Bookmark bookmark =
                BookmarkIndex.build(new Node("Web", ActionKind.URI, 3, 9)).get(0);
        assertEquals(ActionKind.URI, bookmark.action());
        assertNull(bookmark.page());
    }

    // ── Page titles ─────────────────────────────────────────────────

    @Test
    void laterEntriesWinPageTitles() {
        List<Bookmark> bookmarks =
                List.of(
                        new Bookmark("Part", 0, ActionKind.PAGE, 1),
                        new Bookmark("Chapter", 1, ActionKind.PAGE, 1),
                        new Bookmark("Nowhere", 0, ActionKind.URI, null));
        assertEquals(Map.of(1, "Chapter"), BookmarkIndex.pageTitles(bookmarks));
    }

    @Test
    void pageTitlesSkipNonPositivePages() {
        List<Bookmark> bookmarks =
                List.of(
                        new Bookmark("Zero", 0, ActionKind.PAGE, 0),
                        new Bookmark("Negative", 0, ActionKind.PAGE, -2),
                        new Bookmark("Untargeted", 0, null, null),
                        new Bookmark("Two", 0, ActionKind.PAGE, 2));
        assertEquals(Map.of(2, "Two"), BookmarkIndex.pageTitles(bookmarks));
    }
}
