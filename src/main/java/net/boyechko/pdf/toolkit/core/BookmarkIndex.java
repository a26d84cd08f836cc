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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.toolkit.engine.ActionKind;
import net.boyechko.pdf.toolkit.engine.DocumentHandle;
import net.boyechko.pdf.toolkit.engine.OutlineEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens a document outline depth-first, child before sibling.
 *
 * <p>An entry with a blank title is listed, but neither its children nor its following siblings
 * are visited.
 */
public final class BookmarkIndex {
    private static final Logger logger = LoggerFactory.getLogger(BookmarkIndex.class);

    private BookmarkIndex() {}

    private record Pending(OutlineEntry entry, int level) {}

    public static List<Bookmark> build(DocumentHandle document) {
        return build(document.firstOutline());
    }

    public static List<Bookmark> build(OutlineEntry first) {
        List<Bookmark> bookmarks = new ArrayList<>();
        if (first == null) {
            return bookmarks;
        }

        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(first, 0));
        while (!stack.isEmpty()) {
            Pending current = stack.pop();
            OutlineEntry entry = current.entry();
            String title = entry.title();
            bookmarks.add(toBookmark(entry, title, current.level()));

            if (title == null || title.isBlank()) {
                logger.debug("Blank outline title at level {}; not descending", current.level());
                continue;
            }
            // Sibling goes under the child so the child's subtree is emitted first
            OutlineEntry sibling = entry.nextSibling();
            if (sibling != null) {
                stack.push(new Pending(sibling, current.level()));
            }
            OutlineEntry child = entry.firstChild();
            if (child != null) {
                stack.push(new Pending(child, current.level() + 1));
            }
        }
        logger.debug("Flattened {} outline entries", bookmarks.size());
        return bookmarks;
    }

    private static Bookmark toBookmark(OutlineEntry entry, String title, int level) {
        ActionKind kind = entry.actionKind();
        if (kind != null) {
            Integer page = kind.resolvesToPage() ? entry.actionDestinationPage() : null;
            return new Bookmark(title, level, kind, page);
        }
        Integer page = entry.destinationPage();
        return new Bookmark(title, level, page != null ? ActionKind.PAGE : null, page);
    }

    /** Maps each target page to a title; later entries in traversal order win. */
    public static Map<Integer, String> pageTitles(List<Bookmark> bookmarks) {
        Map<Integer, String> titles = new HashMap<>();
        for (Bookmark bookmark : bookmarks) {
            if (bookmark.page() != null && bookmark.page() > 0) {
                titles.put(bookmark.page(), bookmark.title());
            }
        }
        return titles;
    }
}
