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

import java.util.SortedSet;
import net.boyechko.pdf.toolkit.core.PageSelection;

final class Extraction {
    private Extraction() {}

    /** Resolves a selection against the page count; an explicit selection must hit a page. */
    static SortedSet<Integer> selectedPages(PageSelection selection, int pageCount) {
        PageSelection effective = selection == null ? PageSelection.all() : selection;
        SortedSet<Integer> pages = effective.resolve(pageCount);
        if (!effective.isAll() && pages.isEmpty()) {
            throw new IllegalArgumentException(
                    "Page range '" + effective + "' matches no page (1-" + pageCount + ")");
        }
        return pages;
    }
}
