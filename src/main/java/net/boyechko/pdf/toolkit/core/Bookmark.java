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

import net.boyechko.pdf.toolkit.engine.ActionKind;

/**
 * One flattened outline entry.
 *
 * @param level nesting depth, 0 for top-level entries
 * @param action what the entry does, or {@code null} for an entry with neither action nor
 *     destination
 * @param page 1-based target page, or {@code null} when the destination is unresolvable
 */
public record Bookmark(String title, int level, ActionKind action, Integer page) {
    public Bookmark {
        if (title == null) {
            title = "";
        }
        if (level < 0) {
            throw new IllegalArgumentException("Bookmark level must be >= 0");
        }
    }
}
