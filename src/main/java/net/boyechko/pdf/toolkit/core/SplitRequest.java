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

import java.nio.file.Path;
import java.util.Map;

/**
 * Parameters of a split.
 *
 * @param range pages to extract; {@link PageSelection#all()} for every page
 * @param overrides explicit names by page, such as those read from a name-list file
 * @param template name template with {@code {original}} and {@code {page}}, or null
 */
public record SplitRequest(
        Path input,
        String password,
        PageSelection range,
        boolean useBookmarks,
        Map<Integer, String> overrides,
        String template) {
    public SplitRequest {
        if (input == null) {
            throw new IllegalArgumentException("Input path is required");
        }
        range = range == null ? PageSelection.all() : range;
        overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
    }

    public static SplitRequest of(Path input) {
        return new SplitRequest(input, null, PageSelection.all(), false, Map.of(), null);
    }
}
