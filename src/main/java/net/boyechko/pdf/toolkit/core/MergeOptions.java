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

/**
 * Options for merging.
 *
 * @param password tried for every input; null for none
 * @param deleteOriginals delete each input once its pages are imported
 * @param strict fail on the first missing or unloadable input instead of skipping it
 */
public record MergeOptions(String password, boolean deleteOriginals, boolean strict) {
    public static final MergeOptions DEFAULT = new MergeOptions(null, false, false);
}
