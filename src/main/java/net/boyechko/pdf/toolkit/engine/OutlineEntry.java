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

/**
 * One node of a document outline, exposed as first-child/next-sibling links.
 *
 * <p>Page numbers returned here are 1-based display numbers; {@code null} means the destination
 * could not be resolved.
 */
public interface OutlineEntry {
    String title();

    OutlineEntry firstChild();

    OutlineEntry nextSibling();

    /** The kind of the explicit action, or {@code null} if the entry has no action. */
    ActionKind actionKind();

    /** Page targeted by the explicit action's destination. */
    Integer actionDestinationPage();

    /** Page targeted by the entry's own destination. */
    Integer destinationPage();
}
