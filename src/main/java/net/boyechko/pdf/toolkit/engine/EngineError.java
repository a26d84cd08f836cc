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

/** Failure categories reported by a {@link PdfEngine}. */
public enum EngineError {
    FILE("File not found or could not be opened"),
    FORMAT("File not in PDF format or corrupted"),
    PASSWORD("Password required or incorrect password"),
    SECURITY("Unsupported security scheme"),
    PAGE("Page not found or content error"),
    XFA_LOAD("Load XFA error"),
    XFA_LAYOUT("Layout XFA error"),
    UNKNOWN("Unknown error");

    private final String description;

    EngineError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
