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

import java.nio.file.Path;

/** Loads and creates documents. Callers hold {@link EngineLock} around every use. */
public interface PdfEngine {
    /** Opens a document read-only, as a source of pages. */
    default DocumentHandle load(Path path, String password) throws EngineException {
        return load(path, password, OpenMode.READ);
    }

    DocumentHandle load(Path path, String password, OpenMode mode) throws EngineException;

    DocumentHandle create() throws EngineException;

    /** Creates an empty document that is saved with the same encryption as {@code source}. */
    DocumentHandle createWithSecurityOf(DocumentHandle source) throws EngineException;
}
