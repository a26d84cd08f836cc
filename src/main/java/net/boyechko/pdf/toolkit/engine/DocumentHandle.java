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

import java.io.OutputStream;

/**
 * An open document owned by a single operation. All indices are 0-based engine indices.
 *
 * <p>{@link #close()} releases the document and must be called exactly once, after every page
 * handle obtained from it has been closed.
 */
public interface DocumentHandle extends AutoCloseable {
    int pageCount();

    PageHandle loadPage(int index0) throws EngineException;

    /**
     * Copies pages of {@code source} into this document.
     *
     * @param rangeSpec 1-based {@code "a-b"} or {@code "a"}
     * @param insertAtIndex0 position in this document where the first copied page lands
     */
    void importPages(DocumentHandle source, String rangeSpec, int insertAtIndex0)
            throws EngineException;

    void deletePage(int index0) throws EngineException;

    void insertBlankPage(int index0, float width, float height) throws EngineException;

    /** Serializes the document. A handle can be saved once. */
    void save(OutputStream out) throws EngineException;

    /** First top-level outline entry, or {@code null} if the document has none. */
    OutlineEntry firstOutline();

    @Override
    void close();
}
