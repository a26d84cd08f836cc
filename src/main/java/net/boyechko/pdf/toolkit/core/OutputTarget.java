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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Destination for documents produced one at a time, such as split pages. */
@FunctionalInterface
public interface OutputTarget {
    /**
     * Persists one produced file.
     *
     * @return where the file was written
     */
    Path write(String fileName, byte[] content) throws IOException;

    /** Writes into {@code directory}, creating it if needed and replacing existing files. */
    static OutputTarget directory(Path directory) {
        return (fileName, content) -> {
            Files.createDirectories(directory);
            Path target = directory.resolve(fileName);
            Files.write(target, content);
            return target;
        };
    }
}
