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

/** Raised by the engine boundary; carries the translated failure category. */
public class EngineException extends Exception {
    private final EngineError error;

    public EngineException(EngineError error, String message) {
        super(message + ": " + error.description());
        this.error = error;
    }

    public EngineException(EngineError error, String message, Throwable cause) {
        super(message + ": " + error.description(), cause);
        this.error = error;
    }

    public EngineError error() {
        return error;
    }
}
