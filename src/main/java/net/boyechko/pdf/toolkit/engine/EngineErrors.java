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

import com.itextpdf.commons.exceptions.ITextException;
import com.itextpdf.kernel.exceptions.BadPasswordException;
import com.itextpdf.kernel.exceptions.PdfException;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.Locale;

/** Translates iText and I/O failures into {@link EngineError} categories. */
public final class EngineErrors {
    private EngineErrors() {}

    /** For failures while opening and parsing an input: iText errors there mean a bad file. */
    public static EngineException translateRead(String context, Exception cause) {
        return build(context, categorize(cause, true), cause);
    }

    /** For failures while changing or serializing an already opened document. */
    public static EngineException translate(String context, Exception cause) {
        return build(context, categorize(cause, false), cause);
    }

    private static EngineException build(String context, EngineError error, Exception cause) {
        String message = context;
        if (error == EngineError.UNKNOWN && cause.getMessage() != null) {
            message = context + " (" + cause.getMessage() + ")";
        }
        return new EngineException(error, message, cause);
    }

    static EngineError categorize(Throwable cause, boolean reading) {
        if (cause instanceof BadPasswordException) {
            return EngineError.PASSWORD;
        }
        if (cause instanceof NoSuchFileException
                || cause instanceof FileNotFoundException
                || cause instanceof AccessDeniedException) {
            return EngineError.FILE;
        }
        if (cause instanceof PdfException) {
            String message = String.valueOf(cause.getMessage()).toLowerCase(Locale.ROOT);
            if (message.contains("security") || message.contains("encrypt")) {
                return EngineError.SECURITY;
            }
            if (message.contains("xfa")) {
                return EngineError.XFA_LOAD;
            }
            return reading ? EngineError.FORMAT : EngineError.UNKNOWN;
        }
        if (cause instanceof ITextException) {
            return reading ? EngineError.FORMAT : EngineError.UNKNOWN;
        }
        if (cause instanceof IOException) {
            return EngineError.FILE;
        }
        if (cause instanceof IndexOutOfBoundsException) {
            return EngineError.PAGE;
        }
        return EngineError.UNKNOWN;
    }
}
