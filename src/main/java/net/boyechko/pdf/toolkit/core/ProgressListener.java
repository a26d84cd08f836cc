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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives progress as an operation advances. Called synchronously on the operation's thread, in
 * order, with {@code 0 <= current <= total}.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (current, total, context) -> {};

    void onProgress(int current, int total, String context);

    /** Wraps a listener so that its failures are logged instead of reaching the operation. */
    static ProgressListener safe(ProgressListener listener) {
        if (listener == null || listener == NONE) {
            return NONE;
        }
        Logger logger = LoggerFactory.getLogger(ProgressListener.class);
        return (current, total, context) -> {
            try {
                listener.onProgress(current, total, context);
            } catch (RuntimeException e) {
                logger.warn("Progress listener failed at {}/{}: {}", current, total, e.toString());
            }
        };
    }
}
