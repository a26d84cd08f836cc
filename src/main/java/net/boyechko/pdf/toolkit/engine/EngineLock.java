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

import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide mutual exclusion around engine use. At most one engine operation is in flight at
 * any time, whichever thread starts it.
 *
 * <pre>{@code
 * try (EngineLock.Guard guard = EngineLock.acquire()) {
 *     // load, mutate, save, close
 * }
 * }</pre>
 */
public final class EngineLock {
    private static final ReentrantLock LOCK = new ReentrantLock(true);

    private EngineLock() {}

    /** Releases the lock when closed; close it exactly once. */
    @FunctionalInterface
    public interface Guard extends AutoCloseable {
        @Override
        void close();
    }

    public static Guard acquire() {
        LOCK.lock();
        return LOCK::unlock;
    }

    public static boolean isHeldByCurrentThread() {
        return LOCK.isHeldByCurrentThread();
    }

    /** True while any thread holds the lock. */
    public static boolean isLocked() {
        return LOCK.isLocked();
    }
}
