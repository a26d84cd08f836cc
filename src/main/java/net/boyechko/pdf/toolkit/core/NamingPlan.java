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

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Names issued during one operation. A name already issued for another page gets the page number
 * appended ({@code -NNN}), then a counter ({@code -NNN-2}, {@code -NNN-3}, ...) until it is free.
 * Names compare case-insensitively.
 */
public final class NamingPlan {
    private static final Logger logger = LoggerFactory.getLogger(NamingPlan.class);

    private final Set<String> taken = new HashSet<>();
    private final Map<Integer, String> byPage = new LinkedHashMap<>();

    /** Records a name for {@code page}, returning it or its disambiguated form. */
    public String claim(int page, String name) {
        String existing = byPage.get(page);
        if (existing != null && existing.equalsIgnoreCase(name)) {
            return existing;
        }
        String candidate = name;
        if (taken.contains(key(candidate))) {
            String base = name + "-" + NamingStrategy.padPage(page);
            candidate = base;
            for (int k = 2; taken.contains(key(candidate)); k++) {
                candidate = base + "-" + k;
            }
            logger.warn(
                    "Output name '{}' already used; page {} saved as '{}'", name, page, candidate);
        }
        if (existing != null) {
            taken.remove(key(existing));
        }
        taken.add(key(candidate));
        byPage.put(page, candidate);
        return candidate;
    }

    /** Names issued so far, keyed by page, in claim order. */
    public Map<Integer, String> entries() {
        return Collections.unmodifiableMap(byPage);
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
