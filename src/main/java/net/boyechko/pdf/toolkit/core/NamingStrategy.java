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

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the output name (without extension) for a page. Exactly one source wins, in this
 * order: explicit override, bookmark title, template, default {@code {original}-{page}}.
 *
 * <p>{@code {page}} is always zero-padded to three digits. Every returned name passes {@link
 * FilenameSanitizer#isValid}.
 */
public final class NamingStrategy {
    private static final Logger logger = LoggerFactory.getLogger(NamingStrategy.class);

    public static final int DEFAULT_TITLE_MAX_LENGTH = 100;
    public static final String ORIGINAL_PLACEHOLDER = "{original}";
    public static final String PAGE_PLACEHOLDER = "{page}";

    private final int titleMaxLength;

    public NamingStrategy() {
        this(DEFAULT_TITLE_MAX_LENGTH);
    }

    public NamingStrategy(int titleMaxLength) {
        if (titleMaxLength < 1) {
            throw new IllegalArgumentException("Title length limit must be >= 1");
        }
        this.titleMaxLength = titleMaxLength;
    }

    public String resolve(
            int page,
            String originalStem,
            Map<Integer, String> overrides,
            Map<Integer, String> bookmarkNames,
            String template) {
        String original = FilenameSanitizer.sanitize(originalStem);

        String override = overrides == null ? null : overrides.get(page);
        if (override != null) {
            String name = FilenameSanitizer.sanitize(override);
            if (!name.isBlank()) {
                return name;
            }
            logger.warn("Ignoring override for page {}: no usable characters", page);
        }

        String title = bookmarkNames == null ? null : bookmarkNames.get(page);
        if (title != null) {
            String name = FilenameSanitizer.sanitize(title);
            if (name.length() > titleMaxLength) {
                name = name.substring(0, titleMaxLength);
            }
            if (!name.isBlank()) {
                return name;
            }
        }

        if (template != null && !template.isEmpty()) {
            String name = FilenameSanitizer.sanitize(applyTemplate(template, original, page));
            if (!name.isBlank()) {
                return name;
            }
        }

        return defaultName(original, page);
    }

    public static String defaultName(String original, int page) {
        return original + "-" + padPage(page);
    }

    public static String applyTemplate(String template, String original, int page) {
        return template.replace(ORIGINAL_PLACEHOLDER, original)
                .replace(PAGE_PLACEHOLDER, padPage(page));
    }

    public static String padPage(int page) {
        return String.format("%03d", page);
    }

    /** File name without its last extension. */
    public static String stem(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Parses a name-list file. {@code N=name} assigns page N and moves the counter to N; any other
     * non-blank line assigns the current counter. The counter starts at 1 and advances after every
     * line. The first assignment of a page wins.
     */
    public static Map<Integer, String> parseNameList(List<String> lines) {
        Map<Integer, String> names = new HashMap<>();
        int counter = 1;
        for (String line : lines) {
            int equals = line.indexOf('=');
            if (equals >= 0) {
                String key = line.substring(0, equals).trim();
                String value = line.substring(equals + 1);
                try {
                    int page = Integer.parseInt(key);
                    if (page >= 1) {
                        names.putIfAbsent(page, value);
                        counter = page;
                    } else {
                        logger.warn("Ignoring name-list entry for page {}", page);
                    }
                } catch (NumberFormatException e) {
                    logger.warn("Ignoring malformed name-list line: {}", line);
                }
            } else if (!line.isBlank()) {
                names.putIfAbsent(counter, line);
            }
            counter++;
        }
        return names;
    }
}
