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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A set of 1-based display page numbers parsed from a range specification such as {@code
 * "1,3,5-8"}.
 *
 * <p>A {@code null} or blank specification yields {@link #all()}, which includes every page and is
 * distinct from an empty selection. Malformed tokens are skipped; a token whose start exceeds its
 * end contributes nothing. Pages are held as merged runs, so {@code "1-2147483647"} costs no more
 * than {@code "1-2"}.
 */
public final class PageSelection {
    private static final Logger logger = LoggerFactory.getLogger(PageSelection.class);

    private static final PageSelection ALL = new PageSelection(null);

    /** Inclusive run of pages. */
    private record Run(int start, int end) {
        long length() {
            return (long) end - start + 1;
        }
    }

    /** Sorted, disjoint, non-adjacent runs; null for the "no filter" selection. */
    private final List<Run> runs;

    private PageSelection(List<Run> runs) {
        this.runs = runs;
    }

    public static PageSelection all() {
        return ALL;
    }

    public static PageSelection of(Iterable<Integer> pageNumbers) {
        List<Run> runs = new ArrayList<>();
        for (Integer page : pageNumbers) {
            if (page == null || page < 1) {
                throw new IllegalArgumentException("Page numbers must be >= 1, got " + page);
            }
            runs.add(new Run(page, page));
        }
        return new PageSelection(merge(runs));
    }

    /** Parses a range specification, skipping malformed tokens. */
    public static PageSelection parse(String spec) {
        if (spec == null || spec.isBlank()) {
            return ALL;
        }
        List<Run> runs = new ArrayList<>();
        for (String rawToken : spec.split(",")) {
            String token = rawToken.trim();
            if (token.isEmpty()) {
                continue;
            }
            int dash = token.indexOf('-');
            if (dash < 0) {
                Integer page = parsePageNumber(token);
                if (page != null) {
                    runs.add(new Run(page, page));
                } else {
                    logger.debug("Skipping malformed page token '{}'", token);
                }
                continue;
            }
            Integer start = parsePageNumber(token.substring(0, dash).trim());
            Integer end = parsePageNumber(token.substring(dash + 1).trim());
            if (start == null || end == null) {
                logger.debug("Skipping malformed page range '{}'", token);
                continue;
            }
            if (start <= end) {
                runs.add(new Run(start, end));
            }
        }
        return new PageSelection(merge(runs));
    }

    /**
     * Parses a range specification that must select at least one page.
     *
     * @throws IllegalArgumentException if a non-blank specification yields no pages
     */
    public static PageSelection parseRequired(String spec) {
        PageSelection selection = parse(spec);
        if (!selection.isAll() && selection.isEmpty()) {
            throw new IllegalArgumentException("Invalid page range: '" + spec + "'");
        }
        return selection;
    }

    private static List<Run> merge(List<Run> runs) {
        runs.sort(Comparator.comparingInt(Run::start));
        List<Run> merged = new ArrayList<>();
        for (Run run : runs) {
            if (!merged.isEmpty()) {
                Run last = merged.get(merged.size() - 1);
                if (run.start() <= (long) last.end() + 1) {
                    merged.set(
                            merged.size() - 1,
                            new Run(last.start(), Math.max(last.end(), run.end())));
                    continue;
                }
            }
            merged.add(run);
        }
        return Collections.unmodifiableList(merged);
    }

    private static Integer parsePageNumber(String text) {
        if (text.isEmpty()) {
            return null;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
        }
        try {
            int value = Integer.parseInt(text);
            return value >= 1 ? value : null;
        } catch (NumberFormatException e) {
            logger.debug("Page number out of range: {}", text);
            return null;
        }
    }

    public boolean isAll() {
        return runs == null;
    }

    public boolean isEmpty() {
        return runs != null && runs.isEmpty();
    }

    public boolean includes(int page) {
        if (runs == null) {
            return true;
        }
        int low = 0;
        int high = runs.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            Run run = runs.get(mid);
            if (page < run.start()) {
                high = mid - 1;
            } else if (page > run.end()) {
                low = mid + 1;
            } else {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns every selected page in ascending order; empty for {@link #all()}. Prefer {@link
     * #resolve(int)} when the selection comes from user input, since open-ended ranges are large.
     */
    public SortedSet<Integer> pages() {
        if (runs == null) {
            return Collections.emptySortedSet();
        }
        return Collections.unmodifiableSortedSet(collect(Integer.MAX_VALUE));
    }

    /** Returns the selected pages that exist in a document of {@code pageCount} pages. */
    public SortedSet<Integer> resolve(int pageCount) {
        if (runs == null) {
            TreeSet<Integer> result = new TreeSet<>();
            for (int p = 1; p <= pageCount; p++) {
                result.add(p);
            }
            return result;
        }
        return collect(pageCount);
    }

    private TreeSet<Integer> collect(int lastPage) {
        TreeSet<Integer> result = new TreeSet<>();
        for (Run run : runs) {
            if (run.start() > lastPage) {
                break;
            }
            int end = Math.min(run.end(), lastPage);
            for (int p = run.start(); p <= end; p++) {
                result.add(p);
                if (p == Integer.MAX_VALUE) {
                    break;
                }
            }
        }
        return result;
    }

    /** Number of selected pages; 0 for {@link #all()}. */
    public long size() {
        return runs == null ? 0 : runs.stream().mapToLong(Run::length).sum();
    }

    /** Canonical form: ascending, consecutive runs collapsed to {@code a-b}; empty for all. */
    @Override
    public String toString() {
        if (runs == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Run run : runs) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(run.start());
            if (run.end() > run.start()) {
                sb.append('-').append(run.end());
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PageSelection other)) return false;
        return Objects.equals(runs, other.runs);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(runs);
    }
}
