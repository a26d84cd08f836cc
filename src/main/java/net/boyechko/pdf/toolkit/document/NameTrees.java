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
package net.boyechko.pdf.toolkit.document;

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfString;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads PDF name trees (such as {@code /Dests} and {@code /EmbeddedFiles}) from raw objects. */
public final class NameTrees {
    private static final Logger logger = LoggerFactory.getLogger(NameTrees.class);

    private static final int MAX_DEPTH = 32;

    private NameTrees() {}

    /** Returns the root of the named tree under the catalog's {@code /Names}, or null. */
    public static PdfDictionary root(PdfDocument document, PdfName treeName) {
        PdfDictionary names = document.getCatalog().getPdfObject().getAsDictionary(PdfName.Names);
        return names == null ? null : names.getAsDictionary(treeName);
    }

    /** All leaf entries in key order as stored, keyed by Unicode string. First key wins. */
    public static Map<String, PdfObject> entries(PdfDictionary treeRoot) {
        Map<String, PdfObject> result = new LinkedHashMap<>();
        collect(treeRoot, result, 0);
        return result;
    }

    public static PdfObject lookup(PdfDictionary treeRoot, String key) {
        return lookup(treeRoot, key, 0);
    }

    private static PdfObject lookup(PdfDictionary node, String key, int depth) {
        if (node == null || tooDeep(depth)) {
            return null;
        }
        PdfArray leaves = node.getAsArray(PdfName.Names);
        if (leaves != null) {
            for (int i = 0; i + 1 < leaves.size(); i += 2) {
                PdfString entryKey = leaves.getAsString(i);
                if (entryKey != null && key.equals(entryKey.toUnicodeString())) {
                    return leaves.get(i + 1);
                }
            }
        }
        PdfArray kids = node.getAsArray(PdfName.Kids);
        if (kids != null) {
            for (int i = 0; i < kids.size(); i++) {
                PdfObject found = lookup(kids.getAsDictionary(i), key, depth + 1);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private static void collect(PdfDictionary node, Map<String, PdfObject> into, int depth) {
        if (node == null || tooDeep(depth)) {
            return;
        }
        PdfArray leaves = node.getAsArray(PdfName.Names);
        if (leaves != null) {
            for (int i = 0; i + 1 < leaves.size(); i += 2) {
                PdfString entryKey = leaves.getAsString(i);
                if (entryKey != null) {
                    into.putIfAbsent(entryKey.toUnicodeString(), leaves.get(i + 1));
                }
            }
        }
        PdfArray kids = node.getAsArray(PdfName.Kids);
        if (kids != null) {
            for (int i = 0; i < kids.size(); i++) {
                collect(kids.getAsDictionary(i), into, depth + 1);
            }
        }
    }

    private static boolean tooDeep(int depth) {
        if (depth > MAX_DEPTH) {
            logger.warn("Name tree deeper than {} levels; ignoring the rest", MAX_DEPTH);
            return true;
        }
        return false;
    }
}
