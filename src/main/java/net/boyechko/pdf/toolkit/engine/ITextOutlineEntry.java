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

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfString;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import net.boyechko.pdf.toolkit.document.NameTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outline node read straight from the {@code /Outlines} dictionaries. Links that point back to an
 * already visited node are treated as absent.
 */
final class ITextOutlineEntry implements OutlineEntry {
    private static final Logger logger = LoggerFactory.getLogger(ITextOutlineEntry.class);

    private final PdfDocument document;
    private final PdfDictionary node;
    private final Set<PdfDictionary> visited;
    private OutlineEntry firstChild;
    private OutlineEntry nextSibling;
    private boolean linksResolved;

    private ITextOutlineEntry(
            PdfDocument document, PdfDictionary node, Set<PdfDictionary> visited) {
        this.document = document;
        this.node = node;
        this.visited = visited;
    }

    static OutlineEntry first(PdfDocument document, PdfDictionary outlineRoot) {
        Set<PdfDictionary> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        visited.add(outlineRoot);
        return link(document, outlineRoot.getAsDictionary(PdfName.First), visited);
    }

    private static OutlineEntry link(
            PdfDocument document, PdfDictionary target, Set<PdfDictionary> visited) {
        if (target == null) {
            return null;
        }
        if (!visited.add(target)) {
            logger.warn("Outline contains a cycle; ignoring repeated entry");
            return null;
        }
        return new ITextOutlineEntry(document, target, visited);
    }

    @Override
    public String title() {
        PdfString title = node.getAsString(PdfName.Title);
        return title == null ? "" : title.toUnicodeString();
    }

    @Override
    public OutlineEntry firstChild() {
        resolveLinks();
        return firstChild;
    }

    @Override
    public OutlineEntry nextSibling() {
        resolveLinks();
        return nextSibling;
    }

    private void resolveLinks() {
        if (linksResolved) {
            return;
        }
        linksResolved = true;
        firstChild = link(document, node.getAsDictionary(PdfName.First), visited);
        nextSibling = link(document, node.getAsDictionary(PdfName.Next), visited);
    }

    @Override
    public ActionKind actionKind() {
        PdfDictionary action = node.getAsDictionary(PdfName.A);
        if (action == null) {
            return null;
        }
        PdfName type = action.getAsName(PdfName.S);
        if (PdfName.GoTo.equals(type)) {
            return ActionKind.GOTO;
        } else if (PdfName.GoToR.equals(type)) {
            return ActionKind.REMOTE_GOTO;
        } else if (PdfName.URI.equals(type)) {
            return ActionKind.URI;
        } else if (PdfName.Launch.equals(type)) {
            return ActionKind.LAUNCH;
        } else if (PdfName.GoToE.equals(type)) {
            return ActionKind.EMBEDDED_GOTO;
        }
        return ActionKind.UNSUPPORTED;
    }

    @Override
    public Integer actionDestinationPage() {
        PdfDictionary action = node.getAsDictionary(PdfName.A);
        if (action == null) {
            return null;
        }
        boolean remote = PdfName.GoToR.equals(action.getAsName(PdfName.S));
        return pageOf(action.get(PdfName.D), remote);
    }

    @Override
    public Integer destinationPage() {
        return pageOf(node.get(PdfName.Dest), false);
    }

    private Integer pageOf(PdfObject destination, boolean remote) {
        PdfObject explicit = remote ? destination : resolveNamed(destination);
        if (explicit instanceof PdfDictionary dict) {
            explicit = dict.get(PdfName.D);
        }
        if (!(explicit instanceof PdfArray array) || array.isEmpty()) {
            return null;
        }
        PdfObject target = array.get(0);
        if (target instanceof PdfDictionary pageDict && !remote) {
            int pageNumber = document.getPageNumber(pageDict);
            return pageNumber > 0 ? pageNumber : null;
        }
        if (target instanceof PdfNumber index) {
            // Page index in the target document (0-based)
            return index.intValue() + 1;
        }
        return null;
    }

    /** Looks up named destinations in the catalog's /Dests dictionary and /Names tree. */
    private PdfObject resolveNamed(PdfObject destination) {
        if (destination == null || destination instanceof PdfArray) {
            return destination;
        }
        String name;
        if (destination instanceof PdfName pdfName) {
            name = pdfName.getValue();
            PdfDictionary dests =
                    document.getCatalog().getPdfObject().getAsDictionary(PdfName.Dests);
            if (dests != null && dests.get(pdfName) != null) {
                return dests.get(pdfName);
            }
        } else if (destination instanceof PdfString pdfString) {
            name = pdfString.toUnicodeString();
        } else {
            return destination;
        }
        return NameTrees.lookup(NameTrees.root(document, PdfName.Dests), name);
    }
}
