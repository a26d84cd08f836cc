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
package net.boyechko.pdf.toolkit.extract;

import com.itextpdf.kernel.geom.IShape;
import com.itextpdf.kernel.geom.LineSegment;
import com.itextpdf.kernel.geom.Matrix;
import com.itextpdf.kernel.geom.Point;
import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.geom.Subpath;
import com.itextpdf.kernel.geom.Vector;
import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.annot.PdfAnnotation;
import com.itextpdf.kernel.pdf.canvas.parser.EventType;
import com.itextpdf.kernel.pdf.canvas.parser.PdfCanvasProcessor;
import com.itextpdf.kernel.pdf.canvas.parser.data.IEventData;
import com.itextpdf.kernel.pdf.canvas.parser.data.ImageRenderInfo;
import com.itextpdf.kernel.pdf.canvas.parser.data.PathRenderInfo;
import com.itextpdf.kernel.pdf.canvas.parser.data.TextRenderInfo;
import com.itextpdf.kernel.pdf.canvas.parser.listener.IEventListener;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import net.boyechko.pdf.toolkit.core.PageSelection;
import net.boyechko.pdf.toolkit.core.PdfOperationException;
import net.boyechko.pdf.toolkit.document.PdfCustodian;
import net.boyechko.pdf.toolkit.engine.EngineException;
import net.boyechko.pdf.toolkit.engine.EngineLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the drawing operations of each page (text runs, images, painted paths) followed by its
 * annotations, in content-stream order.
 */
public class PageObjectService {
    private static final Logger logger = LoggerFactory.getLogger(PageObjectService.class);

    public List<PageObject> list(PdfCustodian custodian, PageSelection selection)
            throws PdfOperationException {
        try (EngineLock.Guard guard = EngineLock.acquire();
                PdfDocument document = custodian.openForReading()) {
            SortedSet<Integer> pages =
                    Extraction.selectedPages(selection, document.getNumberOfPages());
            List<PageObject> objects = new ArrayList<>();
            for (int pageNumber : pages) {
                PdfPage page = document.getPage(pageNumber);
                int before = objects.size();
                try {
                    new PdfCanvasProcessor(new ObjectCollector(pageNumber, objects))
                            .processPageContent(page);
                } catch (RuntimeException e) {
                    throw new PdfOperationException(
                            "Failed to parse content of page " + pageNumber, e);
                }
                for (PdfAnnotation annotation : page.getAnnotations()) {
                    PdfArray rect = annotation.getRectangle();
                    if (rect != null) {
                        add(objects, pageNumber, PageObject.Type.ANNOTATION, rect.toRectangle());
                    }
                }
                logger.debug("Found {} object(s) on page {}", objects.size() - before, pageNumber);
            }
            logger.info("Found {} object(s) on {} page(s)", objects.size(), pages.size());
            return objects;
        } catch (EngineException e) {
            throw new PdfOperationException("Failed to read " + custodian.inputPath(), e);
        }
    }

    private static final class ObjectCollector implements IEventListener {
        private final int page;
        private final List<PageObject> into;

        private ObjectCollector(int page, List<PageObject> into) {
            this.page = page;
            this.into = into;
        }

        @Override
        public void eventOccurred(IEventData data, EventType type) {
            if (type == EventType.RENDER_TEXT) {
                add(into, page, PageObject.Type.TEXT, rectFromText((TextRenderInfo) data));
            } else if (type == EventType.RENDER_IMAGE) {
                add(into, page, PageObject.Type.IMAGE, rectFromImage((ImageRenderInfo) data));
            } else if (type == EventType.RENDER_PATH) {
                PathRenderInfo path = (PathRenderInfo) data;
                if (path.getOperation() != PathRenderInfo.NO_OP) {
                    add(into, page, PageObject.Type.PATH, rectFromPath(path));
                }
            }
        }

        @Override
        public Set<EventType> getSupportedEvents() {
            return Set.of(EventType.RENDER_TEXT, EventType.RENDER_IMAGE, EventType.RENDER_PATH);
        }
    }

    private static void add(List<PageObject> into, int page, PageObject.Type type, Rectangle r) {
        if (r == null) {
            return;
        }
        into.add(new PageObject(page, type, r.getLeft(), r.getBottom(), r.getRight(), r.getTop()));
    }

    private static Rectangle rectFromText(TextRenderInfo info) {
        String text = info.getText();
        if (text == null || text.isEmpty()) {
            return null;
        }
        LineSegment ascent = info.getAscentLine();
        LineSegment descent = info.getDescentLine();
        return rectFromPoints(
                List.of(
                        ascent.getStartPoint(),
                        ascent.getEndPoint(),
                        descent.getStartPoint(),
                        descent.getEndPoint()));
    }

    private static Rectangle rectFromImage(ImageRenderInfo info) {
        Matrix ctm = info.getImageCtm();
        if (ctm == null) {
            return null;
        }
        return rectFromPoints(
                List.of(
                        new Vector(0, 0, 1).cross(ctm),
                        new Vector(1, 0, 1).cross(ctm),
                        new Vector(1, 1, 1).cross(ctm),
                        new Vector(0, 1, 1).cross(ctm)));
    }

    private static Rectangle rectFromPath(PathRenderInfo info) {
        Matrix ctm = info.getCtm();
        List<Vector> points = new ArrayList<>();
        for (Subpath subpath : info.getPath().getSubpaths()) {
            Point start = subpath.getStartPoint();
            if (start != null) {
                points.add(transform(start, ctm));
            }
            for (IShape segment : subpath.getSegments()) {
                for (Point point : segment.getBasePoints()) {
                    points.add(transform(point, ctm));
                }
            }
        }
        return rectFromPoints(points);
    }

    private static Vector transform(Point point, Matrix ctm) {
        return new Vector((float) point.getX(), (float) point.getY(), 1).cross(ctm);
    }

    private static Rectangle rectFromPoints(List<Vector> points) {
        if (points.isEmpty()) {
            return null;
        }
        float minX = Float.MAX_VALUE;
        float minY = Float.MAX_VALUE;
        float maxX = -Float.MAX_VALUE;
        float maxY = -Float.MAX_VALUE;
        for (Vector point : points) {
            float x = point.get(Vector.I1);
            float y = point.get(Vector.I2);
            minX = Math.min(minX, x);
            minY = Math.min(minY, y);
            maxX = Math.max(maxX, x);
            maxY = Math.max(maxY, y);
        }
        return new Rectangle(minX, minY, maxX - minX, maxY - minY);
    }
}
