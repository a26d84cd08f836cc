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

import com.itextpdf.io.image.ImageData;
import com.itextpdf.io.image.ImageDataFactory;
import com.itextpdf.kernel.colors.DeviceRgb;
import com.itextpdf.kernel.font.PdfFont;
import com.itextpdf.kernel.font.PdfFontFactory;
import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.canvas.PdfCanvas;
import com.itextpdf.kernel.pdf.extgstate.PdfExtGState;
import com.itextpdf.layout.Canvas;
import com.itextpdf.layout.properties.TextAlignment;
import com.itextpdf.layout.properties.VerticalAlignment;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.SortedSet;
import net.boyechko.pdf.toolkit.core.PageSelection;
import net.boyechko.pdf.toolkit.core.PdfOperationException;
import net.boyechko.pdf.toolkit.core.ProgressListener;
import net.boyechko.pdf.toolkit.document.PdfCustodian;
import net.boyechko.pdf.toolkit.engine.EngineException;
import net.boyechko.pdf.toolkit.engine.EngineLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stamps text or an image over the centre of selected pages. Text is rotated about its centre;
 * images are drawn at their pixel size times the scale factor.
 */
public class WatermarkService {
    private static final Logger logger = LoggerFactory.getLogger(WatermarkService.class);

    private final ProgressListener listener;

    public WatermarkService() {
        this(ProgressListener.NONE);
    }

    public WatermarkService(ProgressListener listener) {
        this.listener = ProgressListener.safe(listener);
    }

    /** Writes the watermarked document to {@code output}, keeping the input's encryption. */
    public int apply(
            PdfCustodian custodian, Path output, WatermarkOptions options, PageSelection selection)
            throws PdfOperationException {
        if (output == null) {
            throw new IllegalArgumentException("Output path is required");
        }
        if (output.toAbsolutePath().equals(custodian.inputPath().toAbsolutePath())) {
            throw new IllegalArgumentException("Output must differ from input " + output);
        }
        ImageData image = options.isText() ? null : loadImage(options.image());
        int stamped = 0;
        try (EngineLock.Guard guard = EngineLock.acquire()) {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (PdfDocument document = custodian.openForModification(output)) {
                int total = document.getNumberOfPages();
                SortedSet<Integer> pages = Extraction.selectedPages(selection, total);
                PdfFont font = options.isText() ? PdfFontFactory.createFont(options.font()) : null;
                PdfExtGState transparency =
                        new PdfExtGState().setFillOpacity(options.opacity() / 255f);
                for (int pageNumber : pages) {
                    PdfPage page = document.getPage(pageNumber);
                    PdfCanvas canvas = new PdfCanvas(page);
                    canvas.saveState().setExtGState(transparency);
                    if (font != null) {
                        stampText(canvas, page.getPageSize(), font, options);
                    } else {
                        stampImage(canvas, page.getPageSize(), image, options.scale());
                    }
                    canvas.restoreState().release();
                    stamped++;
                    logger.debug("Watermarked page {}", pageNumber);
                    listener.onProgress(pageNumber, total, "page " + pageNumber);
                }
            }
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (EngineException | IOException | RuntimeException e) {
            throw new PdfOperationException(
                    "Failed to watermark " + custodian.inputPath() + " into " + output, e);
        }
        logger.info("Watermarked {} page(s) into {}", stamped, output);
        return stamped;
    }

    private static void stampText(
            PdfCanvas pdfCanvas, Rectangle area, PdfFont font, WatermarkOptions options) {
        try (Canvas canvas = new Canvas(pdfCanvas, area)) {
            canvas.setFont(font)
                    .setFontSize(options.fontSize())
                    .setFontColor(new DeviceRgb(options.red(), options.green(), options.blue()))
                    .showTextAligned(
                            options.text(),
                            area.getX() + area.getWidth() / 2,
                            area.getY() + area.getHeight() / 2,
                            TextAlignment.CENTER,
                            VerticalAlignment.MIDDLE,
                            (float) Math.toRadians(options.rotation()));
        }
    }

    private static void stampImage(PdfCanvas canvas, Rectangle area, ImageData image, float scale) {
        float width = image.getWidth() * scale;
        float height = image.getHeight() * scale;
        float x = area.getX() + (area.getWidth() - width) / 2;
        float y = area.getY() + (area.getHeight() - height) / 2;
        canvas.addImageWithTransformationMatrix(image, width, 0, 0, height, x, y);
    }

    private static ImageData loadImage(Path path) throws PdfOperationException {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Watermark image not found: " + path);
        }
        try {
            return ImageDataFactory.create(path.toString());
        } catch (IOException | RuntimeException e) {
            throw new PdfOperationException("Failed to read watermark image " + path, e);
        }
    }
}
