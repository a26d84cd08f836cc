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
package net.boyechko.pdf.toolkit.render;

import com.itextpdf.io.image.ImageData;
import com.itextpdf.io.image.ImageDataFactory;
import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.canvas.PdfCanvas;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import net.boyechko.pdf.toolkit.core.FilenameSanitizer;
import net.boyechko.pdf.toolkit.core.NamingPlan;
import net.boyechko.pdf.toolkit.core.NamingStrategy;
import net.boyechko.pdf.toolkit.core.PdfOperationException;
import net.boyechko.pdf.toolkit.core.ProgressListener;
import net.boyechko.pdf.toolkit.engine.EngineError;
import net.boyechko.pdf.toolkit.engine.EngineException;
import net.boyechko.pdf.toolkit.engine.EngineLock;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Renders pages to image files with PDFBox, and wraps images into single-page PDFs. */
public class RenderService {
    private static final Logger logger = LoggerFactory.getLogger(RenderService.class);

    public static final int DEFAULT_DPI = 200;
    public static final int MIN_DPI = 1;
    public static final int MAX_DPI = 2400;

    private final ProgressListener listener;

    public RenderService() {
        this(ProgressListener.NONE);
    }

    public RenderService(ProgressListener listener) {
        this.listener = ProgressListener.safe(listener);
    }

    /**
     * Renders the selected pages into {@code request.outputDirectory()}.
     *
     * @return the image files written, in page order
     */
    public List<Path> convertToImages(RenderRequest request) throws PdfOperationException {
        Path input = request.input();
        String stem = FilenameSanitizer.sanitize(NamingStrategy.stem(input));
        ImageFormat format = formatFor(request);
        logger.info("Rendering {} at {} dpi as {}", input, request.dpi(), format);

        List<Path> written = new ArrayList<>();
        try (EngineLock.Guard guard = EngineLock.acquire();
                PDDocument document = loadForRendering(input, request.password())) {
            PDFRenderer renderer = new PDFRenderer(document);
            int total = document.getNumberOfPages();
            SortedSet<Integer> pages = request.range().resolve(total);
            if (!request.range().isAll() && pages.isEmpty()) {
                throw new IllegalArgumentException(
                        "Page range '" + request.range() + "' matches no page (1-" + total + ")");
            }
            Files.createDirectories(request.outputDirectory());

            NamingPlan plan = new NamingPlan();
            for (int page : pages) {
                String name = plan.claim(page, imageName(request.template(), stem, page));
                String fileName = name + "." + format.extension();
                Path target = request.outputDirectory().resolve(fileName);
                try {
                    BufferedImage image =
                            renderer.renderImageWithDPI(page - 1, request.dpi(), ImageType.RGB);
                    Files.write(target, ImageCodec.encode(image, format));
                } catch (IOException | RuntimeException e) {
                    throw new PdfOperationException(
                            "Failed to render page " + page + " to " + fileName, e);
                }
                written.add(target);
                logger.debug("Rendered page {} to {}", page, target);
                listener.onProgress(page, total, fileName);
            }
        } catch (IOException e) {
            throw new PdfOperationException("Failed to render " + input, e);
        }
        logger.info("Rendered {} page(s) of {}", written.size(), input.getFileName());
        return written;
    }

    /** Chooses the format from the template's extension when it has one. */
    static ImageFormat formatFor(RenderRequest request) {
        String template = request.template();
        if (template != null && template.indexOf('.') >= 0) {
            return ImageFormat.fromFileName(template);
        }
        return request.format();
    }

    /** The name part of an image file, without the extension. */
    static String imageName(String template, String stem, int page) {
        if (template == null || template.isBlank()) {
            return NamingStrategy.defaultName(stem, page);
        }
        String base = template;
        int dot = base.lastIndexOf('.');
        if (dot >= 0) {
            base = base.substring(0, dot);
        }
        String name = FilenameSanitizer.sanitize(NamingStrategy.applyTemplate(base, stem, page));
        return name.isBlank() ? NamingStrategy.defaultName(stem, page) : name;
    }

    private static PDDocument loadForRendering(Path input, String password)
            throws PdfOperationException {
        if (!Files.isRegularFile(input)) {
            throw new PdfOperationException(
                    "Failed to load " + input,
                    new EngineException(EngineError.FILE, "Cannot open " + input));
        }
        try {
            return Loader.loadPDF(input.toFile(), password == null ? "" : password);
        } catch (InvalidPasswordException e) {
            throw new PdfOperationException(
                    "Failed to load " + input,
                    new EngineException(EngineError.PASSWORD, "Cannot open " + input, e));
        } catch (IOException e) {
            throw new PdfOperationException(
                    "Failed to load " + input,
                    new EngineException(EngineError.FORMAT, "Cannot open " + input, e));
        }
    }

    // ── Image to PDF ────────────────────────────────────────────────

    /** Default output for {@link #imageToPdf}: the image path with a {@code .pdf} extension. */
    public static Path defaultPdfPath(Path image) {
        return image.resolveSibling(NamingStrategy.stem(image) + ".pdf");
    }

    /**
     * Writes a one-page PDF whose page size in points equals the image's size in pixels, with the
     * image covering the whole page.
     */
    public Path imageToPdf(Path image, Path output) throws PdfOperationException {
        if (image == null) {
            throw new IllegalArgumentException("Image path is required");
        }
        Path target = output != null ? output : defaultPdfPath(image);
        logger.info("Converting {} to {}", image, target);

        BufferedImage decoded;
        try {
            decoded = ImageCodec.decode(image);
        } catch (IOException e) {
            throw new PdfOperationException("Failed to read image " + image, e);
        }

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (EngineLock.Guard guard = EngineLock.acquire()) {
            try (PdfDocument pdf = new PdfDocument(new PdfWriter(buffer))) {
                PageSize size = new PageSize(decoded.getWidth(), decoded.getHeight());
                PdfPage page = pdf.addNewPage(size);
                ImageData data = ImageDataFactory.create(decoded, null);
                new PdfCanvas(page).addImageFittedIntoRectangle(data, size, false);
            }
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(target, buffer.toByteArray());
        } catch (IOException | RuntimeException e) {
            throw new PdfOperationException("Failed to convert " + image + " to PDF", e);
        }
        listener.onProgress(1, 1, target.getFileName().toString());
        return target;
    }
}
