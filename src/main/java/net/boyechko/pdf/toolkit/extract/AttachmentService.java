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

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfStream;
import com.itextpdf.kernel.pdf.PdfString;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import net.boyechko.pdf.toolkit.core.FilenameSanitizer;
import net.boyechko.pdf.toolkit.core.PdfOperationException;
import net.boyechko.pdf.toolkit.document.NameTrees;
import net.boyechko.pdf.toolkit.document.PdfCustodian;
import net.boyechko.pdf.toolkit.engine.EngineException;
import net.boyechko.pdf.toolkit.engine.EngineLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Lists and saves the files in the document's {@code /EmbeddedFiles} name tree. */
public class AttachmentService {
    private static final Logger logger = LoggerFactory.getLogger(AttachmentService.class);

    private static final PdfName PARAMS = new PdfName("Params");
    private static final PdfName SIZE = new PdfName("Size");

    public List<Attachment> list(PdfCustodian custodian) throws PdfOperationException {
        try (EngineLock.Guard guard = EngineLock.acquire();
                PdfDocument document = custodian.openForReading()) {
            List<Attachment> attachments = new ArrayList<>();
            for (Embedded embedded : embeddedFiles(document)) {
                attachments.add(embedded.describe());
            }
            logger.info("Found {} attachment(s) in {}", attachments.size(), custodian.inputPath());
            return attachments;
        } catch (EngineException e) {
            throw new PdfOperationException("Failed to read " + custodian.inputPath(), e);
        }
    }

    /** Saves the attachment at {@code index} into {@code outputDirectory}. */
    public Path extract(PdfCustodian custodian, int index, Path outputDirectory)
            throws PdfOperationException {
        try (EngineLock.Guard guard = EngineLock.acquire();
                PdfDocument document = custodian.openForReading()) {
            List<Embedded> files = embeddedFiles(document);
            if (index < 0 || index >= files.size()) {
                throw new IllegalArgumentException(
                        "Attachment index "
                                + index
                                + " is out of range; document has "
                                + files.size()
                                + " attachment(s)");
            }
            return save(files.get(index), outputDirectory, new HashSet<>());
        } catch (EngineException e) {
            throw new PdfOperationException("Failed to read " + custodian.inputPath(), e);
        }
    }

    /** Saves every attachment into {@code outputDirectory}, returning how many were written. */
    public int extractAll(PdfCustodian custodian, Path outputDirectory)
            throws PdfOperationException {
        try (EngineLock.Guard guard = EngineLock.acquire();
                PdfDocument document = custodian.openForReading()) {
            Set<String> used = new HashSet<>();
            int written = 0;
            for (Embedded embedded : embeddedFiles(document)) {
                save(embedded, outputDirectory, used);
                written++;
            }
            logger.info("Extracted {} attachment(s) to {}", written, outputDirectory);
            return written;
        } catch (EngineException e) {
            throw new PdfOperationException("Failed to read " + custodian.inputPath(), e);
        }
    }

    private static Path save(Embedded embedded, Path outputDirectory, Set<String> used)
            throws PdfOperationException {
        String fileName = uniqueName(fileNameFor(embedded.index, embedded.name), used);
        Path target = outputDirectory.resolve(fileName);
        try {
            byte[] content = embedded.content();
            Files.createDirectories(outputDirectory);
            Files.write(target, content);
        } catch (IOException | RuntimeException e) {
            throw new PdfOperationException(
                    "Failed to extract attachment " + embedded.index + " to " + target, e);
        }
        logger.debug("Attachment {} saved as {}", embedded.index, target);
        return target;
    }

    static String fileNameFor(int index, String name) {
        String sanitized = FilenameSanitizer.sanitize(name).strip();
        if (sanitized.isEmpty() || sanitized.chars().allMatch(c -> c == '.')) {
            return "attachment-" + index;
        }
        return sanitized;
    }

    private static String uniqueName(String fileName, Set<String> used) {
        String candidate = fileName;
        if (used.contains(candidate.toLowerCase(Locale.ROOT))) {
            int dot = fileName.lastIndexOf('.');
            String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
            String extension = dot > 0 ? fileName.substring(dot) : "";
            for (int k = 2; used.contains(candidate.toLowerCase(Locale.ROOT)); k++) {
                candidate = stem + "-" + k + extension;
            }
            logger.warn("Attachment name '{}' already used; saved as '{}'", fileName, candidate);
        }
        used.add(candidate.toLowerCase(Locale.ROOT));
        return candidate;
    }

    private static List<Embedded> embeddedFiles(PdfDocument document) {
        List<Embedded> files = new ArrayList<>();
        Map<String, PdfObject> entries =
                NameTrees.entries(NameTrees.root(document, PdfName.EmbeddedFiles));
        for (Map.Entry<String, PdfObject> entry : entries.entrySet()) {
            if (!(entry.getValue() instanceof PdfDictionary spec)) {
                logger.warn("Embedded file '{}' has no file specification", entry.getKey());
                continue;
            }
            files.add(new Embedded(files.size(), displayName(entry.getKey(), spec), spec));
        }
        return files;
    }

    private static String displayName(String key, PdfDictionary spec) {
        PdfString name = spec.getAsString(PdfName.UF);
        if (name == null) {
            name = spec.getAsString(PdfName.F);
        }
        return name != null ? name.toUnicodeString() : key;
    }

    private record Embedded(int index, String name, PdfDictionary spec) {
        PdfStream stream() {
            PdfDictionary ef = spec.getAsDictionary(PdfName.EF);
            if (ef == null) {
                return null;
            }
            PdfStream stream = ef.getAsStream(PdfName.UF);
            return stream != null ? stream : ef.getAsStream(PdfName.F);
        }

        byte[] content() {
            PdfStream stream = stream();
            if (stream == null) {
                throw new IllegalStateException("Attachment '" + name + "' has no content");
            }
            return stream.getBytes();
        }

        Attachment describe() {
            PdfStream stream = stream();
            String mimeType = null;
            String created = null;
            String modified = null;
            long size = 0;
            if (stream != null) {
                PdfName subtype = stream.getAsName(PdfName.Subtype);
                mimeType = subtype == null ? null : subtype.getValue();
                PdfDictionary params = stream.getAsDictionary(PARAMS);
                PdfNumber declared = params == null ? null : params.getAsNumber(SIZE);
                if (params != null) {
                    created = text(params.getAsString(PdfName.CreationDate));
                    modified = text(params.getAsString(PdfName.ModDate));
                }
                size = declared != null ? declared.longValue() : stream.getBytes().length;
            }
            return new Attachment(
                    index,
                    name,
                    mimeType,
                    size,
                    created,
                    modified,
                    text(spec.getAsString(PdfName.Desc)));
        }

        private static String text(PdfString value) {
            return value == null ? null : value.toUnicodeString();
        }
    }
}
