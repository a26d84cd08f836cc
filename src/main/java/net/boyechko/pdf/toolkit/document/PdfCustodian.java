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

import com.itextpdf.kernel.exceptions.BadPasswordException;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.ReaderProperties;
import com.itextpdf.kernel.pdf.WriterProperties;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import net.boyechko.pdf.toolkit.engine.EngineErrors;
import net.boyechko.pdf.toolkit.engine.EngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Factory for opening PDF documents with appropriate password and encryption settings. */
public final class PdfCustodian {
    private static final Logger logger = LoggerFactory.getLogger(PdfCustodian.class);

    private final Path inputPath;
    private final String password;
    private final ReaderProperties readerProps;
    private EncryptionInfo encryptionInfo;

    private record EncryptionInfo(
            int permissions, int cryptoMode, boolean isEncrypted, boolean needsPassword) {}

    @FunctionalInterface
    private interface WriterFactory {
        PdfWriter open(WriterProperties props) throws IOException;
    }

    public PdfCustodian(Path inputPath, String password) {
        this.inputPath = inputPath;
        this.password = password == null || password.isEmpty() ? null : password;
        this.readerProps = new ReaderProperties();
        if (this.password != null) {
            this.readerProps.setPassword(this.password.getBytes(StandardCharsets.UTF_8));
        }
    }

    public PdfCustodian(Path inputPath) {
        this(inputPath, null);
    }

    public Path inputPath() {
        return inputPath;
    }

    public PdfDocument openForReading() throws EngineException {
        PdfReader pdfReader = openReader();
        try {
            return new PdfDocument(pdfReader);
        } catch (RuntimeException e) {
            closeQuietly(pdfReader, e);
            throw EngineErrors.translateRead("Failed to open " + inputPath, e);
        }
    }

    /** Opens the input for modification; the output keeps the input's encryption settings. */
    public PdfDocument openForModification(Path outputPath) throws EngineException {
        return openStamped(
                props -> new PdfWriter(outputPath.toString(), props),
                writerPropertiesPreservingEncryption(),
                " for modification");
    }

    /** Like {@link #openForModification(Path)}, writing the result to {@code out}. */
    public PdfDocument openForModification(OutputStream out) throws EngineException {
        return openStamped(
                props -> new PdfWriter(out, props),
                writerPropertiesPreservingEncryption(),
                " for modification");
    }

    /**
     * Opens the original (possibly encrypted) input and writes to {@code out} WITHOUT encryption.
     * Owner restrictions are not enforced; a user password is still required to open the file.
     */
    public PdfDocument decryptTo(OutputStream out) throws EngineException {
        return openStamped(props -> new PdfWriter(out, props), new WriterProperties(), "");
    }

    /** Returns whether the original PDF is encrypted and will be re-encrypted on modification. */
    public boolean isEncrypted() throws EngineException {
        analyzeEncryptionIfNeeded();
        return encryptionInfo.isEncrypted();
    }

    /**
     * Writer settings that reproduce the input's encryption: same permissions and crypto mode,
     * and the supplied password as user password when the input needs one to open. iText
     * generates a fresh owner password.
     */
    public WriterProperties writerPropertiesPreservingEncryption() throws EngineException {
        analyzeEncryptionIfNeeded();
        WriterProperties writerProps = new WriterProperties();
        if (encryptionInfo.isEncrypted()) {
            byte[] userPassword =
                    encryptionInfo.needsPassword() && password != null
                            ? password.getBytes(StandardCharsets.UTF_8)
                            : null;
            writerProps.setStandardEncryption(
                    userPassword, null, encryptionInfo.permissions(), encryptionInfo.cryptoMode());
        }
        return writerProps;
    }

    private PdfDocument openStamped(WriterFactory writers, WriterProperties props, String purpose)
            throws EngineException {
        PdfReader pdfReader = openReader();
        // Owner restrictions travel with the output's encryption rather than blocking the edit
        pdfReader.setUnethicalReading(true);
        try {
            return new PdfDocument(pdfReader, writers.open(props));
        } catch (IOException | RuntimeException e) {
            closeQuietly(pdfReader, e);
            throw EngineErrors.translateRead("Failed to open " + inputPath + purpose, e);
        }
    }

    private PdfReader openReader() throws EngineException {
        if (!Files.isRegularFile(inputPath)) {
            throw EngineErrors.translateRead(
                    "Cannot open " + inputPath, new NoSuchFileException(inputPath.toString()));
        }
        try {
            return new PdfReader(inputPath.toString(), readerProps);
        } catch (IOException | RuntimeException e) {
            throw EngineErrors.translateRead("Cannot open " + inputPath, e);
        }
    }

    private void analyzeEncryptionIfNeeded() throws EngineException {
        if (encryptionInfo != null) {
            return;
        }

        try (PdfReader testReader = openReader();
                PdfDocument testDoc = new PdfDocument(testReader)) {
            logger.debug("PDF Encryption Analysis:");
            logger.debug("  Encrypted: {}", testReader.isEncrypted());
            logger.debug("  Permissions: {}", testReader.getPermissions());
            logger.debug("  Crypto Mode: {}", testReader.getCryptoMode());

            boolean encrypted = testReader.isEncrypted();
            encryptionInfo =
                    new EncryptionInfo(
                            testReader.getPermissions(),
                            testReader.getCryptoMode(),
                            encrypted,
                            encrypted && password != null && !opensWithoutPassword());
        } catch (IOException | RuntimeException e) {
            throw EngineErrors.translateRead(
                    "Failed to analyze encryption of " + inputPath, e);
        }
    }

    /** Whether the input opens with an empty user password, i.e. it is only owner-locked. */
    private boolean opensWithoutPassword() throws IOException {
        try (PdfReader bareReader = new PdfReader(inputPath.toString());
                PdfDocument bareDoc = new PdfDocument(bareReader)) {
            return true;
        } catch (BadPasswordException e) {
            logger.debug("{} needs a user password", inputPath.getFileName());
            return false;
        }
    }

    private static void closeQuietly(PdfReader reader, Exception primary) {
        try {
            reader.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
