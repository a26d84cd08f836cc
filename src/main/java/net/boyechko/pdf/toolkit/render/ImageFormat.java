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

import java.util.Locale;

/** Raster formats recognized for page images. */
public enum ImageFormat {
    PNG("png", "png"),
    JPEG("jpg", "jpeg"),
    GIF("gif", "gif"),
    BMP("bmp", "bmp"),
    TIFF("tiff", "tiff"),
    WEBP("webp", "webp");

    private final String extension;
    private final String imageIoName;

    ImageFormat(String extension, String imageIoName) {
        this.extension = extension;
        this.imageIoName = imageIoName;
    }

    /** File extension without the dot. */
    public String extension() {
        return extension;
    }

    /** Format name understood by {@link javax.imageio.ImageIO}. */
    public String imageIoName() {
        return imageIoName;
    }

    /**
     * Looks up a format by name or extension, case-insensitively, with or without a leading dot.
     *
     * @throws IllegalArgumentException for unrecognized names
     */
    public static ImageFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Image format is required");
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        if (key.startsWith(".")) {
            key = key.substring(1);
        }
        return switch (key) {
            case "png" -> PNG;
            case "jpg", "jpeg" -> JPEG;
            case "gif" -> GIF;
            case "bmp" -> BMP;
            case "tiff", "tif" -> TIFF;
            case "webp" -> WEBP;
            default -> throw new IllegalArgumentException("Unsupported image format: " + name);
        };
    }

    /** Format implied by a file name's extension. */
    public static ImageFormat fromFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            throw new IllegalArgumentException("No image extension in " + fileName);
        }
        return fromName(fileName.substring(dot + 1));
    }
}
