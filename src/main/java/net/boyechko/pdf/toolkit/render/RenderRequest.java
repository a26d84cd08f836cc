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

import java.nio.file.Path;
import net.boyechko.pdf.toolkit.core.PageSelection;

/**
 * Parameters for rendering pages to image files.
 *
 * @param template name template with {@code {original}} and {@code {page}}; when it carries an
 *     extension, that extension picks the format
 */
public record RenderRequest(
        Path input,
        String password,
        Path outputDirectory,
        PageSelection range,
        int dpi,
        ImageFormat format,
        String template) {
    public RenderRequest {
        if (input == null) {
            throw new IllegalArgumentException("Input path is required");
        }
        if (dpi < RenderService.MIN_DPI || dpi > RenderService.MAX_DPI) {
            throw new IllegalArgumentException(
                    "DPI must be between "
                            + RenderService.MIN_DPI
                            + " and "
                            + RenderService.MAX_DPI
                            + ", got "
                            + dpi);
        }
        range = range == null ? PageSelection.all() : range;
        format = format == null ? ImageFormat.PNG : format;
        if (outputDirectory == null) {
            Path parent = input.toAbsolutePath().getParent();
            outputDirectory = parent != null ? parent : Path.of(".");
        }
    }

    public static RenderRequest of(Path input, Path outputDirectory) {
        return new RenderRequest(
                input,
                null,
                outputDirectory,
                PageSelection.all(),
                RenderService.DEFAULT_DPI,
                ImageFormat.PNG,
                null);
    }
}
