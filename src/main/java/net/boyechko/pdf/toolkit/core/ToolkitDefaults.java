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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Defaults for command options, read from YAML. Keys left out of the file keep the built-in
 * values; values that make no sense are reported and replaced by the built-in ones.
 */
public final class ToolkitDefaults {
    private static final String DEFAULT_RESOURCE = "/toolkit-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(ToolkitDefaults.class);

    private static final int BUILTIN_DPI = 200;
    private static final String BUILTIN_IMAGE_FORMAT = "png";
    private static final float BUILTIN_PAGE_WIDTH = 612f;
    private static final float BUILTIN_PAGE_HEIGHT = 792f;

    public Integer dpi = BUILTIN_DPI;
    public String image_format = BUILTIN_IMAGE_FORMAT;
    public String name_template;
    public Integer bookmark_title_max_length = NamingStrategy.DEFAULT_TITLE_MAX_LENGTH;
    public Float blank_page_width = BUILTIN_PAGE_WIDTH;
    public Float blank_page_height = BUILTIN_PAGE_HEIGHT;
    public Boolean strict_merge = false;
    public Watermark watermark = new Watermark();

    public static final class Watermark {
        public String font = "Helvetica";
        public Float font_size = 50f;
        /** {@code "R,G,B"}. */
        public String color = "255,0,0";

        public Integer opacity = 50;
        public Float rotation = 45f;
        public Float scale = 1.0f;
    }

    public static ToolkitDefaults builtIn() {
        return new ToolkitDefaults();
    }

    /**
     * Load defaults from a classpath resource.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static ToolkitDefaults fromResource(String resourcePath) {
        try (InputStream inputStream = ToolkitDefaults.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            return load(inputStream, resourcePath);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Failed to load defaults from resource " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    public static ToolkitDefaults fromFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Configuration file not found: " + file);
        }
        try (InputStream inputStream = Files.newInputStream(file)) {
            return load(inputStream, file.toString());
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Failed to load defaults from " + file + ": " + e.getMessage(), e);
        }
    }

    public static ToolkitDefaults loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }

    private static ToolkitDefaults load(InputStream inputStream, String origin) {
        ToolkitDefaults defaults;
        try {
            var yaml = new Yaml(new Constructor(ToolkitDefaults.class, new LoaderOptions()));
            defaults = yaml.load(inputStream);
        } catch (RuntimeException e) {
            logger.error("Failed to parse defaults from {}: {}", origin, e.getMessage());
            throw new IllegalStateException(
                    "Failed to parse defaults from " + origin + ": " + e.getMessage(), e);
        }
        if (defaults == null) {
            // Empty document
            defaults = new ToolkitDefaults();
        }
        var warnings = defaults.validateConsistency();
        if (!warnings.isEmpty()) {
            logger.warn(
                    "Defaults loaded from {} have {} problem(s):", origin, warnings.size());
            for (String warning : warnings) {
                logger.warn("  - {}", warning);
            }
        }
        logger.debug("Loaded defaults from {}", origin);
        return defaults;
    }

    /**
     * Replaces missing or out-of-range values with built-in ones.
     *
     * @return one message per replaced value (empty when everything was usable)
     */
    public List<String> validateConsistency() {
        List<String> warnings = new ArrayList<>();

        if (dpi == null || dpi < 1 || dpi > 2400) {
            warnings.add("dpi " + dpi + " is outside 1-2400; using " + BUILTIN_DPI);
            dpi = BUILTIN_DPI;
        }
        if (image_format == null || !isKnownImageFormat(image_format)) {
            warnings.add(
                    "image_format '" + image_format + "' is unknown; using " + BUILTIN_IMAGE_FORMAT);
            image_format = BUILTIN_IMAGE_FORMAT;
        }
        if (name_template != null && name_template.isBlank()) {
            name_template = null;
        }
        if (bookmark_title_max_length == null || bookmark_title_max_length < 1) {
            warnings.add(
                    "bookmark_title_max_length "
                            + bookmark_title_max_length
                            + " must be positive; using "
                            + NamingStrategy.DEFAULT_TITLE_MAX_LENGTH);
            bookmark_title_max_length = NamingStrategy.DEFAULT_TITLE_MAX_LENGTH;
        }
        if (blank_page_width == null || !(blank_page_width > 0)) {
            warnings.add(
                    "blank_page_width " + blank_page_width + " must be positive; using 612");
            blank_page_width = BUILTIN_PAGE_WIDTH;
        }
        if (blank_page_height == null || !(blank_page_height > 0)) {
            warnings.add(
                    "blank_page_height " + blank_page_height + " must be positive; using 792");
            blank_page_height = BUILTIN_PAGE_HEIGHT;
        }
        if (strict_merge == null) {
            strict_merge = false;
        }
        if (watermark == null) {
            watermark = new Watermark();
        }
        validateWatermark(warnings);
        return warnings;
    }

    private void validateWatermark(List<String> warnings) {
        Watermark builtIn = new Watermark();
        if (watermark.font == null || watermark.font.isBlank()) {
            watermark.font = builtIn.font;
        }
        if (watermark.font_size == null || !(watermark.font_size > 0)) {
            warnings.add(
                    "watermark.font_size " + watermark.font_size + " must be positive; using 50");
            watermark.font_size = builtIn.font_size;
        }
        if (watermark.color == null || !isColor(watermark.color)) {
            warnings.add(
                    "watermark.color '"
                            + watermark.color
                            + "' is not R,G,B in 0-255; using "
                            + builtIn.color);
            watermark.color = builtIn.color;
        }
        if (watermark.opacity == null || watermark.opacity < 0 || watermark.opacity > 255) {
            warnings.add(
                    "watermark.opacity " + watermark.opacity + " is outside 0-255; using 50");
            watermark.opacity = builtIn.opacity;
        }
        if (watermark.rotation == null) {
            watermark.rotation = builtIn.rotation;
        }
        if (watermark.scale == null || !(watermark.scale > 0)) {
            warnings.add("watermark.scale " + watermark.scale + " must be positive; using 1.0");
            watermark.scale = builtIn.scale;
        }
    }

    private static boolean isKnownImageFormat(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "png", "jpg", "jpeg", "gif", "bmp", "tif", "tiff", "webp":
                return true;
            default:
                return false;
        }
    }

    private static boolean isColor(String spec) {
        String[] parts = spec.split(",");
        if (parts.length != 3) {
            return false;
        }
        for (String part : parts) {
            try {
                int value = Integer.parseInt(part.trim());
                if (value < 0 || value > 255) {
                    return false;
                }
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return true;
    }
}
