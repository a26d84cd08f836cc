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

import com.itextpdf.io.font.constants.StandardFonts;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/** What to stamp on each page and how. Exactly one of {@code text} and {@code image} is set. */
public record WatermarkOptions(
        String text,
        Path image,
        String font,
        float fontSize,
        int red,
        int green,
        int blue,
        int opacity,
        float rotation,
        float scale) {

    public static final String DEFAULT_FONT = StandardFonts.HELVETICA;
    public static final float DEFAULT_FONT_SIZE = 50f;
    public static final int DEFAULT_OPACITY = 50;
    public static final float DEFAULT_ROTATION = 45f;
    public static final float DEFAULT_SCALE = 1.0f;
    public static final int[] DEFAULT_COLOR = {255, 0, 0};

    private static final Map<String, String> STANDARD_FONTS = new TreeMap<>();

    static {
        for (String name :
                new String[] {
                    StandardFonts.COURIER,
                    StandardFonts.COURIER_BOLD,
                    StandardFonts.COURIER_OBLIQUE,
                    StandardFonts.COURIER_BOLDOBLIQUE,
                    StandardFonts.HELVETICA,
                    StandardFonts.HELVETICA_BOLD,
                    StandardFonts.HELVETICA_OBLIQUE,
                    StandardFonts.HELVETICA_BOLDOBLIQUE,
                    StandardFonts.TIMES_ROMAN,
                    StandardFonts.TIMES_BOLD,
                    StandardFonts.TIMES_ITALIC,
                    StandardFonts.TIMES_BOLDITALIC,
                    StandardFonts.SYMBOL,
                    StandardFonts.ZAPFDINGBATS
                }) {
            STANDARD_FONTS.put(name.toLowerCase(Locale.ROOT), name);
        }
    }

    public boolean isText() {
        return text != null;
    }

    /** Canonical standard-14 name for {@code name}, matched case-insensitively. */
    public static String standardFont(String name) {
        String canonical = name == null ? null : STANDARD_FONTS.get(name.toLowerCase(Locale.ROOT));
        if (canonical == null) {
            throw new IllegalArgumentException(
                    "Unknown font '" + name + "'; use one of " + STANDARD_FONTS.values());
        }
        return canonical;
    }

    /** Parses {@code "R,G,B"} with each component in 0..255. */
    public static int[] parseColor(String spec) {
        String[] parts = spec == null ? new String[0] : spec.split(",");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Color must be R,G,B, got '" + spec + "'");
        }
        int[] rgb = new int[3];
        for (int i = 0; i < 3; i++) {
            try {
                rgb[i] = Integer.parseInt(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Color must be R,G,B, got '" + spec + "'", e);
            }
            checkRange("Color component", rgb[i], 0, 255);
        }
        return rgb;
    }

    private static void checkRange(String what, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                    what + " must be between " + min + " and " + max + ", got " + value);
        }
    }

    public static class WatermarkOptionsBuilder {
        private String text;
        private Path image;
        private String font = DEFAULT_FONT;
        private float fontSize = DEFAULT_FONT_SIZE;
        private int[] color = DEFAULT_COLOR.clone();
        private int opacity = DEFAULT_OPACITY;
        private float rotation = DEFAULT_ROTATION;
        private float scale = DEFAULT_SCALE;

        public WatermarkOptionsBuilder withText(String text) {
            this.text = text;
            return this;
        }

        public WatermarkOptionsBuilder withImage(Path image) {
            this.image = image;
            return this;
        }

        public WatermarkOptionsBuilder withFont(String font) {
            this.font = font;
            return this;
        }

        public WatermarkOptionsBuilder withFontSize(float fontSize) {
            this.fontSize = fontSize;
            return this;
        }

        public WatermarkOptionsBuilder withColor(int red, int green, int blue) {
            this.color = new int[] {red, green, blue};
            return this;
        }

        public WatermarkOptionsBuilder withOpacity(int opacity) {
            this.opacity = opacity;
            return this;
        }

        public WatermarkOptionsBuilder withRotation(float rotation) {
            this.rotation = rotation;
            return this;
        }

        public WatermarkOptionsBuilder withScale(float scale) {
            this.scale = scale;
            return this;
        }

        public WatermarkOptions build() {
            boolean hasText = text != null && !text.isEmpty();
            if (!hasText && image == null) {
                throw new IllegalArgumentException(
                        "Either --text or --image must be specified for watermarking.");
            }
            if (hasText && image != null) {
                throw new IllegalArgumentException(
                        "Both --text and --image cannot be specified simultaneously.");
            }
            for (int component : color) {
                checkRange("Color component", component, 0, 255);
            }
            checkRange("Opacity", opacity, 0, 255);
            if (!(fontSize > 0)) {
                throw new IllegalArgumentException("Font size must be positive, got " + fontSize);
            }
            if (!(scale > 0)) {
                throw new IllegalArgumentException("Scale must be positive, got " + scale);
            }
            return new WatermarkOptions(
                    hasText ? text : null,
                    image,
                    standardFont(font),
                    fontSize,
                    color[0],
                    color[1],
                    color[2],
                    opacity,
                    rotation,
                    scale);
        }
    }
}
