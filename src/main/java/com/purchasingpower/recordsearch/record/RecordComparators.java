package com.purchasingpower.recordsearch.record;

import com.google.common.base.Splitter;
import com.google.common.primitives.Ints;

import java.util.Comparator;
import java.util.List;

/**
 * Orderings applied to records with equal search score.
 *
 * <p>Colors are {@code "r, g, b"} strings with components in 0-255. They order by hue so
 * similar colors end up next to each other:
 * <ol>
 *   <li>records with a parseable color before records without one</li>
 *   <li>colors before shades of gray</li>
 *   <li>higher hue first</li>
 *   <li>higher saturation plus value first</li>
 * </ol>
 */
public final class RecordComparators {

    private static final Splitter COMPONENTS = Splitter.on(',').trimResults();

    public static final Comparator<SearchableRecord> BY_COLOR = Comparator.comparing(
            (SearchableRecord record) -> Hsv.parse(record.getColor()),
            Comparator.nullsLast(Hsv.ORDER));

    public static final Comparator<SearchableRecord> BY_ID = Comparator.comparing(
            SearchableRecord::getId,
            Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private RecordComparators() {
    }

    /**
     * Color, then id.
     */
    public static Comparator<SearchableRecord> standard() {
        return BY_COLOR.thenComparing(BY_ID);
    }

    /**
     * A color in HSV space: hue in [0, 360), saturation and value in [0, 100].
     */
    record Hsv(double hue, double saturation, double value) {

        static final Comparator<Hsv> ORDER = Comparator
                .comparing(Hsv::isShade)
                .thenComparing(Comparator.comparingDouble(Hsv::hue).reversed())
                .thenComparing(Comparator.comparingDouble(Hsv::intensity).reversed());

        /**
         * Whether this is white, black or a gray.
         */
        boolean isShade() {
            return saturation == 0;
        }

        double intensity() {
            return saturation + value;
        }

        /**
         * Parses an {@code "r, g, b"} string.
         *
         * @return The color, or {@code null} if {@code rgb} is missing or malformed
         */
        static Hsv parse(String rgb) {
            if (rgb == null) {
                return null;
            }

            List<String> parts = COMPONENTS.splitToList(rgb);
            if (parts.size() != 3) {
                return null;
            }

            int[] channels = new int[3];
            for (int i = 0; i < 3; i++) {
                Integer channel = Ints.tryParse(parts.get(i));
                if (channel == null || channel < 0 || channel > 255) {
                    return null;
                }
                channels[i] = channel;
            }

            return fromRgb(channels[0], channels[1], channels[2]);
        }

        static Hsv fromRgb(int r, int g, int b) {
            double red = r / 255.0;
            double green = g / 255.0;
            double blue = b / 255.0;

            double max = Math.max(red, Math.max(green, blue));
            double min = Math.min(red, Math.min(green, blue));
            double delta = max - min;

            double hue = 0;
            if (delta > 0) {
                if (max == red) {
                    hue = (60 * ((green - blue) / delta) + 360) % 360;
                } else if (max == green) {
                    hue = (60 * ((blue - red) / delta) + 120) % 360;
                } else {
                    hue = (60 * ((red - green) / delta) + 240) % 360;
                }
            }

            double saturation = max == 0 ? 0 : (delta / max) * 100;
            return new Hsv(hue, saturation, max * 100);
        }
    }
}
