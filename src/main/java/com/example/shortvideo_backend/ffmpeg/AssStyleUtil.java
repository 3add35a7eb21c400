package com.example.shortvideo_backend.ffmpeg;

import com.example.shortvideo_backend.util.CaptionPosition;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class AssStyleUtil {
    private static final Pattern RGBA = Pattern.compile("rgba?\\((\\d+),(\\d+),(\\d+)(?:,(\\d+(?:\\.\\d+)?))?\\)");

    /** CSS colour keywords accepted as caption background. */
    private static final Map<String, String> NAMED = Map.ofEntries(
            Map.entry("black", "#000000"),
            Map.entry("white", "#ffffff"),
            Map.entry("red", "#ff0000"),
            Map.entry("green", "#008000"),
            Map.entry("lime", "#00ff00"),
            Map.entry("blue", "#0000ff"),
            Map.entry("navy", "#000080"),
            Map.entry("yellow", "#ffff00"),
            Map.entry("orange", "#ffa500"),
            Map.entry("purple", "#800080"),
            Map.entry("pink", "#ffc0cb"),
            Map.entry("gray", "#808080"),
            Map.entry("grey", "#808080"),
            Map.entry("cyan", "#00ffff"),
            Map.entry("magenta", "#ff00ff"),
            Map.entry("transparent", "rgba(0,0,0,0)")
    );

    private AssStyleUtil() {
    }

    /**
     * Converts a CSS colour ({@code #rgb}, {@code #rrggbb}, {@code rgb()}, {@code rgba()} or a keyword)
     * to ASS {@code &HAABBGGRR}, where alpha 00 is opaque. Unknown input becomes opaque white.
     */
    public static String toAssColor(String color) {
        String c = color == null ? "" : color.trim().toLowerCase(Locale.ROOT);
        c = NAMED.getOrDefault(c, c);
        int r = 255;
        int g = 255;
        int b = 255;
        int transparency = 0;

        if (c.startsWith("#") && (c.length() == 7 || c.length() == 4)) {
            if (c.length() == 7) {
                r = Integer.parseInt(c.substring(1, 3), 16);
                g = Integer.parseInt(c.substring(3, 5), 16);
                b = Integer.parseInt(c.substring(5, 7), 16);
            } else {
                r = Integer.parseInt(c.substring(1, 2) + c.substring(1, 2), 16);
                g = Integer.parseInt(c.substring(2, 3) + c.substring(2, 3), 16);
                b = Integer.parseInt(c.substring(3, 4) + c.substring(3, 4), 16);
            }
        } else {
            Matcher m = RGBA.matcher(c.replace(" ", ""));
            if (m.matches()) {
                r = clamp(Integer.parseInt(m.group(1)));
                g = clamp(Integer.parseInt(m.group(2)));
                b = clamp(Integer.parseInt(m.group(3)));
                if (m.group(4) != null) {
                    double alpha = Math.max(0d, Math.min(1d, Double.parseDouble(m.group(4))));
                    transparency = 255 - (int) Math.round(alpha * 255.0);
                }
            }
        }
        return String.format("&H%02X%02X%02X%02X", transparency, b, g, r);
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(255, v));
    }

    /**
     * Builds the {@code Style:} line of the caption track. Captions sit in an opaque box of
     * {@code backgroundColor} (BorderStyle=3 paints the box with the outline colour).
     */
    public static String buildStyleLine(String fontName, int fontSize, String backgroundColor,
                                        CaptionPosition position, int marginH, int marginV) {
        String box = toAssColor(backgroundColor);
        return "Style: " + String.join(",",
                "Default",
                fontName,
                String.valueOf(fontSize),
                toAssColor("#ffffff"),
                toAssColor("#ffffff"),
                box,
                box,
                "-1", "0", "0", "0",
                "100", "100", "0", "0",
                "3", "2", "0",
                String.valueOf(position.assAlignment()),
                String.valueOf(marginH), String.valueOf(marginH), String.valueOf(marginV),
                "1"
        );
    }
}
