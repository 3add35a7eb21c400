package com.example.shortvideo_backend.ffmpeg;

import com.example.shortvideo_backend.dto.CaptionToken;
import com.example.shortvideo_backend.util.CaptionPosition;
import com.example.shortvideo_backend.util.Orientation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes timed caption words as an ASS subtitle track. Words are grouped into short lines; while a
 * line is on screen the word being spoken is highlighted.
 */
public class AssCaptionWriter {
    static final int MAX_WORDS_PER_LINE = 5;
    static final int MAX_CHARS_PER_LINE = 28;
    private static final String HIGHLIGHT = "&H0000FFFF&";

    private final String fontName;

    public AssCaptionWriter(String fontName) {
        this.fontName = fontName == null || fontName.isBlank() ? "Arial" : fontName;
    }

    public Path write(Path target, List<CaptionToken> tokens, Orientation orientation,
                      CaptionPosition position, String backgroundColor) throws IOException {
        Files.writeString(target, render(tokens, orientation, position, backgroundColor), StandardCharsets.UTF_8);
        return target;
    }

    public String render(List<CaptionToken> tokens, Orientation orientation, CaptionPosition position, String backgroundColor) {
        int w = orientation.width();
        int h = orientation.height();
        int fontSize = Math.round(Math.min(w, h) * 0.065f);
        int marginV = Math.round(h * 0.12f);
        int marginH = Math.round(w * 0.08f);

        StringBuilder sb = new StringBuilder();
        sb.append("[Script Info]\n")
                .append("ScriptType: v4.00+\n")
                .append("PlayResX: ").append(w).append('\n')
                .append("PlayResY: ").append(h).append('\n')
                .append("WrapStyle: 0\n")
                .append("ScaledBorderAndShadow: yes\n\n");
        sb.append("[V4+ Styles]\n")
                .append("Format: Name, Fontname, Fontsize, PrimaryColour, SecondaryColour, OutlineColour, BackColour, ")
                .append("Bold, Italic, Underline, StrikeOut, ScaleX, ScaleY, Spacing, Angle, BorderStyle, Outline, ")
                .append("Shadow, Alignment, MarginL, MarginR, MarginV, Encoding\n")
                .append(AssStyleUtil.buildStyleLine(fontName, fontSize, backgroundColor, position, marginH, marginV))
                .append("\n\n");
        sb.append("[Events]\n")
                .append("Format: Layer, Start, End, Style, Name, MarginL, MarginR, MarginV, Effect, Text\n");

        for (List<CaptionToken> line : groupLines(tokens)) {
            for (int i = 0; i < line.size(); i++) {
                long start = line.get(i).startMs();
                long end = i + 1 < line.size() ? line.get(i + 1).startMs() : line.get(i).endMs();
                if (end <= start) {
                    continue;
                }
                sb.append("Dialogue: 0,")
                        .append(formatTime(start)).append(',')
                        .append(formatTime(end))
                        .append(",Default,,0,0,0,,")
                        .append(lineText(line, i))
                        .append('\n');
            }
        }
        return sb.toString();
    }

    static List<List<CaptionToken>> groupLines(List<CaptionToken> tokens) {
        List<List<CaptionToken>> lines = new ArrayList<>();
        List<CaptionToken> current = new ArrayList<>();
        int chars = 0;
        for (CaptionToken token : tokens) {
            String word = token.text().strip();
            if (word.isEmpty()) {
                continue;
            }
            boolean full = current.size() >= MAX_WORDS_PER_LINE
                    || (!current.isEmpty() && chars + 1 + word.length() > MAX_CHARS_PER_LINE);
            if (full) {
                lines.add(current);
                current = new ArrayList<>();
                chars = 0;
            }
            chars += (current.isEmpty() ? 0 : 1) + word.length();
            current.add(token);
        }
        if (!current.isEmpty()) {
            lines.add(current);
        }
        return lines;
    }

    private static String lineText(List<CaptionToken> line, int active) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < line.size(); i++) {
            if (i > 0) sb.append(' ');
            String word = escape(line.get(i).text().strip());
            if (i == active) {
                sb.append("{\\c").append(HIGHLIGHT).append('}').append(word).append("{\\r}");
            } else {
                sb.append(word);
            }
        }
        return sb.toString();
    }

    static String formatTime(long ms) {
        long cs = Math.max(0L, ms) / 10;
        long hours = cs / 360_000;
        long minutes = (cs / 6_000) % 60;
        long seconds = (cs / 100) % 60;
        long centis = cs % 100;
        return String.format(Locale.ROOT, "%d:%02d:%02d.%02d", hours, minutes, seconds, centis);
    }

    private static String escape(String text) {
        return text.replace("\\", "")
                .replace('{', '(')
                .replace('}', ')')
                .replace('\n', ' ');
    }
}
