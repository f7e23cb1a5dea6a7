package com.timesync.reconciliation.normalizer;

/**
 * Whitespace and line-ending normalization for text fields, so that encoding
 * differences between the two stores never show up as content differences.
 */
public final class TextNormalizer {

    private TextNormalizer() {
    }

    /**
     * Multi-line text: LF line endings, no trailing blanks per line, no leading or trailing blank lines.
     */
    public static String normalizeText(String value) {
        if (value == null) {
            return "";
        }
        String unified = value
            .replace("\r\n", "\n")
            .replace('\r', '\n')
            .replace('\u00A0', ' ')
            .replace("\t", "    ");
        StringBuilder out = new StringBuilder(unified.length());
        for (String line : unified.split("\n", -1)) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(line.stripTrailing());
        }
        return out.toString().strip();
    }

    /**
     * Single-line text: every whitespace run collapsed to one space.
     */
    public static String normalizeLine(String value) {
        if (value == null) {
            return "";
        }
        return value.replace('\u00A0', ' ').strip().replaceAll("\\s+", " ");
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
