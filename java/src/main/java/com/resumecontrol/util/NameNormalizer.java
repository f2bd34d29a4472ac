package com.resumecontrol.util;

import java.util.Locale;

/**
 * Turns free-text names into a display form and a comparison key.
 *
 * Display form: surrounding whitespace removed, internal whitespace runs
 * collapsed to one space, every word lowercased and then its first character
 * upper-cased. Comparison key: the display form lowercased.
 *
 * Pure and total; {@code null} and blank input both give the empty name.
 */
public final class NameNormalizer {

    private NameNormalizer() {
    }

    public static NormalizedName normalize(String raw) {
        String display = displayForm(raw);
        return new NormalizedName(display, display.toLowerCase(Locale.ROOT));
    }

    /**
     * Comparison key of {@code raw}. Equal keys mean the names collide.
     */
    public static String key(String raw) {
        return normalize(raw).getKey();
    }

    private static String displayForm(String raw) {
        if (raw == null) {
            return "";
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        StringBuilder out = new StringBuilder(lower.length());
        boolean atWordStart = true;
        int i = 0;
        while (i < lower.length()) {
            int cp = lower.codePointAt(i);
            i += Character.charCount(cp);
            if (isSpace(cp)) {
                atWordStart = true;
                continue;
            }
            if (atWordStart) {
                if (out.length() > 0) {
                    out.append(' ');
                }
                out.appendCodePoint(Character.toUpperCase(cp));
                atWordStart = false;
            } else {
                out.appendCodePoint(cp);
            }
        }
        return out.toString();
    }

    /**
     * Unicode white space, including NEL (U+0085) and no-break spaces.
     */
    static boolean isSpace(int cp) {
        return Character.isWhitespace(cp) || Character.isSpaceChar(cp) || cp == 0x85;
    }
}
