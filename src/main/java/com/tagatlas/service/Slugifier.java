package com.tagatlas.service;

import java.util.Locale;

/**
 * Turns human text into the canonical slug token used as node key:
 * lowercase, every run of non letter/digit characters collapsed to one underscore,
 * no leading or trailing underscore.
 */
public final class Slugifier {

    private Slugifier() {
    }

    public static String slugify(String text) {
        if (text == null) {
            return "";
        }

        String lower = text.toLowerCase(Locale.ROOT).trim();
        StringBuilder sb = new StringBuilder(lower.length());
        boolean pendingSeparator = false;

        for (int i = 0; i < lower.length(); ) {
            int cp = lower.codePointAt(i);
            i += Character.charCount(cp);

            if (Character.isLetterOrDigit(cp)) {
                if (pendingSeparator && sb.length() > 0) {
                    sb.append('_');
                }
                pendingSeparator = false;
                sb.appendCodePoint(cp);
            } else {
                pendingSeparator = true;
            }
        }
        return sb.toString();
    }
}
