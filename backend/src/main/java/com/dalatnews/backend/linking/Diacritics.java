package com.dalatnews.backend.linking;

import java.text.Normalizer;
import java.util.regex.Pattern;

public final class Diacritics {

    private static final Pattern COMBINING_MARKS = Pattern.compile("[\\u0300-\\u036f]");

    private Diacritics() {
    }

    /**
     * Vietnamese text without tone and vowel marks: "Hồ Xuân Hương" becomes "Ho Xuan Huong".
     */
    public static String strip(String text) {
        if (text == null) return null;
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("")
                .replace('đ', 'd')
                .replace('Đ', 'D');
    }
}
