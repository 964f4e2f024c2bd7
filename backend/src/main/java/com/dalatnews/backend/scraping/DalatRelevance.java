package com.dalatnews.backend.scraping;

import java.util.List;
import java.util.Locale;

/**
 * Keyword check deciding whether an article is about Da Lat or Lam Dong province.
 */
public final class DalatRelevance {

    public static final List<String> KEYWORDS = List.of(
            "đà lạt", "da lat", "dalat", "lâm đồng", "lam dong", "đà-lạt",
            "tp đà lạt", "tp. đà lạt", "thành phố đà lạt", "hồ xuân hương",
            "langbiang", "lang biang", "bảo lộc", "đức trọng", "lạc dương", "đơn dương"
    );

    private DalatRelevance() {
    }

    public static boolean isDalatRelated(String title, String content) {
        String text = ((title == null ? "" : title) + " " + (content == null ? "" : content))
                .toLowerCase(Locale.ROOT);
        for (String keyword : KEYWORDS) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
