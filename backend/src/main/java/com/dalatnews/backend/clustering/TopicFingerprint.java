package com.dalatnews.backend.clustering;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Canonical keyword-set string used to compare and deduplicate stories.
 */
public final class TopicFingerprint {

    public static final String SEPARATOR = "|";

    private TopicFingerprint() {
    }

    /**
     * Lowercase, trim, drop blanks, dedupe, sort and join with {@value #SEPARATOR}.
     */
    public static String of(Collection<String> keywords) {
        Set<String> normalized = new TreeSet<>();
        for (String keyword : keywords) {
            if (keyword == null) continue;
            String k = keyword.toLowerCase(Locale.ROOT).trim();
            if (!k.isEmpty()) {
                normalized.add(k);
            }
        }
        return String.join(SEPARATOR, normalized);
    }

    /**
     * Jaccard similarity of the keyword sets behind two fingerprints; 0 when both are empty.
     */
    public static double similarity(String a, String b) {
        Set<String> setA = toSet(a);
        Set<String> setB = toSet(b);
        Set<String> union = new HashSet<>(setA);
        union.addAll(setB);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(setA);
        intersection.retainAll(setB);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> toSet(String fingerprint) {
        Set<String> set = new HashSet<>();
        if (fingerprint == null || fingerprint.isEmpty()) {
            return set;
        }
        Arrays.stream(fingerprint.split("\\|"))
                .filter(Objects::nonNull)
                .filter(s -> !s.isEmpty())
                .forEach(set::add);
        return set;
    }
}
