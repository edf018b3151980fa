package com.compcollector.comps.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Loosens a marketplace search query by dropping grading-company tokens (with the grade that
 * follows them) and print-run fractions such as {@code 12/99} or {@code /99}.
 */
public final class QueryNormalizer {
    private static final Set<String> GRADING_COMPANIES = Set.of("psa", "bgs", "sgc", "cgc", "csg", "bvg", "hga");
    private static final Pattern FRACTION = Pattern.compile("^\\d*/\\d+$");
    private static final Pattern GRADE = Pattern.compile("^(?:\\d{1,2}(?:\\.5)?|gem|mint|gem-mint|gm)$");

    private QueryNormalizer() {
    }

    public static String loosen(String query) {
        if (query == null || query.isBlank()) {
            return "";
        }
        String[] tokens = query.trim().split("\\s+");
        List<String> kept = new ArrayList<>();
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            String lower = token.toLowerCase(Locale.ROOT);
            if (GRADING_COMPANIES.contains(lower)) {
                while (i + 1 < tokens.length && GRADE.matcher(tokens[i + 1].toLowerCase(Locale.ROOT)).matches()) {
                    i++;
                }
                continue;
            }
            if (FRACTION.matcher(lower).matches()) {
                continue;
            }
            kept.add(token);
        }
        return String.join(" ", kept);
    }

    public static boolean differs(String original, String loosened) {
        if (loosened == null || loosened.isBlank()) {
            return false;
        }
        return !loosened.equalsIgnoreCase(original == null ? "" : original.trim());
    }
}
