package com.seorag.routing;

import java.util.List;

/**
 * Keyword lookups over lower-cased text. Latin terms must match on word boundaries so "new" does
 * not fire on "news" or "renewal"; Japanese terms are matched as substrings since the text is not
 * space-delimited.
 */
public final class KeywordMatcher {
    private KeywordMatcher() {
    }

    public static String firstMatch(String text, List<String> terms) {
        for (String term : terms) {
            if (containsTerm(text, term)) {
                return term;
            }
        }
        return null;
    }

    public static boolean containsAny(String text, List<String> terms) {
        return firstMatch(text, terms) != null;
    }

    /** Counts distinct terms present, accepting a plural "s" after Latin terms. */
    public static int countMatches(String text, List<String> terms) {
        int count = 0;
        for (String term : terms) {
            if (containsTerm(text, term, true)) {
                count++;
            }
        }
        return count;
    }

    public static boolean containsTerm(String text, String term) {
        return containsTerm(text, term, false);
    }

    public static boolean containsTerm(String text, String term, boolean allowPlural) {
        if (term.isEmpty()) {
            return false;
        }
        if (!isLatin(term)) {
            return text.contains(term);
        }
        int from = 0;
        while (true) {
            int index = text.indexOf(term, from);
            if (index < 0) {
                return false;
            }
            int end = index + term.length();
            if (allowPlural && end < text.length() && text.charAt(end) == 's') {
                if (isBoundary(text, end + 1) && isBoundary(text, index - 1)) {
                    return true;
                }
            }
            if (isBoundary(text, index - 1) && isBoundary(text, end)) {
                return true;
            }
            from = index + 1;
        }
    }

    private static boolean isBoundary(String text, int position) {
        return position < 0 || position >= text.length() || !Character.isLetterOrDigit(text.charAt(position));
    }

    private static boolean isLatin(String term) {
        return term.chars().allMatch(c -> c < 0x250);
    }
}
