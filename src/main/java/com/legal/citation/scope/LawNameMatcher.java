package com.legal.citation.scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds law names in a window of text.
 *
 * <p>A name counts only when the character before it is a boundary: window start, whitespace,
 * punctuation, hiragana (particles such as {@code の}, {@code 及び}, {@code 又は}) or the
 * prefixes {@code 新}/{@code 旧}. A name preceded by kanji or katakana is part of a longer
 * name ({@code 信託法} inside {@code 担保付社債信託法}). Names are expected longest-first;
 * ranges claimed by a longer name are not re-matched by a shorter one.</p>
 */
final class LawNameMatcher {

    // Optional single separator, then either 第 (prefix form) or end of window (suffix form).
    private static final Pattern TRAILER = Pattern.compile(
            "(?:の|、|，|,|\\r?\\n|（[^（）]{0,20}）)?(?:(第)|[ \\t\\u3000]*$)");

    private LawNameMatcher() {
    }

    /**
     * Returns the candidate ending closest to the window end.
     * Ties favour the suffix form, then the longer name.
     */
    static Optional<LawNameMatch> findClosest(String window, List<String> namesLongestFirst) {
        LawNameMatch best = null;
        for (LawNameMatch match : findAll(window, namesLongestFirst)) {
            if (best == null || isCloser(match, best)) {
                best = match;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Returns the name that ends the window, if any.
     */
    static Optional<LawNameMatch> findSuffix(String window, List<String> namesLongestFirst) {
        for (LawNameMatch match : findAll(window, namesLongestFirst)) {
            if (match.suffixForm()) {
                return Optional.of(match);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns true if any name occurs anywhere in the text with a valid boundary.
     */
    static boolean containsAny(String text, List<String> namesLongestFirst) {
        List<int[]> claimed = new ArrayList<>();
        for (String name : namesLongestFirst) {
            int from = 0;
            int idx;
            while ((idx = text.indexOf(name, from)) >= 0) {
                int end = idx + name.length();
                if (!isClaimed(claimed, idx, end)) {
                    claimed.add(new int[]{idx, end});
                    if (hasBoundary(text, idx)) {
                        return true;
                    }
                }
                from = idx + 1;
            }
        }
        return false;
    }

    static boolean hasBoundary(String text, int start) {
        if (start == 0) {
            return true;
        }
        char prev = text.charAt(start - 1);
        if (prev == '新' || prev == '旧') {
            return true;
        }
        if (Character.isWhitespace(prev) || prev == '　') {
            return true;
        }
        Character.UnicodeScript script = Character.UnicodeScript.of(prev);
        if (script == Character.UnicodeScript.HIRAGANA) {
            return true;
        }
        if (script == Character.UnicodeScript.HAN || script == Character.UnicodeScript.KATAKANA) {
            return false;
        }
        return !Character.isLetterOrDigit(prev);
    }

    private static List<LawNameMatch> findAll(String window, List<String> namesLongestFirst) {
        List<LawNameMatch> matches = new ArrayList<>();
        List<int[]> claimed = new ArrayList<>();
        Matcher trailer = TRAILER.matcher(window);
        for (String name : namesLongestFirst) {
            if (name.isEmpty()) {
                continue;
            }
            int from = 0;
            int idx;
            while ((idx = window.indexOf(name, from)) >= 0) {
                int nameEnd = idx + name.length();
                from = idx + 1;
                if (isClaimed(claimed, idx, nameEnd)) {
                    continue;
                }
                claimed.add(new int[]{idx, nameEnd});
                if (!hasBoundary(window, idx)) {
                    continue;
                }
                trailer.region(nameEnd, window.length());
                if (!trailer.lookingAt()) {
                    continue;
                }
                boolean prefixForm = trailer.group(1) != null;
                int end = prefixForm ? trailer.end() : window.length();
                matches.add(new LawNameMatch(name, idx, end, !prefixForm));
            }
        }
        return matches;
    }

    private static boolean isCloser(LawNameMatch candidate, LawNameMatch best) {
        if (candidate.end() != best.end()) {
            return candidate.end() > best.end();
        }
        if (candidate.suffixForm() != best.suffixForm()) {
            return candidate.suffixForm();
        }
        return false;
    }

    private static boolean isClaimed(List<int[]> claimed, int start, int end) {
        for (int[] range : claimed) {
            if (start >= range[0] && end <= range[1]) {
                return true;
            }
        }
        return false;
    }
}
