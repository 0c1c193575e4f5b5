package com.legal.citation.numeral;

import java.util.Map;

/**
 * Conversion between kanji numerals and integers, plus the article-key and
 * file-name helpers built on top of it.
 *
 * <p>Two kanji notations are accepted:</p>
 * <ul>
 *   <li>positional: {@code 二十三} → 23, {@code 百二} → 102, {@code 千二百三十四} → 1234,
 *       {@code 二十万} → 200000</li>
 *   <li>concatenative: {@code 一一} → 11, {@code 八七} → 87</li>
 * </ul>
 * All conversions are total: characters outside the numeral set are ignored.
 */
public final class NumeralConverter {

    private static final Map<Character, Integer> DIGITS = Map.ofEntries(
            Map.entry('〇', 0), Map.entry('零', 0),
            Map.entry('一', 1), Map.entry('壱', 1),
            Map.entry('二', 2), Map.entry('弐', 2),
            Map.entry('三', 3), Map.entry('参', 3),
            Map.entry('四', 4),
            Map.entry('五', 5),
            Map.entry('六', 6),
            Map.entry('七', 7),
            Map.entry('八', 8),
            Map.entry('九', 9)
    );

    private static final int MAN = 10000;

    private static final Map<Character, Integer> UNITS = Map.of(
            '十', 10,
            '百', 100,
            '千', 1000,
            '万', MAN
    );

    private NumeralConverter() {
        // Utility class
    }

    /**
     * Converts a kanji or ASCII numeral run to an integer.
     *
     * @param text numeral text, may be null or empty
     * @return the value, 0 for empty input
     */
    public static int kanjiToInt(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        String ascii = toAsciiDigits(text);
        if (isAsciiDigits(ascii)) {
            return parseDigits(ascii);
        }
        for (int i = 0; i < text.length(); i++) {
            if (UNITS.containsKey(text.charAt(i))) {
                return parsePositional(text);
            }
        }
        return parseConcatenative(text);
    }

    /**
     * Builds the article key used inside node ids: {@code 30} or {@code 30_28}.
     */
    public static String articleKey(int main, Integer branch) {
        return branch == null ? Integer.toString(main) : main + "_" + branch;
    }

    /**
     * Builds the Markdown file name of an article: {@code 第30条.md} or {@code 第30条の28.md}.
     */
    public static String articleFileName(int main, Integer branch) {
        return branch == null
                ? "第" + main + "条.md"
                : "第" + main + "条の" + branch + ".md";
    }

    // 十/百/千 build a section below 万; 万 multiplies the whole section.
    private static int parsePositional(String text) {
        long total = 0;
        int section = 0;
        int current = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            Integer digit = DIGITS.get(c);
            if (digit != null) {
                current = digit;
                continue;
            }
            Integer unit = UNITS.get(c);
            if (unit == null) {
                continue;
            }
            if (unit == MAN) {
                section += current;
                total += (long) (section == 0 ? 1 : section) * MAN;
                if (total > Integer.MAX_VALUE) {
                    return Integer.MAX_VALUE;
                }
                section = 0;
            } else {
                section += (current == 0 ? 1 : current) * unit;
            }
            current = 0;
        }
        return (int) Math.min(Integer.MAX_VALUE, total + section + current);
    }

    private static int parseConcatenative(String text) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            Integer digit = DIGITS.get(text.charAt(i));
            if (digit != null) {
                sb.append(digit);
            }
        }
        return parseDigits(sb.toString());
    }

    // Saturates at Integer.MAX_VALUE instead of overflowing.
    private static int parseDigits(String digits) {
        long value = 0;
        for (int i = 0; i < digits.length(); i++) {
            value = value * 10 + (digits.charAt(i) - '0');
            if (value > Integer.MAX_VALUE) {
                return Integer.MAX_VALUE;
            }
        }
        return (int) value;
    }

    private static String toAsciiDigits(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '０' && c <= '９') {
                sb.append((char) ('0' + (c - '０')));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean isAsciiDigits(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
