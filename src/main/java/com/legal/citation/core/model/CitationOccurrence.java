package com.legal.citation.core.model;

import com.legal.citation.numeral.NumeralConverter;

import java.util.Objects;

/**
 * A single {@code 第N条} / {@code 第N条のM} match found in a text.
 *
 * @param startOffset   inclusive start offset of the literal in the scanned text
 * @param endOffset     exclusive end offset of the literal in the scanned text
 * @param mainNumeral   the article numeral as written (kanji or digits)
 * @param branchNumeral the branch numeral as written, or null when absent
 * @param literalText   the matched text, e.g. {@code 第三十条の二十八}
 */
public record CitationOccurrence(
        int startOffset,
        int endOffset,
        String mainNumeral,
        String branchNumeral,
        String literalText
) {

    public CitationOccurrence {
        Objects.requireNonNull(mainNumeral, "mainNumeral is required");
        Objects.requireNonNull(literalText, "literalText is required");
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("Invalid offsets: " + startOffset + ".." + endOffset);
        }
    }

    public boolean hasBranch() {
        return branchNumeral != null;
    }

    public int mainNumber() {
        return NumeralConverter.kanjiToInt(mainNumeral);
    }

    public Integer branchNumber() {
        return branchNumeral == null ? null : NumeralConverter.kanjiToInt(branchNumeral);
    }

    /**
     * Article key used in node ids: {@code 30} or {@code 30_28}.
     */
    public String articleKey() {
        return NumeralConverter.articleKey(mainNumber(), branchNumber());
    }

    /**
     * File name of the cited article: {@code 第30条.md} or {@code 第30条の28.md}.
     */
    public String articleFileName() {
        return NumeralConverter.articleFileName(mainNumber(), branchNumber());
    }
}
