package com.legal.citation.numeral;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class NumeralConverterTest {

    @Nested
    @DisplayName("kanjiToInt")
    class KanjiToInt {

        @ParameterizedTest
        @DisplayName("Should parse positional kanji numerals")
        @CsvSource({
                "一,1",
                "十,10",
                "十一,11",
                "二十三,23",
                "百,100",
                "百二,102",
                "七百七十四,774",
                "千二百三十四,1234",
                "二千,2000",
                "二万,20000",
                "万,10000",
                "一万二千,12000",
                "二十万,200000",
                "三百五十万二千,3502000",
                "九千九百九十九万九千九百九十九,99999999"
        })
        void testPositional(String input, int expected) {
            assertEquals(expected, NumeralConverter.kanjiToInt(input));
        }

        @ParameterizedTest
        @DisplayName("Should parse concatenated kanji digits")
        @CsvSource({
                "一一,11",
                "八七,87",
                "一〇五,105",
                "弐参,23"
        })
        void testConcatenative(String input, int expected) {
            assertEquals(expected, NumeralConverter.kanjiToInt(input));
        }

        @ParameterizedTest
        @DisplayName("Should parse ASCII and fullwidth digits")
        @CsvSource({
                "30,30",
                "３０,30",
                "０７,7"
        })
        void testDigits(String input, int expected) {
            assertEquals(expected, NumeralConverter.kanjiToInt(input));
        }

        @Test
        @DisplayName("Should return zero for null and empty input")
        void testEmpty() {
            assertEquals(0, NumeralConverter.kanjiToInt(null));
            assertEquals(0, NumeralConverter.kanjiToInt(""));
        }

        @Test
        @DisplayName("Should saturate instead of overflowing")
        void testSaturation() {
            assertEquals(Integer.MAX_VALUE, NumeralConverter.kanjiToInt("99999999999999"));
            assertEquals(Integer.MAX_VALUE, NumeralConverter.kanjiToInt("九九九九九九九九九九九九"));
            assertEquals(Integer.MAX_VALUE, NumeralConverter.kanjiToInt("九千万".repeat(30)));
        }
    }

    @Test
    @DisplayName("Should build article keys and file names")
    void testArticleKeyAndFileName() {
        assertEquals("30", NumeralConverter.articleKey(30, null));
        assertEquals("30_28", NumeralConverter.articleKey(30, 28));
        assertEquals("第30条.md", NumeralConverter.articleFileName(30, null));
        assertEquals("第30条の28.md", NumeralConverter.articleFileName(30, 28));
    }
}
