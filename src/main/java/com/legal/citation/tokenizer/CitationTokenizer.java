package com.legal.citation.tokenizer;

import com.legal.citation.core.model.CitationOccurrence;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans text for article citations of the form {@code 第<numeral>条} optionally followed by
 * {@code の<numeral>}.
 *
 * <p>{@link #scan(String)} returns a lazy, finite sequence: matching happens as the iterator
 * advances, left to right, without overlaps. Each call to {@link Iterable#iterator()} restarts
 * the scan from the beginning of the text. Wiki-link markup in the input is not interpreted.</p>
 */
public class CitationTokenizer {

    static final String NUMERAL_RUN = "[0-9０-９〇零一壱二弐三参四五六七八九十百千]+";

    private static final Pattern CITATION = Pattern.compile(
            "第(" + NUMERAL_RUN + ")条(?:の(" + NUMERAL_RUN + "))?");

    /**
     * Returns the citations of {@code text} as a restartable lazy sequence.
     */
    public Iterable<CitationOccurrence> scan(String text) {
        String input = text != null ? text : "";
        return () -> new OccurrenceIterator(CITATION.matcher(input));
    }

    /**
     * Eagerly collects every citation of {@code text}.
     */
    public List<CitationOccurrence> scanAll(String text) {
        List<CitationOccurrence> result = new ArrayList<>();
        for (CitationOccurrence occurrence : scan(text)) {
            result.add(occurrence);
        }
        return result;
    }

    /**
     * Returns the pattern that matches a single citation, for callers composing larger expressions.
     */
    public static String citationRegex() {
        return "第" + NUMERAL_RUN + "条(?:の" + NUMERAL_RUN + ")?";
    }

    private static final class OccurrenceIterator implements Iterator<CitationOccurrence> {
        private final Matcher matcher;
        private CitationOccurrence next;
        private boolean done;

        OccurrenceIterator(Matcher matcher) {
            this.matcher = matcher;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (done) {
                return false;
            }
            if (matcher.find()) {
                next = new CitationOccurrence(
                        matcher.start(),
                        matcher.end(),
                        matcher.group(1),
                        matcher.group(2),
                        matcher.group());
                return true;
            }
            done = true;
            return false;
        }

        @Override
        public CitationOccurrence next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            CitationOccurrence current = next;
            next = null;
            return current;
        }
    }
}
