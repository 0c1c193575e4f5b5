package com.legal.citation.markup;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for Obsidian wiki-link markup: {@code [[target|display]]} and {@code [[display]]}.
 */
public final class WikiLinks {

    // Group 1: display text
    private static final Pattern DISPLAY = Pattern.compile("\\[\\[(?:[^\\]|]+\\|)?([^\\]]+)\\]\\]");

    // Group 1: whole link body
    private static final Pattern FULL = Pattern.compile("\\[\\[([^\\]]+)\\]\\]");

    private static final String LAWS_ROOT = "laws/";
    private static final String MAIN_PROVISION_DIR = "/本文/";

    private WikiLinks() {
        // Utility class
    }

    /**
     * Replaces every link with its display text.
     * {@code [[laws/刑法/本文/第199条.md|第百九十九条]]} becomes {@code 第百九十九条}.
     */
    public static String strip(String text) {
        if (text == null || text.indexOf("[[") < 0) {
            return text;
        }
        return DISPLAY.matcher(text).replaceAll(m -> Matcher.quoteReplacement(m.group(1)));
    }

    /**
     * Formats a link to an article of a law's main provision.
     */
    public static String articleLink(String lawFolder, String articleFileName, String display) {
        return format(articlePath(lawFolder, articleFileName), display);
    }

    /**
     * Path of an article file relative to the vault root.
     */
    public static String articlePath(String lawFolder, String articleFileName) {
        return LAWS_ROOT + lawFolder + MAIN_PROVISION_DIR + articleFileName;
    }

    public static String format(String target, String display) {
        return "[[" + target + "|" + display + "]]";
    }

    /**
     * Lists the raw bodies of all links in {@code text}, in order.
     */
    public static List<String> bodies(String text) {
        List<String> result = new ArrayList<>();
        if (text == null) {
            return result;
        }
        Matcher m = FULL.matcher(text);
        while (m.find()) {
            result.add(m.group(1));
        }
        return result;
    }

    /**
     * Extracts the file path of a link body, dropping display, heading and block parts.
     * Returns empty for external URLs.
     */
    public static Optional<String> targetPath(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        if (body.startsWith("http://") || body.startsWith("https://") || body.startsWith("mailto:")) {
            return Optional.empty();
        }
        String path = body;
        int pipe = path.indexOf('|');
        if (pipe >= 0) {
            path = path.substring(0, pipe);
        }
        int hash = path.indexOf('#');
        if (hash >= 0) {
            path = path.substring(0, hash);
        }
        int caret = path.indexOf('^');
        if (caret >= 0) {
            path = path.substring(0, caret);
        }
        path = path.trim();
        return path.isEmpty() ? Optional.empty() : Optional.of(path);
    }
}
