package com.legal.citation.scope;

import com.legal.citation.markup.WikiLinks;
import com.legal.citation.registry.LawRegistry;
import com.legal.citation.tokenizer.CitationTokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Determines which law governs a bare citation from the text preceding it.
 *
 * <p>The search window is the current sentence up to the citation, cut at the last paragraph
 * break and with wiki-link markup replaced by its display text. Inside the window:</p>
 * <ol>
 *   <li>a self-law token ({@code 本法}, {@code この法律}, ...) ending the window, possibly
 *       followed by a comma-separated run of citations, gives {@link ScopeType#SELF};</li>
 *   <li>otherwise the linkable law name ending closest to the citation gives
 *       {@link ScopeType#NAMED};</li>
 *   <li>only when no linkable name matches, the closest external law name gives
 *       {@link ScopeType#EXTERNAL};</li>
 *   <li>a reset token between that name and the citation cancels the scope.</li>
 * </ol>
 */
public class ScopeResolver {

    /** Self-law tokens, longest first. */
    public static final List<String> SELF_LAW_TOKENS = List.of("当該法律", "この法律", "当該法", "本法");

    /** Tokens and phrases that end a named scope. */
    public static final List<String> SCOPE_RESET_TOKENS = List.of(
            "同法", "同条", "同項", "同号", "同表", "同附則",
            "前条", "次条", "前項", "次項", "前号", "次号",
            "本条", "本項", "本号", "その", "当該",
            "の規定により", "の規定に基づき", "の規定を適用", "の規定は");

    private static final Pattern SELF_SCOPE = Pattern.compile(
            "(" + String.join("|", SELF_LAW_TOKENS) + ")"
                    + "(?:" + CitationTokenizer.citationRegex() + "[、，,][\\s\\u3000]*)*"
                    + "[\\s\\u3000]*$");

    private static final Pattern PARENTHESIZED = Pattern.compile("（[^（）]*）|\\([^()]*\\)");
    private static final Pattern QUOTED = Pattern.compile("「[^「」]*」|『[^『』]*』");

    private static final char SENTENCE_END = '。';
    private static final String PARAGRAPH_BREAK = "\n\n";

    private final LawRegistry registry;

    public ScopeResolver(LawRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
    }

    /**
     * Returns the law governing a citation starting at {@code position}.
     */
    public Scope governingLaw(String text, int position, String currentLawName) {
        return governingLawInWindow(window(text, position), currentLawName);
    }

    /**
     * Same as {@link #governingLaw(String, int, String)} for an already computed {@link #window}.
     */
    public Scope governingLawInWindow(String window, String currentLawName) {
        if (selfTokenApplies(window)) {
            return Scope.self();
        }

        // A named law, once matched, is only cancelled by a reset token after it.
        Optional<LawNameMatch> named = LawNameMatcher.findClosest(window, linkableNames(currentLawName));
        if (named.isPresent()) {
            LawNameMatch match = named.get();
            return containsResetToken(window.substring(match.end()))
                    ? Scope.none()
                    : Scope.named(canonicalFolder(match.name(), currentLawName));
        }

        Optional<LawNameMatch> external = LawNameMatcher.findClosest(window, externalNames(currentLawName));
        if (external.isEmpty() || containsResetToken(window.substring(external.get().end()))) {
            return Scope.none();
        }
        return Scope.external(external.get().name());
    }

    /**
     * Returns the normalized scope window for a citation starting at {@code position}:
     * text after the last {@code 。} and the last blank line, with wiki-link markup stripped.
     */
    public String window(String text, int position) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int end = Math.max(0, Math.min(position, text.length()));
        int start = text.lastIndexOf(SENTENCE_END, end - 1) + 1;
        String sentence = text.substring(start, end);
        int paragraph = sentence.lastIndexOf(PARAGRAPH_BREAK);
        if (paragraph >= 0) {
            sentence = sentence.substring(paragraph + PARAGRAPH_BREAK.length());
        }
        return WikiLinks.strip(sentence);
    }

    /**
     * Returns true if the window ends with a self-law token, or with a self-law token
     * followed by a comma-separated run of citations.
     */
    public boolean selfTokenApplies(String window) {
        if (window == null || window.isEmpty()) {
            return false;
        }
        Matcher m = SELF_SCOPE.matcher(window);
        int from = 0;
        while (from < window.length() && m.find(from)) {
            if (LawNameMatcher.hasBoundary(window, m.start())) {
                return true;
            }
            from = m.start() + 1;
        }
        return false;
    }

    /**
     * Returns the canonical folder of a linkable law named immediately before the citation.
     */
    public Optional<String> immediateNamedLaw(String window, String currentLawName) {
        return LawNameMatcher.findSuffix(window, linkableNames(currentLawName))
                .map(match -> canonicalFolder(match.name(), currentLawName));
    }

    /**
     * Returns the external law named immediately before the citation.
     */
    public Optional<String> immediateExternalLaw(String window, String currentLawName) {
        return LawNameMatcher.findSuffix(window, externalNames(currentLawName))
                .map(LawNameMatch::name);
    }

    /**
     * Returns true if an external law is named anywhere in the window outside
     * parentheses and quotations.
     */
    public boolean externalLawInSentence(String window, String currentLawName) {
        String stripped = removeEnclosed(window, PARENTHESIZED);
        stripped = removeEnclosed(stripped, QUOTED);
        return LawNameMatcher.containsAny(stripped, externalNames(currentLawName));
    }

    static boolean containsResetToken(String tail) {
        for (String token : SCOPE_RESET_TOKENS) {
            if (tail.contains(token)) {
                return true;
            }
        }
        return false;
    }

    private List<String> linkableNames(String currentLawName) {
        List<String> names = registry.linkableNames();
        if (currentLawName == null || currentLawName.isEmpty() || names.contains(currentLawName)) {
            return names;
        }
        List<String> withCurrent = new ArrayList<>(names.size() + 1);
        boolean inserted = false;
        for (String name : names) {
            if (!inserted && name.length() < currentLawName.length()) {
                withCurrent.add(currentLawName);
                inserted = true;
            }
            withCurrent.add(name);
        }
        if (!inserted) {
            withCurrent.add(currentLawName);
        }
        return withCurrent;
    }

    private List<String> externalNames(String currentLawName) {
        List<String> names = registry.externalNames();
        if (currentLawName == null || !names.contains(currentLawName)) {
            return names;
        }
        List<String> withoutCurrent = new ArrayList<>(names);
        withoutCurrent.remove(currentLawName);
        return withoutCurrent;
    }

    private String canonicalFolder(String name, String currentLawName) {
        if (name.equals(currentLawName)) {
            return currentLawName;
        }
        return registry.resolveAlias(name).orElse(name);
    }

    private static String removeEnclosed(String text, Pattern enclosed) {
        String previous;
        String current = text;
        do {
            previous = current;
            current = enclosed.matcher(previous).replaceAll("");
        } while (!current.equals(previous));
        return current;
    }
}
