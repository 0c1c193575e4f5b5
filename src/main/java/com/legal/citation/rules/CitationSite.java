package com.legal.citation.rules;

import com.legal.citation.core.model.CitationOccurrence;
import com.legal.citation.core.model.ResolutionContext;
import com.legal.citation.markup.WikiLinks;
import com.legal.citation.scope.ScopeResolver;

import java.util.Objects;
import java.util.Optional;

/**
 * A citation together with the text around it. Derived views of the preceding text are
 * computed on first use and shared by all rules evaluating the same citation.
 *
 * <p>Not thread-safe; one instance serves one citation of one resolution call.</p>
 */
public final class CitationSite {

    private final CitationOccurrence occurrence;
    private final ResolutionContext context;
    private final ScopeResolver scopeResolver;

    private String window;
    private Boolean selfTokenImmediate;
    private Optional<String> immediateNamedLaw;

    public CitationSite(CitationOccurrence occurrence, ResolutionContext context, ScopeResolver scopeResolver) {
        this.occurrence = Objects.requireNonNull(occurrence, "occurrence is required");
        this.context = Objects.requireNonNull(context, "context is required");
        this.scopeResolver = Objects.requireNonNull(scopeResolver, "scopeResolver is required");
    }

    public CitationOccurrence occurrence() {
        return occurrence;
    }

    public ResolutionContext context() {
        return context;
    }

    public ScopeResolver scopeResolver() {
        return scopeResolver;
    }

    public String currentLawName() {
        return context.getCurrentLawName();
    }

    /**
     * Up to {@code length} characters immediately before the citation, markup stripped.
     */
    public String preceding(int length) {
        String text = context.getFullText();
        int end = occurrence.startOffset();
        int start = Math.max(0, end - length);
        return WikiLinks.strip(text.substring(start, end));
    }

    /**
     * Up to {@code length} characters immediately after the citation.
     */
    public String following(int length) {
        String text = context.getFullText();
        int start = occurrence.endOffset();
        int end = Math.min(text.length(), start + length);
        return text.substring(start, end);
    }

    /**
     * The scope window: the sentence up to the citation, cut at the last paragraph break.
     */
    public String window() {
        if (window == null) {
            window = scopeResolver.window(context.getFullText(), occurrence.startOffset());
        }
        return window;
    }

    public boolean selfTokenImmediate() {
        if (selfTokenImmediate == null) {
            selfTokenImmediate = scopeResolver.selfTokenApplies(window());
        }
        return selfTokenImmediate;
    }

    /**
     * Canonical folder of a linkable law named directly before the citation.
     */
    public Optional<String> immediateNamedLaw() {
        if (immediateNamedLaw == null) {
            immediateNamedLaw = scopeResolver.immediateNamedLaw(window(), currentLawName());
        }
        return immediateNamedLaw;
    }
}
