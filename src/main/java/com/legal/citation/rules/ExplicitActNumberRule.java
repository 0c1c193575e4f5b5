package com.legal.citation.rules;

import com.legal.citation.registry.LawRegistry;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handles a law identified by its promulgation number right before the citation,
 * as in {@code 弁護士法（昭和二十四年法律第二百五号）第三十条の二十八}.
 *
 * <p>A law present in the store is cross-linked; any other law gets an external edge
 * and no link. A number naming the current law is left to the self-law rules.</p>
 */
public class ExplicitActNumberRule extends AbstractCitationRule {

    public static final String NAME = "explicit-act-number";

    private static final Pattern ACT_NUMBER = Pattern.compile("([^（）]*)（([^（）]*号)）[ \\t\\u3000]*$");
    private static final String[] NAME_SEPARATORS = {"若しくは", "並びに", "及び", "又は", "、", "。"};

    private final LawRegistry registry;
    private final int lookbehind;

    public ExplicitActNumberRule(LawRegistry registry, int lookbehind) {
        super(NAME, 10);
        this.registry = Objects.requireNonNull(registry, "registry is required");
        if (lookbehind <= 0) {
            throw new IllegalArgumentException("lookbehind must be positive");
        }
        this.lookbehind = lookbehind;
    }

    @Override
    public Optional<Resolution> evaluate(CitationSite site) {
        Optional<String> actLaw = findActLawName(site.preceding(lookbehind));
        if (actLaw.isEmpty()) {
            return Optional.empty();
        }
        String name = actLaw.get();
        String canonical = registry.resolveAlias(name).orElse(name);
        if (registry.isSelf(canonical, site.currentLawName())) {
            return Optional.empty();
        }
        if (registry.exists(canonical)) {
            return Optional.of(Resolution.crossLink(canonical, getName()));
        }
        return Optional.of(Resolution.externalEdge(name, getName()));
    }

    /**
     * Extracts the law name written before a trailing {@code （…号）} annotation.
     *
     * @param preceding text immediately before a citation
     * @return the law name, or empty when the text does not end with an act number
     */
    public static Optional<String> findActLawName(String preceding) {
        if (preceding == null || preceding.isEmpty()) {
            return Optional.empty();
        }
        Matcher m = ACT_NUMBER.matcher(preceding);
        if (!m.find()) {
            return Optional.empty();
        }
        String name = m.group(1);
        for (String separator : NAME_SEPARATORS) {
            int idx = name.lastIndexOf(separator);
            if (idx >= 0) {
                name = name.substring(idx + separator.length());
            }
        }
        name = name.strip();
        return name.isEmpty() ? Optional.empty() : Optional.of(name);
    }
}
