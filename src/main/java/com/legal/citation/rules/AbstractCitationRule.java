package com.legal.citation.rules;

import java.util.Objects;

/**
 * Base class carrying the name and priority of a rule.
 */
public abstract class AbstractCitationRule implements CitationRule {

    private final String name;
    private final int priority;

    protected AbstractCitationRule(String name, int priority) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.priority = priority;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "', priority=" + priority + '}';
    }
}
