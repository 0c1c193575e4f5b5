package com.legal.citation.scope;

import java.util.Objects;

/**
 * Result of scope detection.
 *
 * @param type    the scope kind
 * @param lawName canonical folder name for {@link ScopeType#NAMED}, surface name for
 *                {@link ScopeType#EXTERNAL}, null otherwise
 */
public record Scope(ScopeType type, String lawName) {

    private static final Scope SELF = new Scope(ScopeType.SELF, null);
    private static final Scope NONE = new Scope(ScopeType.NONE, null);

    public Scope {
        Objects.requireNonNull(type, "type is required");
    }

    public static Scope self() {
        return SELF;
    }

    public static Scope none() {
        return NONE;
    }

    public static Scope named(String lawName) {
        return new Scope(ScopeType.NAMED, Objects.requireNonNull(lawName, "lawName is required"));
    }

    public static Scope external(String lawName) {
        return new Scope(ScopeType.EXTERNAL, Objects.requireNonNull(lawName, "lawName is required"));
    }

    public boolean isNone() {
        return type == ScopeType.NONE;
    }
}
