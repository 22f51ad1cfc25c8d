package com.beancount.langserver.loader.tree;

import java.util.Objects;

/** A request to splice the files matching {@link #getGlobPattern()} into the current walk. */
public final class IncludeDirective {
    private final String globPattern;

    public IncludeDirective(String globPattern) {
        this.globPattern = Objects.requireNonNull(globPattern, "globPattern");
    }

    public String getGlobPattern() {
        return globPattern;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IncludeDirective
                && globPattern.equals(((IncludeDirective) obj).globPattern);
    }

    @Override
    public int hashCode() {
        return globPattern.hashCode();
    }

    @Override
    public String toString() {
        return "include \"" + globPattern + "\"";
    }
}
