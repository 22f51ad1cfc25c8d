package com.beancount.langserver.loader.tree;

import com.beancount.langserver.ledger.Entry;
import java.util.Objects;

/**
 * What dispatching one statement node yielded. Exactly one of the payload getters is meaningful,
 * depending on {@link #getKind()}.
 */
public final class HandlerOutcome {

    public enum Kind {
        PRODUCED,
        SKIPPED,
        SYNTAX_PROBLEM,
        INCLUDE_REQUEST
    }

    private static final HandlerOutcome SKIPPED = new HandlerOutcome(Kind.SKIPPED, null, null, null);

    private final Kind kind;
    private final Entry entry;
    private final String problem;
    private final IncludeDirective include;

    private HandlerOutcome(Kind kind, Entry entry, String problem, IncludeDirective include) {
        this.kind = kind;
        this.entry = entry;
        this.problem = problem;
        this.include = include;
    }

    public static HandlerOutcome produced(Entry entry) {
        return new HandlerOutcome(Kind.PRODUCED, Objects.requireNonNull(entry, "entry"), null, null);
    }

    public static HandlerOutcome skipped() {
        return SKIPPED;
    }

    public static HandlerOutcome syntaxProblem(String problem) {
        return new HandlerOutcome(Kind.SYNTAX_PROBLEM, null, problem, null);
    }

    public static HandlerOutcome includeRequest(IncludeDirective include) {
        return new HandlerOutcome(
                Kind.INCLUDE_REQUEST, null, null, Objects.requireNonNull(include, "include"));
    }

    public Kind getKind() {
        return kind;
    }

    public Entry getEntry() {
        return entry;
    }

    /** Detail for a syntax problem; may be {@code null}. */
    public String getProblem() {
        return problem;
    }

    public IncludeDirective getInclude() {
        return include;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case PRODUCED -> "Produced(" + entry + ")";
            case SYNTAX_PROBLEM -> "SyntaxProblem(" + problem + ")";
            case INCLUDE_REQUEST -> "IncludeRequest(" + include + ")";
            case SKIPPED -> "Skipped";
        };
    }
}
