package com.beancount.langserver.loader;

import com.beancount.langserver.ledger.Entry;
import com.beancount.langserver.ledger.SourcePosition;
import java.util.Objects;

/**
 * A positioned problem found while loading a ledger. Diagnostics never abort a load; they are
 * collected and handed to the caller next to the entries.
 */
public final class Diagnostic {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final SourcePosition source;
    private final String message;
    private final Entry relatedEntry;

    public Diagnostic(Level level, SourcePosition source, String message, Entry relatedEntry) {
        this.level = Objects.requireNonNull(level, "level");
        this.source = Objects.requireNonNull(source, "source");
        this.message = Objects.requireNonNull(message, "message");
        this.relatedEntry = relatedEntry;
    }

    public static Diagnostic error(SourcePosition source, String message) {
        return new Diagnostic(Level.ERROR, source, message, null);
    }

    public static Diagnostic warning(SourcePosition source, String message) {
        return new Diagnostic(Level.WARNING, source, message, null);
    }

    public Level getLevel() {
        return level;
    }

    public SourcePosition getSource() {
        return source;
    }

    public String getMessage() {
        return message;
    }

    /** The entry the problem is about, or {@code null}. */
    public Entry getRelatedEntry() {
        return relatedEntry;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Diagnostic)) {
            return false;
        }
        Diagnostic other = (Diagnostic) obj;
        return level == other.level
                && source.equals(other.source)
                && message.equals(other.message)
                && Objects.equals(relatedEntry, other.relatedEntry);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, source, message, relatedEntry);
    }

    @Override
    public String toString() {
        return source + ": " + message;
    }
}
