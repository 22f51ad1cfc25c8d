package com.beancount.langserver.ledger;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Base type of every directive produced from a ledger. Entries are immutable; two entries are equal
 * when they have the same kind, date, metadata (including source position) and kind-specific fields.
 */
public abstract class Entry {
    private final LocalDate date;
    private final EntryMeta meta;

    protected Entry(LocalDate date, EntryMeta meta) {
        this.date = Objects.requireNonNull(date, "date");
        this.meta = Objects.requireNonNull(meta, "meta");
    }

    public LocalDate getDate() {
        return date;
    }

    public EntryMeta getMeta() {
        return meta;
    }

    /** Lower-case directive keyword, e.g. {@code "txn"}, {@code "open"}, {@code "balance"}. */
    public abstract String getType();

    /** Kind-specific values in a fixed order; drives {@link #equals} and {@link #toString}. */
    protected abstract List<Object> fields();

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        Entry other = (Entry) obj;
        return date.equals(other.date) && meta.equals(other.meta) && fields().equals(other.fields());
    }

    @Override
    public final int hashCode() {
        return Objects.hash(getClass(), date, meta, fields());
    }

    @Override
    public String toString() {
        return getType() + "(" + date + ", " + fields() + ", " + meta + ")";
    }

    static List<Object> values(Object... values) {
        // Arrays.asList keeps nulls, which List.of rejects.
        return Arrays.asList(values);
    }
}
