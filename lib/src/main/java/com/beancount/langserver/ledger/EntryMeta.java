package com.beancount.langserver.ledger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Source position plus the key/value metadata attached to an entry. Values keep the type they were
 * parsed as ({@code String}, {@code BigDecimal}, {@code LocalDate}, {@code Boolean}, {@link Amount}).
 */
public final class EntryMeta {
    private final String filename;
    private final int lineno;
    private final Map<String, Object> values;

    public EntryMeta(String filename, int lineno, Map<String, Object> values) {
        this.filename = Objects.requireNonNull(filename, "filename");
        this.lineno = lineno;
        this.values =
                values == null || values.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String getFilename() {
        return filename;
    }

    public int getLineno() {
        return lineno;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public SourcePosition toPosition() {
        return new SourcePosition(filename, lineno);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof EntryMeta)) {
            return false;
        }
        EntryMeta other = (EntryMeta) obj;
        return lineno == other.lineno
                && filename.equals(other.filename)
                && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filename, lineno, values);
    }

    @Override
    public String toString() {
        return filename + ":" + lineno + (values.isEmpty() ? "" : " " + values);
    }
}
