package com.beancount.langserver.loader.tree;

import java.util.Objects;

/** A {@code key: value} metadata pair; the value may be {@code null} when omitted. */
public final class KeyValue {
    private final String key;
    private final Object value;

    public KeyValue(String key, Object value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof KeyValue)) {
            return false;
        }
        KeyValue other = (KeyValue) obj;
        return key.equals(other.key) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override
    public String toString() {
        return key + ": " + value;
    }
}
