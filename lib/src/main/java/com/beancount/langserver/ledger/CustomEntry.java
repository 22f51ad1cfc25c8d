package com.beancount.langserver.ledger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A user-defined directive: a type name followed by loosely typed values. */
public final class CustomEntry extends Entry {
    private final String customType;
    private final List<Object> customValues;

    public CustomEntry(LocalDate date, EntryMeta meta, String customType, List<Object> customValues) {
        super(date, meta);
        this.customType = customType;
        this.customValues =
                customValues == null
                        ? List.of()
                        : Collections.unmodifiableList(new ArrayList<>(customValues));
    }

    public String getCustomType() {
        return customType;
    }

    public List<Object> getCustomValues() {
        return customValues;
    }

    @Override
    public String getType() {
        return "custom";
    }

    @Override
    protected List<Object> fields() {
        return values(customType, customValues);
    }
}
