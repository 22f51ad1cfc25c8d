package com.beancount.langserver.ledger;

import java.time.LocalDate;
import java.util.List;

/** A named query stored in the ledger. */
public final class QueryEntry extends Entry {
    private final String name;
    private final String queryString;

    public QueryEntry(LocalDate date, EntryMeta meta, String name, String queryString) {
        super(date, meta);
        this.name = name;
        this.queryString = queryString;
    }

    public String getName() {
        return name;
    }

    public String getQueryString() {
        return queryString;
    }

    @Override
    public String getType() {
        return "query";
    }

    @Override
    protected List<Object> fields() {
        return values(name, queryString);
    }
}
