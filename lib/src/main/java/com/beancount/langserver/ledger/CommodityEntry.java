package com.beancount.langserver.ledger;

import java.time.LocalDate;
import java.util.List;

/** Declares a currency or commodity. */
public final class CommodityEntry extends Entry {
    private final String currency;

    public CommodityEntry(LocalDate date, EntryMeta meta, String currency) {
        super(date, meta);
        this.currency = currency;
    }

    public String getCurrency() {
        return currency;
    }

    @Override
    public String getType() {
        return "commodity";
    }

    @Override
    protected List<Object> fields() {
        return values(currency);
    }
}
