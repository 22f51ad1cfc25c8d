package com.beancount.langserver.ledger;

import java.time.LocalDate;
import java.util.List;

/** Price of one unit of {@code currency} expressed as {@code amount}. */
public final class PriceEntry extends Entry {
    private final String currency;
    private final Amount amount;

    public PriceEntry(LocalDate date, EntryMeta meta, String currency, Amount amount) {
        super(date, meta);
        this.currency = currency;
        this.amount = amount;
    }

    public String getCurrency() {
        return currency;
    }

    public Amount getAmount() {
        return amount;
    }

    @Override
    public String getType() {
        return "price";
    }

    @Override
    protected List<Object> fields() {
        return values(currency, amount);
    }
}
