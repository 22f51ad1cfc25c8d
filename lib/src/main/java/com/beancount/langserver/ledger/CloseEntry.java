package com.beancount.langserver.ledger;

import java.time.LocalDate;
import java.util.List;

/** Marks an account as closed from its date onwards. */
public final class CloseEntry extends Entry {
    private final String account;

    public CloseEntry(LocalDate date, EntryMeta meta, String account) {
        super(date, meta);
        this.account = account;
    }

    public String getAccount() {
        return account;
    }

    @Override
    public String getType() {
        return "close";
    }

    @Override
    protected List<Object> fields() {
        return values(account);
    }
}
