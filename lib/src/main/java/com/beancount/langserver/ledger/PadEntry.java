package com.beancount.langserver.ledger;

import java.time.LocalDate;
import java.util.List;

/** Requests a padding transaction from {@code sourceAccount} to satisfy the next balance assertion. */
public final class PadEntry extends Entry {
    private final String account;
    private final String sourceAccount;

    public PadEntry(LocalDate date, EntryMeta meta, String account, String sourceAccount) {
        super(date, meta);
        this.account = account;
        this.sourceAccount = sourceAccount;
    }

    public String getAccount() {
        return account;
    }

    public String getSourceAccount() {
        return sourceAccount;
    }

    @Override
    public String getType() {
        return "pad";
    }

    @Override
    protected List<Object> fields() {
        return values(account, sourceAccount);
    }
}
