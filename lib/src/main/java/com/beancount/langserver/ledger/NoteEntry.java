package com.beancount.langserver.ledger;

import java.time.LocalDate;
import java.util.List;

/** Free-form comment attached to an account at a date. */
public final class NoteEntry extends Entry {
    private final String account;
    private final String comment;

    public NoteEntry(LocalDate date, EntryMeta meta, String account, String comment) {
        super(date, meta);
        this.account = account;
        this.comment = comment;
    }

    public String getAccount() {
        return account;
    }

    public String getComment() {
        return comment;
    }

    @Override
    public String getType() {
        return "note";
    }

    @Override
    protected List<Object> fields() {
        return values(account, comment);
    }
}
