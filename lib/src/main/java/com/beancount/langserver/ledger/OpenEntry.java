package com.beancount.langserver.ledger;

import java.time.LocalDate;
import java.util.List;

/** Opens an account, optionally constraining its currencies and booking method. */
public final class OpenEntry extends Entry {
    private final String account;
    private final List<String> currencies;
    private final String booking;

    public OpenEntry(
            LocalDate date, EntryMeta meta, String account, List<String> currencies, String booking) {
        super(date, meta);
        this.account = account;
        this.currencies = currencies == null ? List.of() : List.copyOf(currencies);
        this.booking = booking;
    }

    public String getAccount() {
        return account;
    }

    public List<String> getCurrencies() {
        return currencies;
    }

    /** Booking method name such as {@code "FIFO"}, or {@code null} for the ledger default. */
    public String getBooking() {
        return booking;
    }

    @Override
    public String getType() {
        return "open";
    }

    @Override
    protected List<Object> fields() {
        return values(account, currencies, booking);
    }
}
