package com.beancount.langserver.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/** Asserts the balance of an account at the beginning of a date. */
public final class BalanceEntry extends Entry {
    private final String account;
    private final Amount amount;
    private final BigDecimal tolerance;

    public BalanceEntry(
            LocalDate date, EntryMeta meta, String account, Amount amount, BigDecimal tolerance) {
        super(date, meta);
        this.account = account;
        this.amount = amount;
        this.tolerance = tolerance;
    }

    public String getAccount() {
        return account;
    }

    public Amount getAmount() {
        return amount;
    }

    /** Explicit {@code ~ tolerance}, or {@code null} when the default tolerance applies. */
    public BigDecimal getTolerance() {
        return tolerance;
    }

    @Override
    public String getType() {
        return "balance";
    }

    @Override
    protected List<Object> fields() {
        return values(account, amount, tolerance == null ? null : tolerance.stripTrailingZeros());
    }
}
