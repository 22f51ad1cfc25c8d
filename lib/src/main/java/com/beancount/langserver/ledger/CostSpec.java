package com.beancount.langserver.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** The cost annotation of a posting, as written: {@code {...}} per-unit or {@code {{...}}} total. */
public final class CostSpec {
    private final BigDecimal numberPer;
    private final BigDecimal numberTotal;
    private final String currency;
    private final LocalDate date;
    private final String label;
    private final boolean merge;

    public CostSpec(
            BigDecimal numberPer,
            BigDecimal numberTotal,
            String currency,
            LocalDate date,
            String label,
            boolean merge) {
        this.numberPer = numberPer;
        this.numberTotal = numberTotal;
        this.currency = currency;
        this.date = date;
        this.label = label;
        this.merge = merge;
    }

    public BigDecimal getNumberPer() {
        return numberPer;
    }

    public BigDecimal getNumberTotal() {
        return numberTotal;
    }

    public String getCurrency() {
        return currency;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getLabel() {
        return label;
    }

    public boolean isMerge() {
        return merge;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CostSpec)) {
            return false;
        }
        CostSpec other = (CostSpec) obj;
        return merge == other.merge
                && sameNumber(numberPer, other.numberPer)
                && sameNumber(numberTotal, other.numberTotal)
                && Objects.equals(currency, other.currency)
                && Objects.equals(date, other.date)
                && Objects.equals(label, other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                numberPer == null ? null : numberPer.stripTrailingZeros(),
                numberTotal == null ? null : numberTotal.stripTrailingZeros(),
                currency,
                date,
                label,
                merge);
    }

    @Override
    public String toString() {
        return "CostSpec(per=" + numberPer + ", total=" + numberTotal + ", currency=" + currency
                + ", date=" + date + ", label=" + label + ", merge=" + merge + ")";
    }

    private static boolean sameNumber(BigDecimal left, BigDecimal right) {
        if (left == null || right == null) {
            return left == right;
        }
        return left.compareTo(right) == 0;
    }
}
