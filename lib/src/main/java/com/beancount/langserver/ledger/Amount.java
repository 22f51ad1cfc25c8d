package com.beancount.langserver.ledger;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A number with a currency. Either part may be {@code null} when the ledger elides it and leaves it
 * to be inferred during booking.
 */
public final class Amount {
    private final BigDecimal number;
    private final String currency;

    public Amount(BigDecimal number, String currency) {
        this.number = number;
        this.currency = currency;
    }

    public BigDecimal getNumber() {
        return number;
    }

    public String getCurrency() {
        return currency;
    }

    public boolean isComplete() {
        return number != null && currency != null;
    }

    // Numerically equal values compare equal regardless of scale, so 10.0 USD == 10 USD.
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Amount)) {
            return false;
        }
        Amount other = (Amount) obj;
        boolean numbersEqual =
                number == null ? other.number == null : other.number != null && number.compareTo(other.number) == 0;
        return numbersEqual && Objects.equals(currency, other.currency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number == null ? null : number.stripTrailingZeros(), currency);
    }

    @Override
    public String toString() {
        String renderedNumber = number == null ? "<missing>" : number.toPlainString();
        String renderedCurrency = currency == null ? "<missing>" : currency;
        return renderedNumber + " " + renderedCurrency;
    }
}
