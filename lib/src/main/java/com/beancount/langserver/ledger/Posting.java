package com.beancount.langserver.ledger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One leg of a transaction. Units, cost and price are {@code null} when not written. */
public final class Posting {
    private final String flag;
    private final String account;
    private final Amount units;
    private final CostSpec cost;
    private final Amount price;
    private final Map<String, Object> meta;

    public Posting(
            String flag,
            String account,
            Amount units,
            CostSpec cost,
            Amount price,
            Map<String, Object> meta) {
        this.flag = flag;
        this.account = Objects.requireNonNull(account, "account");
        this.units = units;
        this.cost = cost;
        this.price = price;
        this.meta =
                meta == null || meta.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    public String getFlag() {
        return flag;
    }

    public String getAccount() {
        return account;
    }

    public Amount getUnits() {
        return units;
    }

    public CostSpec getCost() {
        return cost;
    }

    public Amount getPrice() {
        return price;
    }

    public Map<String, Object> getMeta() {
        return meta;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Posting)) {
            return false;
        }
        Posting other = (Posting) obj;
        return Objects.equals(flag, other.flag)
                && account.equals(other.account)
                && Objects.equals(units, other.units)
                && Objects.equals(cost, other.cost)
                && Objects.equals(price, other.price)
                && meta.equals(other.meta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(flag, account, units, cost, price, meta);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (flag != null) {
            builder.append(flag).append(' ');
        }
        builder.append(account);
        if (units != null) {
            builder.append(' ').append(units);
        }
        if (cost != null) {
            builder.append(' ').append(cost);
        }
        if (price != null) {
            builder.append(" @ ").append(price);
        }
        return builder.toString();
    }
}
