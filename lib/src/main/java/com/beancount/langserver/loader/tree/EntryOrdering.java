package com.beancount.langserver.loader.tree;

import com.beancount.langserver.ledger.Entry;
import java.util.Comparator;

/**
 * Canonical entry order: by date, then {@code open} before {@code balance} before everything else,
 * with {@code document} and then {@code close} last on a day. Used with a stable sort, so ties keep
 * document order.
 */
public final class EntryOrdering {

    public static final Comparator<Entry> CANONICAL =
            Comparator.comparing(Entry::getDate).thenComparingInt(EntryOrdering::typeOrder);

    private EntryOrdering() {}

    static int typeOrder(Entry entry) {
        return switch (entry.getType()) {
            case "open" -> -2;
            case "balance" -> -1;
            case "document" -> 1;
            case "close" -> 2;
            default -> 0;
        };
    }
}
