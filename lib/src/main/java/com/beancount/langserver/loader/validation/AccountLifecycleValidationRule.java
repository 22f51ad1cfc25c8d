package com.beancount.langserver.loader.validation;

import com.beancount.langserver.ledger.CloseEntry;
import com.beancount.langserver.ledger.Entry;
import com.beancount.langserver.ledger.OpenEntry;
import com.beancount.langserver.loader.Diagnostic;
import com.beancount.langserver.loader.LedgerOptions;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports references to accounts that are never opened, used before their open date or after
 * their close date. Expects entries in canonical order.
 */
final class AccountLifecycleValidationRule implements ValidationRule {

    @Override
    public List<Diagnostic> validate(List<Entry> entries, LedgerOptions options) {
        Map<String, LocalDate> opened = new HashMap<>();
        Map<String, LocalDate> closed = new HashMap<>();
        for (Entry entry : entries) {
            if (entry instanceof OpenEntry open) {
                opened.putIfAbsent(open.getAccount(), open.getDate());
            } else if (entry instanceof CloseEntry close) {
                closed.putIfAbsent(close.getAccount(), close.getDate());
            }
        }

        List<Diagnostic> messages = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry instanceof OpenEntry) {
                continue;
            }
            for (String account : AccountNames.referencedBy(entry)) {
                LocalDate openDate = opened.get(account);
                if (openDate == null) {
                    messages.add(error(entry, "Invalid reference to unknown account '" + account + "'"));
                } else if (entry.getDate().isBefore(openDate)) {
                    messages.add(
                            error(
                                    entry,
                                    "Invalid reference to account '"
                                            + account
                                            + "' before its opening on "
                                            + openDate));
                } else if (!(entry instanceof CloseEntry) && isAfterClose(closed.get(account), entry)) {
                    messages.add(error(entry, "Invalid reference to inactive account '" + account + "'"));
                }
            }
        }
        return messages;
    }

    private static boolean isAfterClose(LocalDate closeDate, Entry entry) {
        return closeDate != null && entry.getDate().isAfter(closeDate);
    }

    private static Diagnostic error(Entry entry, String message) {
        return new Diagnostic(Diagnostic.Level.ERROR, entry.getMeta().toPosition(), message, entry);
    }
}
