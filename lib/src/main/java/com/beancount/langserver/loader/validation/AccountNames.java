package com.beancount.langserver.loader.validation;

import com.beancount.langserver.ledger.BalanceEntry;
import com.beancount.langserver.ledger.CloseEntry;
import com.beancount.langserver.ledger.DocumentEntry;
import com.beancount.langserver.ledger.Entry;
import com.beancount.langserver.ledger.NoteEntry;
import com.beancount.langserver.ledger.OpenEntry;
import com.beancount.langserver.ledger.PadEntry;
import com.beancount.langserver.ledger.Posting;
import com.beancount.langserver.ledger.TransactionEntry;
import java.util.ArrayList;
import java.util.List;

final class AccountNames {

    private AccountNames() {}

    /** Accounts an entry refers to, in source order. */
    static List<String> referencedBy(Entry entry) {
        List<String> accounts = new ArrayList<>();
        if (entry instanceof OpenEntry open) {
            accounts.add(open.getAccount());
        } else if (entry instanceof CloseEntry close) {
            accounts.add(close.getAccount());
        } else if (entry instanceof PadEntry pad) {
            accounts.add(pad.getAccount());
            accounts.add(pad.getSourceAccount());
        } else if (entry instanceof BalanceEntry balance) {
            accounts.add(balance.getAccount());
        } else if (entry instanceof NoteEntry note) {
            accounts.add(note.getAccount());
        } else if (entry instanceof DocumentEntry document) {
            accounts.add(document.getAccount());
        } else if (entry instanceof TransactionEntry transaction) {
            for (Posting posting : transaction.getPostings()) {
                accounts.add(posting.getAccount());
            }
        }
        return accounts;
    }
}
