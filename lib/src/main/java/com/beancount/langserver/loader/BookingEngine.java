package com.beancount.langserver.loader;

import com.beancount.langserver.ledger.Entry;
import com.beancount.langserver.loader.display.DisplayContext;
import java.util.List;

/** Accounting collaborator run over the sorted entries of a tree load. */
public interface BookingEngine {

    BookingResult book(List<Entry> entries, LedgerOptions options, DisplayContext displayContext);
}
