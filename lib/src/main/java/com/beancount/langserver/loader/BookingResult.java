package com.beancount.langserver.loader;

import com.beancount.langserver.ledger.Entry;
import java.util.List;

public final class BookingResult {
    private final List<Entry> entries;
    private final List<Diagnostic> diagnostics;

    public BookingResult(List<Entry> entries, List<Diagnostic> diagnostics) {
        this.entries = List.copyOf(entries);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
