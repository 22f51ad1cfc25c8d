package com.beancount.langserver.loader;

import com.beancount.langserver.ledger.Entry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Entries, diagnostics and options produced by loading one root ledger. */
public final class LoadResult {
    private final List<Entry> entries;
    private final List<Diagnostic> diagnostics;
    private final LedgerOptions options;

    public LoadResult(List<Entry> entries, List<Diagnostic> diagnostics, LedgerOptions options) {
        this.entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
        this.diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
        this.options = Objects.requireNonNull(options, "options");
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public LedgerOptions getOptions() {
        return options;
    }

    public LoadResult withDiagnostics(List<Diagnostic> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        List<Diagnostic> combined = new ArrayList<>(diagnostics);
        combined.addAll(extra);
        return new LoadResult(entries, combined, options);
    }
}
