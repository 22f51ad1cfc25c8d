package com.beancount.langserver.loader.validation;

import com.beancount.langserver.ledger.Entry;
import com.beancount.langserver.loader.Diagnostic;
import com.beancount.langserver.loader.LedgerOptions;
import java.util.List;

/**
 * A single validation rule that inspects the sorted entries of a ledger and emits diagnostics.
 * Rules are expected to be deterministic and preserve the order they discover problems in.
 */
public interface ValidationRule {

    /**
     * Evaluate this rule against the given entries.
     *
     * @param entries Entries in canonical order.
     * @param options Options gathered while loading.
     * @return A list of diagnostics, possibly empty. Implementations must not return null.
     */
    List<Diagnostic> validate(List<Entry> entries, LedgerOptions options);
}
