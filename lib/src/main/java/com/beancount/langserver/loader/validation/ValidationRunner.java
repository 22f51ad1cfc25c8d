package com.beancount.langserver.loader.validation;

import com.beancount.langserver.ledger.Entry;
import com.beancount.langserver.loader.Diagnostic;
import com.beancount.langserver.loader.LedgerOptions;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Executes a list of validation rules and aggregates their diagnostics. */
public final class ValidationRunner {

    private final List<ValidationRule> rules;

    public ValidationRunner(List<ValidationRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    /** Convenience factory that wires in the default rule set. */
    public static ValidationRunner defaultRules() {
        return new ValidationRunner(
                List.of(new AccountNameValidationRule(), new AccountLifecycleValidationRule()));
    }

    /** @return All diagnostics produced by all rules, in rule order. */
    public List<Diagnostic> run(List<Entry> entries, LedgerOptions options) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ValidationRule rule : rules) {
            diagnostics.addAll(rule.validate(entries, options));
        }
        return diagnostics;
    }
}
