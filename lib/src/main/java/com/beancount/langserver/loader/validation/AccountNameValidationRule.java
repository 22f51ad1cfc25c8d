package com.beancount.langserver.loader.validation;

import com.beancount.langserver.ledger.Entry;
import com.beancount.langserver.loader.Diagnostic;
import com.beancount.langserver.loader.LedgerOptions;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks account component syntax and that the root is one of the five account types, honouring
 * {@code option "name_assets"} and friends.
 */
final class AccountNameValidationRule implements ValidationRule {

    private static final String ACC_COMP_TYPE_RE = "\\p{Lu}[\\p{L}\\p{Nd}-]*";
    private static final String ACC_COMP_NAME_RE = "[\\p{Lu}\\p{Nd}][\\p{L}\\p{Nd}-]*";
    private static final Pattern ACCOUNT_PATTERN =
            Pattern.compile("(?:" + ACC_COMP_TYPE_RE + ")(?::" + ACC_COMP_NAME_RE + ")+");

    @Override
    public List<Diagnostic> validate(List<Entry> entries, LedgerOptions options) {
        Set<String> roots = rootNames(options);
        List<Diagnostic> messages = new ArrayList<>();
        for (Entry entry : entries) {
            for (String account : AccountNames.referencedBy(entry)) {
                validateAccount(account, roots, entry, messages);
            }
        }
        return messages;
    }

    private static Set<String> rootNames(LedgerOptions options) {
        Set<String> roots = new LinkedHashSet<>();
        roots.add(optionOrDefault(options, "name_assets", "Assets"));
        roots.add(optionOrDefault(options, "name_liabilities", "Liabilities"));
        roots.add(optionOrDefault(options, "name_equity", "Equity"));
        roots.add(optionOrDefault(options, "name_income", "Income"));
        roots.add(optionOrDefault(options, "name_expenses", "Expenses"));
        return roots;
    }

    private static String optionOrDefault(LedgerOptions options, String name, String fallback) {
        String value = options.getOption(name);
        return value == null || value.isBlank() ? fallback : value;
    }

    private static void validateAccount(
            String account, Set<String> roots, Entry entry, List<Diagnostic> out) {
        if (account == null || account.isBlank()) {
            return;
        }
        int colon = account.indexOf(':');
        String root = colon < 0 ? account : account.substring(0, colon);
        if (ACCOUNT_PATTERN.matcher(account).matches() && roots.contains(root)) {
            return;
        }
        out.add(
                new Diagnostic(
                        Diagnostic.Level.ERROR,
                        entry.getMeta().toPosition(),
                        "Invalid account name: " + account,
                        entry));
    }
}
