package com.beancount.langserver.loader.reference;

import com.beancount.langserver.ledger.Entry;
import com.beancount.langserver.loader.Diagnostic;
import java.util.ArrayList;
import java.util.List;

/**
 * Compares the entries of the reference engine and the tree walker position by position. Every
 * divergence becomes a warning; nothing here fails a load.
 */
public final class EntryReconciler {

    public List<Diagnostic> reconcile(List<Entry> referenceEntries, List<Entry> treeEntries) {
        List<Diagnostic> warnings = new ArrayList<>();
        int common = Math.min(referenceEntries.size(), treeEntries.size());
        for (int i = 0; i < common; i++) {
            Entry reference = referenceEntries.get(i);
            Entry tree = treeEntries.get(i);
            if (!reference.equals(tree)) {
                warnings.add(
                        new Diagnostic(
                                Diagnostic.Level.WARNING,
                                reference.getMeta().toPosition(),
                                "Mismatch:\n" + reference + "\n" + tree,
                                tree));
            }
        }
        if (referenceEntries.size() != treeEntries.size()) {
            Entry first =
                    referenceEntries.size() > common
                            ? referenceEntries.get(common)
                            : treeEntries.get(common);
            warnings.add(
                    new Diagnostic(
                            Diagnostic.Level.WARNING,
                            first.getMeta().toPosition(),
                            "Entry count mismatch: reference produced "
                                    + referenceEntries.size()
                                    + " entries, tree produced "
                                    + treeEntries.size(),
                            first));
        }
        return warnings;
    }
}
