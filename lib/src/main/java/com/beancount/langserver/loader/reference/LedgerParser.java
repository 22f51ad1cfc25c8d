package com.beancount.langserver.loader.reference;

import com.beancount.langserver.ledger.SourcePosition;
import com.beancount.langserver.loader.Diagnostic;
import com.beancount.langserver.loader.LedgerOptions;
import com.beancount.langserver.loader.LoadResult;
import com.beancount.langserver.loader.LoaderException;
import com.beancount.langserver.loader.tree.TreeLoader;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Editor-facing entry point. Chooses between the reference engine and the tree walker according to
 * the configured {@link ParserMode}; encrypted ledgers always go to the reference engine.
 */
public final class LedgerParser {
    private static final Logger LOG = Logger.getLogger(LedgerParser.class.getName());

    private final ParserMode mode;
    private final ReferenceEngine referenceEngine;
    private final TreeLoader treeLoader;
    private final EntryReconciler reconciler = new EntryReconciler();

    /**
     * @param referenceEngine may be {@code null} only in {@link ParserMode#TREE}
     */
    public LedgerParser(ParserMode mode, ReferenceEngine referenceEngine, TreeLoader treeLoader) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.referenceEngine = referenceEngine;
        this.treeLoader = Objects.requireNonNull(treeLoader, "treeLoader");
        if (referenceEngine == null && mode != ParserMode.TREE) {
            throw new IllegalArgumentException("Parser mode " + mode + " needs a reference engine");
        }
    }

    public ParserMode getMode() {
        return mode;
    }

    /** Full load when a document is opened; in verify mode both engines run and are compared. */
    public LoadResult open(Path root) throws LoaderException {
        if (EncryptedLedgers.isEncrypted(root) || mode == ParserMode.REFERENCE) {
            return loadReference(root);
        }
        if (mode == ParserMode.TREE) {
            return treeLoader.load(root);
        }
        LoadResult reference = loadReference(root);
        LoadResult tree = treeLoader.load(root);
        List<Diagnostic> mismatches = reconciler.reconcile(reference.getEntries(), tree.getEntries());
        if (!mismatches.isEmpty()) {
            LOG.warning(() -> mismatches.size() + " entries differ between engines for " + root);
        }
        return tree.withDiagnostics(mismatches);
    }

    /** Reload after a save; never reconciles. */
    public LoadResult save(Path root) throws LoaderException {
        if (EncryptedLedgers.isEncrypted(root) || mode == ParserMode.REFERENCE) {
            return loadReference(root);
        }
        return treeLoader.load(root);
    }

    private LoadResult loadReference(Path root) throws LoaderException {
        if (referenceEngine == null) {
            Diagnostic diagnostic =
                    Diagnostic.error(
                            new SourcePosition(root.toString(), 0),
                            "Encrypted ledger can only be loaded by a reference engine");
            return new LoadResult(List.of(), List.of(diagnostic), new LedgerOptions());
        }
        return referenceEngine.load(root);
    }
}
