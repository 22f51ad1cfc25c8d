package com.beancount.langserver.tools;

import com.beancount.langserver.Version;
import com.beancount.langserver.loader.Diagnostic;
import com.beancount.langserver.loader.LoadResult;
import com.beancount.langserver.loader.LoaderException;
import com.beancount.langserver.loader.LoaderSettings;
import com.beancount.langserver.loader.reference.LedgerParser;
import com.beancount.langserver.loader.reference.ParserMode;
import com.beancount.langserver.loader.tree.TreeLoader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads a ledger through the tree walker and prints its diagnostics as {@code file:line: message},
 * so the loader can be exercised by hand without an editor.
 */
public final class CheckCli {

    private CheckCli() {}

    public static void main(String[] args) throws Exception {
        if (args.length != 1) {
            System.err.println("Usage: CheckCli <ledger.beancount>");
            System.exit(1);
        }
        Path ledger = Path.of(args[0]).toAbsolutePath().normalize();
        if (!Files.exists(ledger)) {
            throw new IllegalStateException("Ledger file not found: " + ledger);
        }
        LoaderSettings settings = LoaderSettings.fromEnvironment();
        if (settings.getMode() != ParserMode.TREE) {
            System.err.println(
                    "No reference engine available from the command line; using tree mode");
        }
        int errors = check(ledger);
        System.exit(errors == 0 ? 0 : 2);
    }

    static int check(Path ledger) throws LoaderException {
        LedgerParser parser = new LedgerParser(ParserMode.TREE, null, new TreeLoader());
        LoadResult result = parser.open(ledger);
        int errors = 0;
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            System.out.println(diagnostic);
            if (diagnostic.getLevel() == Diagnostic.Level.ERROR) {
                errors++;
            }
        }
        System.out.println(
                "["
                        + Version.RUNTIME
                        + "] "
                        + result.getEntries().size()
                        + " entries, "
                        + result.getDiagnostics().size()
                        + " diagnostics in "
                        + result.getOptions().getIncludes().size()
                        + " files");
        return errors;
    }
}
