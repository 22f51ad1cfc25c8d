package com.beancount.langserver.loader.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.beancount.langserver.ledger.BalanceEntry;
import com.beancount.langserver.ledger.Entry;
import com.beancount.langserver.ledger.OpenEntry;
import com.beancount.langserver.ledger.TransactionEntry;
import com.beancount.langserver.loader.BookingResult;
import com.beancount.langserver.loader.Diagnostic;
import com.beancount.langserver.loader.LedgerGrammar;
import com.beancount.langserver.loader.LoadResult;
import com.beancount.langserver.testing.LedgerFixtures;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class IncludeResolverTest {

    private static TreeLoader plainLoader() {
        return new TreeLoader(
                new LedgerGrammar(),
                new NodeDispatcher(),
                (entries, options, displayContext) -> new BookingResult(entries, List.of()));
    }

    @Test
    void includeCycleTerminatesWithOneDuplicateDiagnostic() throws Exception {
        Path dir = LedgerFixtures.tempDir("beancount-cycle");
        Path a = LedgerFixtures.write(dir, "a.bean", "include \"b.bean\"", "2024-01-01 open Assets:A");
        LedgerFixtures.write(dir, "b.bean", "include \"a.bean\"", "2024-01-01 open Assets:B");

        LoadResult result = plainLoader().load(a);

        assertEquals(2, result.getEntries().size());
        List<String> messages = messages(result);
        assertEquals(List.of("Duplicate included file: " + a), messages);
        Diagnostic duplicate = result.getDiagnostics().get(0);
        assertEquals(dir.resolve("b.bean").toString(), duplicate.getSource().getFilename());
        assertEquals(1, duplicate.getSource().getLine());
    }

    @Test
    void selfIncludeIsReportedOnce() throws Exception {
        Path dir = LedgerFixtures.tempDir("beancount-self");
        Path root =
                LedgerFixtures.write(dir, "main.bean", "include \"main.bean\"", "2024-01-01 open Assets:A");

        LoadResult result = plainLoader().load(root);

        assertEquals(1, result.getEntries().size());
        assertEquals(List.of("Duplicate included file: " + root), messages(result));
    }

    @Test
    void globMatchesAreWalkedInLexicographicOrder() throws Exception {
        Path dir = LedgerFixtures.tempDir("beancount-order");
        LedgerFixtures.write(dir, "b.ledger", "2024-01-01 open Assets:B");
        LedgerFixtures.write(dir, "a.ledger", "2024-01-01 open Assets:A");
        Path root = LedgerFixtures.write(dir, "root.bean", "include \"*.ledger\"");

        LoadResult result = plainLoader().load(root);

        assertTrue(result.getDiagnostics().isEmpty(), result.getDiagnostics().toString());
        assertEquals(List.of("Assets:A", "Assets:B"), openAccounts(result.getEntries()));
    }

    @Test
    void unmatchedGlobContributesNothingAndWalkContinues() throws Exception {
        Path dir = LedgerFixtures.tempDir("beancount-missing");
        Path root =
                LedgerFixtures.write(
                        dir,
                        "main.bean",
                        "2024-01-01 open Assets:A",
                        "include \"nothing/*.bean\"",
                        "2024-01-02 open Assets:B");

        LoadResult result = plainLoader().load(root);

        assertEquals(List.of("Assets:A", "Assets:B"), openAccounts(result.getEntries()));
        assertEquals(
                List.of("Include glob did not match any files: nothing/*.bean"), messages(result));
        assertEquals(2, result.getDiagnostics().get(0).getSource().getLine());
    }

    @Test
    void doubleStarAlsoMatchesFilesAtTheTopLevel() throws Exception {
        Path dir = LedgerFixtures.tempDir("beancount-doublestar");
        Path root = LedgerFixtures.write(dir, "main.bean", "include \"books/**/*.bean\"");
        LedgerFixtures.write(dir, "books/a.bean", "2024-01-01 open Assets:A");
        LedgerFixtures.write(dir, "books/sub/b.bean", "2024-01-01 open Assets:B");

        LoadResult result = plainLoader().load(root);

        assertTrue(result.getDiagnostics().isEmpty(), messages(result).toString());
        assertEquals(List.of("Assets:A", "Assets:B"), openAccounts(result.getEntries()));
    }

    @Test
    void unreadableDirectoryDoesNotAbortExpansion() throws Exception {
        Path dir = LedgerFixtures.tempDir("beancount-locked");
        Path root = LedgerFixtures.write(dir, "main.bean", "include \"books/*.bean\"");
        LedgerFixtures.write(dir, "books/a.bean", "2024-01-01 open Assets:A");
        Path locked = dir.resolve("books/locked");
        LedgerFixtures.write(dir, "books/locked/hidden.bean", "2024-01-01 open Assets:Hidden");
        Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        try {
            LoadResult result = plainLoader().load(root);

            assertTrue(result.getDiagnostics().isEmpty(), messages(result).toString());
            assertEquals(List.of("Assets:A"), openAccounts(result.getEntries()));
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    @Test
    void recursiveGlobSkipsUnreadableDirectories() throws Exception {
        Path dir = LedgerFixtures.tempDir("beancount-locked-recursive");
        LedgerFixtures.write(dir, "a.bean", "2024-01-01 open Assets:A");
        LedgerFixtures.write(dir, "open/b.bean", "2024-01-01 open Assets:B");
        Path locked = dir.resolve("locked");
        LedgerFixtures.write(dir, "locked/c.bean", "2024-01-01 open Assets:C");
        Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        try {
            List<Path> matches = IncludeResolver.expand(dir, "**/*.bean");

            assertTrue(matches.contains(dir.resolve("a.bean")), matches.toString());
            assertTrue(matches.contains(dir.resolve("open/b.bean")), matches.toString());
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    @Test
    void plainPathIncludeOfMissingFileIsReported() throws Exception {
        Path dir = LedgerFixtures.tempDir("beancount-plain");
        Path root = LedgerFixtures.write(dir, "main.bean", "include \"absent.bean\"");

        LoadResult result = plainLoader().load(root);

        assertTrue(result.getEntries().isEmpty());
        assertEquals(List.of("Include glob did not match any files: absent.bean"), messages(result));
    }

    @Test
    void subdirectoryGlobSplicesBalancesWithTheirFilenames() throws Exception {
        Path dir = LedgerFixtures.tempDir("beancount-sub");
        Path x = LedgerFixtures.write(dir, "sub/x.bean", "2024-02-01 balance Assets:Cash 10 USD");
        Path y = LedgerFixtures.write(dir, "sub/y.bean", "2024-02-01 balance Assets:Bank 20.50 USD");
        Path root =
                LedgerFixtures.write(
                        dir,
                        "main.bean",
                        "2024-01-01 open Assets:Cash",
                        "include \"sub/*.bean\"",
                        "2024-03-01 close Assets:Cash");

        LoadResult result = plainLoader().load(root);

        assertTrue(result.getDiagnostics().isEmpty(), result.getDiagnostics().toString());
        List<Entry> entries = result.getEntries();
        assertEquals(
                List.of("open", "balance", "balance", "close"),
                entries.stream().map(Entry::getType).toList());
        BalanceEntry first = (BalanceEntry) entries.get(1);
        BalanceEntry second = (BalanceEntry) entries.get(2);
        assertEquals("Assets:Cash", first.getAccount());
        assertEquals(x.toString(), first.getMeta().getFilename());
        assertEquals(1, first.getMeta().getLineno());
        assertEquals("Assets:Bank", second.getAccount());
        assertEquals(y.toString(), second.getMeta().getFilename());

        assertEquals(
                List.of(root.toString(), x.toString(), y.toString()), result.getOptions().getIncludes());
        assertNotNull(result.getOptions().getInputHash());
        assertEquals(64, result.getOptions().getInputHash().length());
        assertEquals(2, result.getOptions().getDisplayContext().getPrecision("USD", 0));
    }

    @Test
    void includedFileStateSharesTagStack() throws Exception {
        Path dir = LedgerFixtures.tempDir("beancount-tags");
        LedgerFixtures.write(
                dir,
                "trip.bean",
                "2024-05-01 * \"Hotel\"",
                "  Expenses:Travel 100 USD",
                "  Assets:Cash");
        Path root =
                LedgerFixtures.write(
                        dir, "main.bean", "pushtag #vacation", "include \"trip.bean\"", "poptag #vacation");

        LoadResult result = plainLoader().load(root);

        assertTrue(result.getDiagnostics().isEmpty(), result.getDiagnostics().toString());
        TransactionEntry txn = (TransactionEntry) result.getEntries().get(0);
        assertEquals(Set.of("vacation"), txn.getTags());
    }

    private static List<String> messages(LoadResult result) {
        return result.getDiagnostics().stream().map(Diagnostic::getMessage).toList();
    }

    private static List<String> openAccounts(List<Entry> entries) {
        return entries.stream()
                .filter(OpenEntry.class::isInstance)
                .map(entry -> ((OpenEntry) entry).getAccount())
                .toList();
    }
}
