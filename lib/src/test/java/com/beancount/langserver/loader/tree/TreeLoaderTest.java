package com.beancount.langserver.loader.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.beancount.langserver.ledger.Amount;
import com.beancount.langserver.ledger.BalanceEntry;
import com.beancount.langserver.ledger.CostSpec;
import com.beancount.langserver.ledger.CustomEntry;
import com.beancount.langserver.ledger.DocumentEntry;
import com.beancount.langserver.ledger.Entry;
import com.beancount.langserver.ledger.OpenEntry;
import com.beancount.langserver.ledger.Posting;
import com.beancount.langserver.ledger.TransactionEntry;
import com.beancount.langserver.loader.BookingResult;
import com.beancount.langserver.loader.Diagnostic;
import com.beancount.langserver.loader.LedgerGrammar;
import com.beancount.langserver.loader.LedgerOptions;
import com.beancount.langserver.loader.LoadResult;
import com.beancount.langserver.loader.LoaderException;
import com.beancount.langserver.testing.LedgerFixtures;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class TreeLoaderTest {

    /** Loader whose booking step passes entries through without validation. */
    private static TreeLoader plainLoader() {
        return new TreeLoader(
                new LedgerGrammar(),
                new NodeDispatcher(),
                (entries, options, displayContext) -> new BookingResult(entries, List.of()));
    }

    @Test
    void buildsTransactionWithPostingsAndMetadata() {
        LoadResult result =
                plainLoader()
                        .loadString(
                                LedgerFixtures.lines(
                                        "option \"title\" \"Test Ledger\"",
                                        "option \"operating_currency\" \"USD\"",
                                        "2024-01-01 open Assets:Cash USD,EUR",
                                        "2024-01-02 * \"Cafe\" \"Coffee\" #breakfast ^receipt-1",
                                        "  project: \"Alpha\"",
                                        "  Expenses:Coffee  5.50 USD",
                                        "    category: \"food\"",
                                        "  Assets:Cash"));

        assertTrue(result.getDiagnostics().isEmpty(), result.getDiagnostics().toString());
        assertEquals(2, result.getEntries().size());

        OpenEntry open = assertInstanceOf(OpenEntry.class, result.getEntries().get(0));
        assertEquals(List.of("USD", "EUR"), open.getCurrencies());

        TransactionEntry txn = assertInstanceOf(TransactionEntry.class, result.getEntries().get(1));
        assertEquals(LocalDate.of(2024, 1, 2), txn.getDate());
        assertEquals("*", txn.getFlag());
        assertEquals("Cafe", txn.getPayee());
        assertEquals("Coffee", txn.getNarration());
        assertEquals(Set.of("breakfast"), txn.getTags());
        assertEquals(Set.of("receipt-1"), txn.getLinks());
        assertEquals("<string>", txn.getMeta().getFilename());
        assertEquals(4, txn.getMeta().getLineno());
        assertEquals(Map.of("project", "Alpha"), txn.getMeta().getValues());

        List<Posting> postings = txn.getPostings();
        assertEquals(2, postings.size());
        assertEquals("Expenses:Coffee", postings.get(0).getAccount());
        assertEquals(new Amount(new BigDecimal("5.50"), "USD"), postings.get(0).getUnits());
        assertEquals(Map.of("category", "food"), postings.get(0).getMeta());
        assertNull(postings.get(1).getUnits());

        LedgerOptions options = result.getOptions();
        assertEquals("Test Ledger", options.getTitle());
        assertEquals(List.of("USD"), options.getOperatingCurrencies());
        assertEquals(2, options.getDisplayContext().getPrecision("USD", 0));
    }

    @Test
    void narrationOnlyTransactionAndTxnKeyword() {
        LoadResult result =
                plainLoader()
                        .loadString(
                                LedgerFixtures.lines(
                                        "2024-01-02 txn \"Rent\"",
                                        "  Expenses:Rent 1,200.00 USD",
                                        "  Assets:Bank"));

        TransactionEntry txn = assertInstanceOf(TransactionEntry.class, result.getEntries().get(0));
        assertEquals("*", txn.getFlag());
        assertNull(txn.getPayee());
        assertEquals("Rent", txn.getNarration());
        assertEquals(
                new Amount(new BigDecimal("1200.00"), "USD"), txn.getPostings().get(0).getUnits());
    }

    @Test
    void costAndTotalPriceAreResolved() {
        LoadResult result =
                plainLoader()
                        .loadString(
                                LedgerFixtures.lines(
                                        "2024-01-02 * \"Buy\"",
                                        "  Assets:Stock 10 HOOL {50.00 USD, 2024-01-01, \"lot1\"}",
                                        "  Assets:Other 10 HOOL @@ 500 USD",
                                        "  Assets:Cash"));

        TransactionEntry txn = assertInstanceOf(TransactionEntry.class, result.getEntries().get(0));
        Posting withCost = txn.getPostings().get(0);
        assertEquals(
                new CostSpec(
                        new BigDecimal("50.00"), null, "USD", LocalDate.of(2024, 1, 1), "lot1", false),
                withCost.getCost());
        Posting withPrice = txn.getPostings().get(1);
        assertEquals(new Amount(new BigDecimal("50"), "USD"), withPrice.getPrice());
    }

    @Test
    void directivesCarryTheirFields() {
        LoadResult result =
                plainLoader()
                        .loadString(
                                LedgerFixtures.lines(
                                        "2024-01-01 balance Assets:Cash 10.00 ~ 0.01 USD",
                                        "2024-01-01 document Assets:Cash \"/docs/receipt.pdf\" #tax",
                                        "2024-01-01 custom \"budget\" Expenses:Food 100 USD TRUE"));

        BalanceEntry balance = assertInstanceOf(BalanceEntry.class, result.getEntries().get(0));
        assertEquals(new Amount(new BigDecimal("10.00"), "USD"), balance.getAmount());
        assertEquals(0, new BigDecimal("0.01").compareTo(balance.getTolerance()));

        DocumentEntry document = assertInstanceOf(DocumentEntry.class, result.getEntries().get(2));
        assertEquals("/docs/receipt.pdf", document.getFilename());
        assertEquals(Set.of("tax"), document.getTags());

        CustomEntry custom = assertInstanceOf(CustomEntry.class, result.getEntries().get(1));
        assertEquals("budget", custom.getCustomType());
        assertEquals(
                List.of("Expenses:Food", new Amount(new BigDecimal("100"), "USD"), Boolean.TRUE),
                custom.getCustomValues());
    }

    @Test
    void pushtagWithMismatchedPoptagKeepsEntryAndReportsLeftover() {
        LoadResult result =
                plainLoader()
                        .loadString(
                                LedgerFixtures.lines(
                                        "pushtag #trip",
                                        "2024-03-01 * \"Dinner\"",
                                        "  Expenses:Food 20 USD",
                                        "  Assets:Cash",
                                        "poptag #other"));

        assertEquals(1, result.getEntries().size());
        TransactionEntry txn = assertInstanceOf(TransactionEntry.class, result.getEntries().get(0));
        assertEquals(Set.of("trip"), txn.getTags());

        List<Diagnostic> unbalanced =
                result.getDiagnostics().stream()
                        .filter(d -> d.getMessage().startsWith("Unbalanced pushed tag"))
                        .toList();
        assertEquals(1, unbalanced.size());
        assertEquals("Unbalanced pushed tag: 'trip'", unbalanced.get(0).getMessage());
        assertTrue(
                result.getDiagnostics().stream()
                        .anyMatch(d -> d.getMessage().equals("Attempting to pop absent tag: 'other'")));
    }

    @Test
    void pushmetaAppliesUntilPopped() {
        LoadResult result =
                plainLoader()
                        .loadString(
                                LedgerFixtures.lines(
                                        "pushmeta location: \"Berlin\"",
                                        "2024-01-01 open Assets:Cash",
                                        "2024-01-02 open Assets:Bank",
                                        "  location: \"Paris\"",
                                        "popmeta location:",
                                        "2024-01-03 open Assets:Card"));

        assertTrue(result.getDiagnostics().isEmpty(), result.getDiagnostics().toString());
        List<Entry> entries = result.getEntries();
        assertEquals("Berlin", entries.get(0).getMeta().get("location"));
        assertEquals("Paris", entries.get(1).getMeta().get("location"));
        assertTrue(entries.get(2).getMeta().getValues().isEmpty());
    }

    @Test
    void leftoverMetadataIsReportedAtFinalize() {
        LoadResult result =
                plainLoader()
                        .loadString(
                                LedgerFixtures.lines(
                                        "pushmeta trip: \"summer\"", "2024-01-01 open Assets:Cash"));

        assertEquals(1, result.getDiagnostics().size());
        assertEquals(
                "Unbalanced metadata key 'trip'; leftover metadata '[summer]'",
                result.getDiagnostics().get(0).getMessage());
    }

    @Test
    void syntaxErrorsAreRecordedAndWalkContinues() {
        LoadResult result =
                plainLoader()
                        .loadString(
                                LedgerFixtures.lines(
                                        "2024-01-01 open Assets:Cash",
                                        "2024-01-02 open",
                                        "2024-02-30 open Assets:Card",
                                        "2024-01-03 open Assets:Bank"));

        assertEquals(2, result.getEntries().size());
        assertEquals(2, result.getDiagnostics().size());
        Diagnostic missingAccount = result.getDiagnostics().get(0);
        assertEquals(Diagnostic.Level.ERROR, missingAccount.getLevel());
        assertEquals("Syntax error:\n2024-01-02 open", missingAccount.getMessage());
        assertEquals(2, missingAccount.getSource().getLine());
        assertEquals(
                "Syntax error:\n2024-02-30 open Assets:Card\nInvalid date: 2024-02-30",
                result.getDiagnostics().get(1).getMessage());
    }

    @Test
    void brokenTransactionHeaderIsOneDiagnostic() {
        LoadResult result =
                plainLoader()
                        .loadString(
                                LedgerFixtures.lines(
                                        "2024-01-01 open Assets:Cash",
                                        "2024-01-02 * \"Lunch\" oops",
                                        "  Expenses:Food  12.00 USD",
                                        "  Assets:Cash",
                                        "2024-01-03 open Assets:Bank"));

        assertEquals(2, result.getEntries().size());
        assertTrue(((OpenEntry) result.getEntries().get(0)).getCurrencies().isEmpty());
        assertEquals(1, result.getDiagnostics().size());
        Diagnostic broken = result.getDiagnostics().get(0);
        assertEquals(2, broken.getSource().getLine());
        assertEquals(
                "Syntax error:\n"
                        + "2024-01-02 * \"Lunch\" oops\n"
                        + "  Expenses:Food  12.00 USD\n"
                        + "  Assets:Cash",
                broken.getMessage());
    }

    @Test
    void entriesAreSortedByDateThenTypeThenDocumentOrder() {
        LoadResult result =
                plainLoader()
                        .loadString(
                                LedgerFixtures.lines(
                                        "2024-01-02 close Assets:Cash",
                                        "2024-01-02 note Assets:Cash \"second\"",
                                        "2024-01-02 balance Assets:Cash 0 USD",
                                        "2024-01-01 open Assets:Cash",
                                        "2024-01-02 note Assets:Cash \"third\"",
                                        "2024-01-02 open Assets:Bank"));

        List<String> types = result.getEntries().stream().map(Entry::getType).toList();
        assertEquals(List.of("open", "open", "balance", "note", "note", "close"), types);
        assertEquals(2, result.getEntries().get(3).getMeta().getLineno());
        assertEquals(5, result.getEntries().get(4).getMeta().getLineno());
    }

    @Test
    void displayPrecisionTracksMaximumObserved() {
        LoadResult result =
                plainLoader()
                        .loadString(
                                LedgerFixtures.lines(
                                        "2024-01-01 price EUR 10.5 USD", "2024-01-02 price EUR 10.25 USD"));

        assertEquals(2, result.getOptions().getDisplayContext().getPrecision("USD", 0));
    }

    @Test
    void optionsAndPluginsAreRecorded() {
        LoadResult result =
                plainLoader()
                        .loadString(
                                LedgerFixtures.lines(
                                        "option \"display_precision\" \"USD:0.001\"",
                                        "option \"render_commas\" \"TRUE\"",
                                        "option \"booking_method\" \"FIFO\"",
                                        "option \"operating_currency\" \"USD\"",
                                        "option \"operating_currency\" \"EUR\"",
                                        "plugin \"beancount.plugins.auto_accounts\"",
                                        "plugin \"beancount.plugins.check_commodity\" \"strict\""));

        LedgerOptions options = result.getOptions();
        assertEquals(3, options.getDisplayContext().getPrecision("USD", 0));
        assertTrue(options.getDisplayContext().isRenderCommas());
        assertEquals("FIFO", options.getOption("booking_method"));
        assertEquals(List.of("USD", "EUR"), options.getOperatingCurrencies());
        assertEquals(List.of("USD", "EUR"), options.getOptionValues("operating_currency"));
        assertTrue(options.getRawOptions().containsKey("render_commas"));
        assertEquals(
                List.of(
                        new LedgerOptions.Plugin("beancount.plugins.auto_accounts", null),
                        new LedgerOptions.Plugin("beancount.plugins.check_commodity", "strict")),
                options.getPlugins());
        assertTrue(result.getEntries().isEmpty());
    }

    @Test
    void loadingTwiceYieldsIdenticalResults() {
        String ledger =
                LedgerFixtures.lines(
                        "pushtag #trip",
                        "2024-01-01 open Assets:Cash",
                        "2024-01-02 * \"Dinner\"",
                        "  Expenses:Food 20.5 USD",
                        "  Assets:Cash",
                        "garbage line",
                        "include \"other.bean\"");
        TreeLoader loader = new TreeLoader();

        LoadResult first = loader.loadString(ledger);
        LoadResult second = loader.loadString(ledger);

        assertEquals(first.getEntries(), second.getEntries());
        assertEquals(first.getDiagnostics(), second.getDiagnostics());
    }

    @Test
    void includeFromStringIsReported() {
        LoadResult result =
                plainLoader()
                        .loadString(
                                LedgerFixtures.lines(
                                        "include \"other.bean\"", "2024-01-01 open Assets:Cash"));

        assertEquals(1, result.getEntries().size());
        assertEquals(1, result.getDiagnostics().size());
        assertEquals(
                "Cannot resolve include when parsing a string",
                result.getDiagnostics().get(0).getMessage());
        assertEquals(1, result.getDiagnostics().get(0).getSource().getLine());
    }

    @Test
    void defaultBookingAppendsValidationDiagnostics() {
        LoadResult result =
                new TreeLoader()
                        .loadString(
                                LedgerFixtures.lines(
                                        "2024-01-01 open Assets:Cash",
                                        "2024-01-02 * \"Dinner\"",
                                        "  Expenses:Food 20 USD",
                                        "  Assets:Cash"));

        assertEquals(
                List.of("Invalid reference to unknown account 'Expenses:Food'"),
                result.getDiagnostics().stream().map(Diagnostic::getMessage).toList());
    }

    @Test
    void missingRootFileIsALoaderException() {
        assertThrows(
                LoaderException.class,
                () -> plainLoader().load(Path.of("does-not-exist", "main.bean")));
    }
}
