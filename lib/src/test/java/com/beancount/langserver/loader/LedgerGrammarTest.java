package com.beancount.langserver.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.beancount.langserver.loader.grammar.BeancountLexer;
import com.beancount.langserver.loader.grammar.BeancountParser;
import com.beancount.langserver.testing.LedgerFixtures;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.junit.jupiter.api.Test;

class LedgerGrammarTest {

    @Test
    void tokenDumpIsCapturedWhenEnabled() {
        System.setProperty("beancount.langserver.debugTokens", "true");
        try {
            DebugFlags.drainCapturedTokens();
            new LedgerGrammar()
                    .parse("option \"title\" \"Home\"\n".getBytes(StandardCharsets.UTF_8), "<test>");
            List<String> captured = DebugFlags.drainCapturedTokens();
            assertEquals(5, captured.size());
            assertTrue(captured.get(0).startsWith("OPTION"), captured.get(0));
        } finally {
            System.clearProperty("beancount.langserver.debugTokens");
        }
    }

    @Test
    void includeDirectiveProducesIncludeAndStringTokens() {
        assertEquals(
                List.of("INCLUDE", "STRING", "NEWLINE", "EOF"),
                symbolicTokens("include \"path/to/file.bean\"\n"));
    }

    @Test
    void postingLineStartsWithIndent() {
        assertEquals(
                List.of("INDENT", "ACCOUNT", "NUMBER", "CURRENCY", "NEWLINE", "EOF"),
                symbolicTokens("  Expenses:Coffee 5.50 USD\n"));
    }

    @Test
    void commentsStayOffTheDefaultChannel() {
        assertEquals(
                List.of("DATE", "NOTE", "ACCOUNT", "STRING", "NEWLINE", "EOF"),
                symbolicTokens("2024-01-01 note Assets:Cash \"Memo\" ; trailing\n"));
    }

    @Test
    void malformedLineBecomesSingleErrorLine() {
        LedgerGrammar.ParsedSource parsed =
                parse(
                        LedgerFixtures.lines(
                                "2024-01-01 open Assets:Cash",
                                "this is not beancount",
                                "2024-01-02 close Assets:Cash"));

        List<BeancountParser.StatementContext> statements = parsed.getTree().statement();
        assertEquals(3, statements.size());
        assertNotNull(statements.get(0).openDirective());
        assertNotNull(statements.get(1).errorLine());
        assertNotNull(statements.get(2).closeDirective());
        assertTrue(parsed.getGrammarErrors().isEmpty(), () -> parsed.getGrammarErrors().toString());
    }

    @Test
    void lastLineWithoutNewlineStillParses() {
        LedgerGrammar.ParsedSource parsed = parse("2024-01-01 open Assets:Cash USD");

        assertEquals(1, parsed.getTree().statement().size());
        BeancountParser.OpenDirectiveContext open = parsed.getTree().statement(0).openDirective();
        assertNotNull(open);
        assertEquals("USD", open.currencyList().currency(0).getText());
    }

    @Test
    void transactionCollectsIndentedLines() {
        LedgerGrammar.ParsedSource parsed =
                parse(
                        LedgerFixtures.lines(
                                "2024-01-02 * \"Cafe\" \"Coffee\" #breakfast",
                                "  project: \"Alpha\"",
                                "  Expenses:Coffee 5 USD",
                                "  ; comment",
                                "  Assets:Cash",
                                "",
                                "2024-01-03 open Assets:Bank"));

        BeancountParser.TransactionContext transaction = parsed.getTree().statement(0).transaction();
        assertNotNull(transaction);
        assertEquals(4, transaction.transactionLine().size());
        assertNotNull(parsed.getTree().statement(1).blankLine());
        assertNotNull(parsed.getTree().statement(2).openDirective());
    }

    private static LedgerGrammar.ParsedSource parse(String text) {
        return new LedgerGrammar().parse(text.getBytes(StandardCharsets.UTF_8), "test");
    }

    private static List<String> symbolicTokens(String ledger) {
        BeancountLexer lexer = new BeancountLexer(CharStreams.fromString(ledger, "test"));
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        List<String> symbolic = new ArrayList<>();
        for (Token token : tokens.getTokens()) {
            if (token.getType() == Token.EOF) {
                symbolic.add("EOF");
            } else if (token.getChannel() == Token.DEFAULT_CHANNEL) {
                symbolic.add(lexer.getVocabulary().getSymbolicName(token.getType()));
            }
        }
        return symbolic;
    }
}
