package com.beancount.langserver.loader;

import com.beancount.langserver.loader.grammar.BeancountLexer;
import com.beancount.langserver.loader.grammar.BeancountParser;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DiagnosticErrorListener;

/**
 * Handle on the generated Beancount grammar. A fresh lexer and parser are built for every call, so
 * one instance may be shared between threads.
 */
public final class LedgerGrammar {
    private static final Logger LOG = Logger.getLogger(LedgerGrammar.class.getName());

    /** A parsed file: the tree root plus whatever the error listener collected. */
    public static final class ParsedSource {
        private final BeancountParser.LedgerContext tree;
        private final List<CollectingErrorListener.GrammarError> grammarErrors;

        ParsedSource(
                BeancountParser.LedgerContext tree,
                List<CollectingErrorListener.GrammarError> grammarErrors) {
            this.tree = tree;
            this.grammarErrors = grammarErrors;
        }

        public BeancountParser.LedgerContext getTree() {
            return tree;
        }

        public List<CollectingErrorListener.GrammarError> getGrammarErrors() {
            return grammarErrors;
        }
    }

    public ParsedSource parse(byte[] source, String sourceName) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sourceName, "sourceName");
        long started = System.nanoTime();
        CharStream input =
                CharStreams.fromString(new String(source, StandardCharsets.UTF_8), sourceName);
        CollectingErrorListener errors = new CollectingErrorListener();

        BeancountLexer lexer = new BeancountLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        if (DebugFlags.isTokenDebugEnabled()) {
            tokens.fill();
            DebugFlags.logTokens(tokens, lexer, sourceName);
            tokens.seek(0);
        }

        BeancountParser parser = new BeancountParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errors);
        if (DebugFlags.isParserTraceEnabled()) {
            parser.addErrorListener(new DiagnosticErrorListener());
        }
        BeancountParser.LedgerContext tree = parser.ledger();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(
                    String.format(
                            "Parsed %s in %.3f ms (%d grammar errors)",
                            sourceName,
                            (System.nanoTime() - started) / 1_000_000.0,
                            errors.getErrors().size()));
        }
        return new ParsedSource(tree, errors.getErrors());
    }
}
