package com.beancount.langserver.loader.tree;

import com.beancount.langserver.ledger.Entry;
import com.beancount.langserver.loader.CollectingErrorListener.GrammarError;
import com.beancount.langserver.loader.LedgerGrammar;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;

/**
 * Walks the top-level nodes of one file in document order. Entries from included files are spliced
 * in at the position of their include directive, so the output follows a depth-first reading of the
 * ledger.
 */
public final class TreeWalker {
    private final NodeDispatcher dispatcher;
    private final IncludeResolver includeResolver;

    public TreeWalker(LedgerGrammar grammar, NodeDispatcher dispatcher) {
        this.dispatcher = dispatcher;
        this.includeResolver = new IncludeResolver(grammar, this);
    }

    /** Walks the top-level nodes of a parsed file. */
    public List<Entry> walk(
            LedgerGrammar.ParsedSource parsed, ParseState state, Path filename, SeenFiles seenFiles) {
        return walk(parsed.getTree().children, parsed.getGrammarErrors(), state, filename, seenFiles);
    }

    /**
     * @param siblings top-level nodes of the current file
     * @param grammarErrors errors the grammar reported for the current file
     * @param filename current file, {@code null} for an in-memory document
     */
    public List<Entry> walk(
            List<ParseTree> siblings,
            List<GrammarError> grammarErrors,
            ParseState state,
            Path filename,
            SeenFiles seenFiles) {
        List<Entry> entries = new ArrayList<>();
        if (siblings == null) {
            return entries;
        }
        int lastProblemLine = -1;
        for (ParseTree node : siblings) {
            HandlerOutcome outcome = dispatcher.dispatch(state, node);
            switch (outcome.getKind()) {
                case PRODUCED -> entries.add(outcome.getEntry());
                case SYNTAX_PROBLEM -> {
                    int line = ParseState.line(node);
                    if (line != lastProblemLine) {
                        state.recordError(
                                node,
                                syntaxMessage(state, node, outcome.getProblem(), grammarErrors));
                        lastProblemLine = line;
                    }
                }
                case INCLUDE_REQUEST ->
                        entries.addAll(
                                includeResolver.resolve(outcome.getInclude(), node, state, seenFiles));
                case SKIPPED -> {
                    // comments, blank lines and state-only directives
                }
            }
        }
        return entries;
    }

    private static String syntaxMessage(
            ParseState state, ParseTree node, String problem, List<GrammarError> grammarErrors) {
        StringBuilder message = new StringBuilder("Syntax error:\n").append(state.text(node));
        if (problem != null) {
            message.append('\n').append(problem);
        }
        int first = ParseState.line(node);
        int last = lastLine(node, first);
        for (GrammarError error : grammarErrors) {
            if (error.getLine() >= first && error.getLine() <= last) {
                message.append("\nline ").append(error);
            }
        }
        return message.toString();
    }

    private static int lastLine(ParseTree node, int first) {
        if (node instanceof ParserRuleContext context && context.getStop() != null) {
            return Math.max(first, context.getStop().getLine());
        }
        return first;
    }
}
