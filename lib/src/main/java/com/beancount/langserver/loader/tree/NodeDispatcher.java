package com.beancount.langserver.loader.tree;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Routes a top-level node to the handler registered for its kind. The table must cover every
 * statement kind of the grammar; a gap is a programming error and fails construction.
 */
public final class NodeDispatcher {
    private final Map<NodeKind, StatementHandler> handlers;

    public NodeDispatcher() {
        this(StatementHandlers.table());
    }

    NodeDispatcher(Map<NodeKind, StatementHandler> handlers) {
        this.handlers = new EnumMap<>(NodeKind.class);
        this.handlers.putAll(handlers);
        List<String> missing = new ArrayList<>();
        for (NodeKind kind : NodeKind.values()) {
            if (kind.getRole() == NodeKind.Role.STATEMENT && !this.handlers.containsKey(kind)) {
                missing.add(kind.getRuleName());
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No handler registered for node kinds " + missing);
        }
    }

    public HandlerOutcome dispatch(ParseState state, ParseTree node) {
        if (node instanceof ErrorNode) {
            return HandlerOutcome.syntaxProblem(null);
        }
        if (node instanceof TerminalNode) {
            return HandlerOutcome.skipped();
        }
        ParserRuleContext context = (ParserRuleContext) node;
        NodeKind kind = NodeKind.forRuleIndex(context.getRuleIndex());
        if (containsSyntaxErrors(context)) {
            return HandlerOutcome.syntaxProblem(null);
        }
        if (kind.getRole() == NodeKind.Role.WRAPPER) {
            if (context.getChildCount() != 1) {
                return HandlerOutcome.syntaxProblem(null);
            }
            return dispatch(state, context.getChild(0));
        }
        StatementHandler handler = handlers.get(kind);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for node kind " + kind.getRuleName());
        }
        try {
            return handler.handle(state, context);
        } catch (MalformedNodeException ex) {
            return HandlerOutcome.syntaxProblem(ex.getMessage());
        }
    }

    static boolean containsSyntaxErrors(ParserRuleContext context) {
        if (context.exception != null) {
            return true;
        }
        for (int i = 0; i < context.getChildCount(); i++) {
            ParseTree child = context.getChild(i);
            if (child instanceof ErrorNode) {
                return true;
            }
            if (child instanceof ParserRuleContext nested && containsSyntaxErrors(nested)) {
                return true;
            }
        }
        return false;
    }
}
