package com.beancount.langserver.loader.tree;

import org.antlr.v4.runtime.ParserRuleContext;

/** Builds the outcome of one statement node of a known kind. */
@FunctionalInterface
public interface StatementHandler {

    HandlerOutcome handle(ParseState state, ParserRuleContext node) throws MalformedNodeException;
}
