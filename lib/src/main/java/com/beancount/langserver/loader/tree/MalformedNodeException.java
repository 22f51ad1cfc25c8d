package com.beancount.langserver.loader.tree;

import org.antlr.v4.runtime.tree.ParseTree;

/**
 * Thrown while extracting a value from a node whose text parsed but does not make sense, such as
 * {@code 2024-02-30}. The dispatcher turns it into a syntax problem for the enclosing statement.
 */
public final class MalformedNodeException extends Exception {
    private final transient ParseTree node;

    public MalformedNodeException(ParseTree node, String message) {
        super(message);
        this.node = node;
    }

    public MalformedNodeException(ParseTree node, String message, Throwable cause) {
        super(message, cause);
        this.node = node;
    }

    public ParseTree getNode() {
        return node;
    }
}
