package com.beancount.langserver.loader.reference;

/** Which engine answers {@link LedgerParser} requests. */
public enum ParserMode {
    /** Reference engine only; its result is returned unchanged. */
    REFERENCE,
    /** Tree walker only; its result is returned unchanged. */
    TREE,
    /** Both engines on open; tree result plus a warning per diverging entry. */
    VERIFY
}
