package com.beancount.langserver.loader;

/**
 * Checked exception signalling that a ledger could not be loaded at all, e.g. the root file is
 * unreadable. Problems inside a readable ledger are reported as {@link Diagnostic}s instead.
 */
public final class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
