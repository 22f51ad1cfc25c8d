package com.beancount.langserver.loader;

import com.beancount.langserver.loader.reference.ParserMode;
import java.util.Locale;

/** Loader configuration read from system properties, falling back to environment variables. */
public final class LoaderSettings {
    static final String MODE_PROPERTY = "beancount.langserver.mode";
    static final String MODE_ENV = "BEANCOUNT_LANGSERVER_MODE";

    private final ParserMode mode;

    public LoaderSettings(ParserMode mode) {
        this.mode = mode;
    }

    public static LoaderSettings fromEnvironment() {
        String value = System.getProperty(MODE_PROPERTY);
        if (value == null) {
            value = System.getenv(MODE_ENV);
        }
        return new LoaderSettings(parseMode(value, ParserMode.TREE));
    }

    static ParserMode parseMode(String value, ParserMode fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return ParserMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(
                    "Unknown parser mode '" + value + "'; expected reference, tree or verify", ex);
        }
    }

    public ParserMode getMode() {
        return mode;
    }
}
