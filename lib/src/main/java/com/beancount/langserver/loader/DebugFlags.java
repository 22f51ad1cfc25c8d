package com.beancount.langserver.loader;

import com.beancount.langserver.loader.grammar.BeancountLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

public final class DebugFlags {
    private static final Logger LOG = Logger.getLogger(DebugFlags.class.getName());
    private static final String TOKENS_PROPERTY = "beancount.langserver.debugTokens";
    private static final String PARSER_PROPERTY = "beancount.langserver.debugParser";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String TOKENS_ENV = "BEANCOUNT_LANGSERVER_DEBUG_TOKENS";
    private static final String PARSER_ENV = "BEANCOUNT_LANGSERVER_DEBUG_PARSER";
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS =
            ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        return flag(TOKENS_PROPERTY, TOKENS_ENV);
    }

    public static boolean isParserTraceEnabled() {
        return flag(PARSER_PROPERTY, PARSER_ENV);
    }

    static boolean flag(String property, String env) {
        String value = System.getProperty(property);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(env));
    }

    public static void logTokens(CommonTokenStream tokens, BeancountLexer lexer, String sourceName) {
        LOG.info(() -> "Token dump for " + sourceName);
        for (Token token : tokens.getTokens()) {
            String symbolic = lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-25s @ %4d:%-3d -> %s",
                            symbolic,
                            token.getLine(),
                            token.getCharPositionInLine(),
                            token.getText());
            LOG.info(() -> "  " + line);
            CAPTURED_TOKENS.get().add(line);
        }
    }

    public static List<String> drainCapturedTokens() {
        List<String> captured = new ArrayList<>(CAPTURED_TOKENS.get());
        CAPTURED_TOKENS.get().clear();
        return captured;
    }
}
