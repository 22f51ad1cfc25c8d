package com.beancount.langserver.loader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Records ANTLR syntax errors instead of throwing, so that one malformed line never aborts the
 * parse of the rest of a ledger.
 */
public final class CollectingErrorListener extends BaseErrorListener {

    /** One reported grammar error. */
    public static final class GrammarError {
        private final int line;
        private final int column;
        private final String message;

        public GrammarError(int line, int column, String message) {
            this.line = line;
            this.column = column;
            this.message = message;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return String.format(Locale.ROOT, "%d:%d %s", line, column, message);
        }
    }

    private final List<GrammarError> errors = new ArrayList<>();

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        errors.add(new GrammarError(line, charPositionInLine, msg));
    }

    public List<GrammarError> getErrors() {
        return Collections.unmodifiableList(errors);
    }
}
