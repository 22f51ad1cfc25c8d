package com.beancount.langserver.loader.tree;

import com.beancount.langserver.ledger.EntryMeta;
import com.beancount.langserver.ledger.SourcePosition;
import com.beancount.langserver.loader.Diagnostic;
import com.beancount.langserver.loader.LedgerOptions;
import com.beancount.langserver.loader.display.DisplayContext;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Mutable context of one traversal: the file being walked, the pushtag/pushmeta stacks, the display
 * context and every diagnostic recorded so far. One instance per root load; never shared.
 */
public final class ParseState {
    static final String STRING_SOURCE = "<string>";

    private byte[] source;
    private Path filename;
    private final List<String> tagStack = new ArrayList<>();
    private final Map<String, List<Object>> metaStack = new LinkedHashMap<>();
    private final DisplayContext displayContext = new DisplayContext();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final LedgerOptions options = new LedgerOptions();

    public ParseState(byte[] source, Path filename) {
        this.source = Objects.requireNonNull(source, "source");
        this.filename = filename;
        options.setDisplayContext(displayContext);
    }

    /** Restores the previous file when closed. */
    public final class FileScope implements AutoCloseable {
        private final byte[] previousSource;
        private final Path previousFilename;

        private FileScope(byte[] previousSource, Path previousFilename) {
            this.previousSource = previousSource;
            this.previousFilename = previousFilename;
        }

        @Override
        public void close() {
            source = previousSource;
            filename = previousFilename;
        }
    }

    public FileScope enterFile(byte[] newSource, Path newFilename) {
        FileScope scope = new FileScope(source, filename);
        source = Objects.requireNonNull(newSource, "newSource");
        filename = newFilename;
        return scope;
    }

    public byte[] getSource() {
        return source;
    }

    /** Current file, or {@code null} while walking an in-memory document. */
    public Path getFilename() {
        return filename;
    }

    public String getSourceName() {
        return filename == null ? STRING_SOURCE : filename.toString();
    }

    public Object value(ParseTree node) throws MalformedNodeException {
        return NodeValues.value(this, node);
    }

    public <T> T value(ParseTree node, Class<T> type) throws MalformedNodeException {
        Object value = NodeValues.value(this, node);
        if (value != null && !type.isInstance(value)) {
            throw new MalformedNodeException(
                    node, "Expected " + type.getSimpleName() + " but found " + value);
        }
        return type.cast(value);
    }

    public void recordError(ParseTree node, String message) {
        diagnostics.add(Diagnostic.error(position(node), message));
    }

    public void recordWarning(ParseTree node, String message) {
        diagnostics.add(Diagnostic.warning(position(node), message));
    }

    public SourcePosition position(ParseTree node) {
        return new SourcePosition(getSourceName(), line(node));
    }

    public void updateDisplayContext(BigDecimal number, String currency) {
        if (number == null || currency == null) {
            return;
        }
        displayContext.update(number, currency);
    }

    public void pushTag(String tag) {
        tagStack.add(tag);
    }

    /** Pops {@code tag}, which must be the most recently pushed one; otherwise records an error. */
    public void popTag(ParseTree node, String tag) {
        if (!tagStack.contains(tag)) {
            recordError(node, "Attempting to pop absent tag: '" + tag + "'");
            return;
        }
        String top = tagStack.get(tagStack.size() - 1);
        if (!top.equals(tag)) {
            recordError(
                    node,
                    "Attempting to pop tag '" + tag + "' while '" + top + "' was pushed after it");
            return;
        }
        tagStack.remove(tagStack.size() - 1);
    }

    public void pushMeta(String key, Object value) {
        metaStack.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }

    public void popMeta(ParseTree node, String key) {
        List<Object> values = metaStack.get(key);
        if (values == null || values.isEmpty()) {
            recordError(node, "Attempting to pop absent metadata key: '" + key + "'");
            return;
        }
        values.remove(values.size() - 1);
        if (values.isEmpty()) {
            metaStack.remove(key);
        }
    }

    public Set<String> currentTags() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(tagStack));
    }

    /** Innermost pushed value for every key with pending pushmeta directives. */
    public Map<String, Object> currentMeta() {
        Map<String, Object> current = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> entry : metaStack.entrySet()) {
            List<Object> values = entry.getValue();
            current.put(entry.getKey(), values.get(values.size() - 1));
        }
        return current;
    }

    /** Metadata for an entry starting at {@code node}; explicit keys override pushed ones. */
    public EntryMeta newMeta(ParseTree node, Map<String, Object> explicit) {
        Map<String, Object> values = currentMeta();
        if (explicit != null) {
            values.putAll(explicit);
        }
        return new EntryMeta(getSourceName(), line(node), values);
    }

    /** Reports anything left on the stacks, then empties them. */
    public void finalizeState() {
        for (String tag : tagStack) {
            recordError(null, "Unbalanced pushed tag: '" + tag + "'");
        }
        for (Map.Entry<String, List<Object>> entry : metaStack.entrySet()) {
            recordError(
                    null,
                    "Unbalanced metadata key '"
                            + entry.getKey()
                            + "'; leftover metadata '"
                            + entry.getValue()
                            + "'");
        }
        tagStack.clear();
        metaStack.clear();
    }

    boolean hasPendingStacks() {
        return !tagStack.isEmpty() || !metaStack.isEmpty();
    }

    public DisplayContext getDisplayContext() {
        return displayContext;
    }

    public LedgerOptions getOptions() {
        return options;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /** Raw source text covered by {@code node}, without the trailing line break. */
    public String text(ParseTree node) {
        String text;
        if (node instanceof TerminalNode terminal) {
            text = terminal.getSymbol().getType() == Token.EOF ? "" : terminal.getText();
        } else if (node instanceof ParserRuleContext context && context.getStart() != null) {
            Token start = context.getStart();
            Token stop = context.getStop();
            int from = start.getStartIndex();
            int to = stop == null ? start.getStopIndex() : stop.getStopIndex();
            if (from < 0 || to < from) {
                text = "";
            } else {
                text = start.getInputStream().getText(Interval.of(from, to));
            }
        } else {
            text = node == null ? "" : node.getText();
        }
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }

    static int line(ParseTree node) {
        if (node instanceof TerminalNode terminal) {
            return Math.max(0, terminal.getSymbol().getLine());
        }
        if (node instanceof ParserRuleContext context && context.getStart() != null) {
            return Math.max(0, context.getStart().getLine());
        }
        return 0;
    }
}
