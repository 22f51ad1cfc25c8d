package com.beancount.langserver.loader.tree;

import com.beancount.langserver.ledger.Entry;
import com.beancount.langserver.loader.BookingEngine;
import com.beancount.langserver.loader.BookingResult;
import com.beancount.langserver.loader.Diagnostic;
import com.beancount.langserver.loader.LedgerGrammar;
import com.beancount.langserver.loader.LedgerOptions;
import com.beancount.langserver.loader.LoadResult;
import com.beancount.langserver.loader.LoaderException;
import com.beancount.langserver.loader.validation.ValidatingBookingEngine;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Loads a ledger through the grammar tree: parse, walk with includes, finalize, sort, book. */
public final class TreeLoader {
    private static final Logger LOG = Logger.getLogger(TreeLoader.class.getName());

    private final LedgerGrammar grammar;
    private final NodeDispatcher dispatcher;
    private final BookingEngine bookingEngine;

    public TreeLoader() {
        this(new LedgerGrammar(), new NodeDispatcher(), new ValidatingBookingEngine());
    }

    public TreeLoader(LedgerGrammar grammar, NodeDispatcher dispatcher, BookingEngine bookingEngine) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.bookingEngine = Objects.requireNonNull(bookingEngine, "bookingEngine");
    }

    public LoadResult load(Path ledgerPath) throws LoaderException {
        Objects.requireNonNull(ledgerPath, "ledgerPath");
        Path root = SeenFiles.canonical(ledgerPath);
        byte[] contents;
        try {
            contents = Files.readAllBytes(root);
        } catch (IOException ex) {
            throw new LoaderException("Failed to read ledger: " + root, ex);
        }
        SeenFiles seenFiles = new SeenFiles();
        seenFiles.add(root);
        return run(contents, root, seenFiles);
    }

    /** Loads an in-memory document; include directives are reported rather than followed. */
    public LoadResult loadString(String contents) {
        Objects.requireNonNull(contents, "contents");
        return run(contents.getBytes(StandardCharsets.UTF_8), null, new SeenFiles());
    }

    private LoadResult run(byte[] contents, Path root, SeenFiles seenFiles) {
        long started = System.nanoTime();
        ParseState state = new ParseState(contents, root);
        LedgerGrammar.ParsedSource parsed = grammar.parse(contents, state.getSourceName());
        TreeWalker walker = new TreeWalker(grammar, dispatcher);
        List<Entry> entries = walker.walk(parsed, state, root, seenFiles);
        state.finalizeState();
        logPhase("walk", started);

        LedgerOptions options = state.getOptions();
        options.setIncludes(seenFiles.sortedNames());
        if (root != null) {
            options.setInputHash(seenFiles.inputHash());
        }

        long sortStarted = System.nanoTime();
        entries.sort(EntryOrdering.CANONICAL);
        logPhase("sort", sortStarted);

        long bookStarted = System.nanoTime();
        BookingResult booked = bookingEngine.book(entries, options, state.getDisplayContext());
        logPhase("booking", bookStarted);

        List<Diagnostic> diagnostics = new ArrayList<>(state.getDiagnostics());
        diagnostics.addAll(booked.getDiagnostics());
        LOG.fine(
                () ->
                        "Loaded "
                                + state.getSourceName()
                                + ": "
                                + booked.getEntries().size()
                                + " entries, "
                                + diagnostics.size()
                                + " diagnostics, "
                                + seenFiles.size()
                                + " files");
        return new LoadResult(booked.getEntries(), diagnostics, options);
    }

    private static void logPhase(String phase, long startedNanos) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(
                    String.format(
                            "%s took %.3f ms", phase, (System.nanoTime() - startedNanos) / 1_000_000.0));
        }
    }
}
