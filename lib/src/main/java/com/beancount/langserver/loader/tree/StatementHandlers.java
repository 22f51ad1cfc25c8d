package com.beancount.langserver.loader.tree;

import com.beancount.langserver.ledger.Amount;
import com.beancount.langserver.ledger.BalanceEntry;
import com.beancount.langserver.ledger.CloseEntry;
import com.beancount.langserver.ledger.CommodityEntry;
import com.beancount.langserver.ledger.CostSpec;
import com.beancount.langserver.ledger.CustomEntry;
import com.beancount.langserver.ledger.DocumentEntry;
import com.beancount.langserver.ledger.EventEntry;
import com.beancount.langserver.ledger.NoteEntry;
import com.beancount.langserver.ledger.OpenEntry;
import com.beancount.langserver.ledger.PadEntry;
import com.beancount.langserver.ledger.Posting;
import com.beancount.langserver.ledger.PriceEntry;
import com.beancount.langserver.ledger.QueryEntry;
import com.beancount.langserver.ledger.TransactionEntry;
import com.beancount.langserver.loader.DecimalParser;
import com.beancount.langserver.loader.LedgerOptions;
import com.beancount.langserver.loader.grammar.BeancountParser;
import java.math.BigDecimal;
import java.math.MathContext;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Handler table: one entry per statement kind of the grammar. */
final class StatementHandlers {

    private StatementHandlers() {}

    static Map<NodeKind, StatementHandler> table() {
        Map<NodeKind, StatementHandler> table = new EnumMap<>(NodeKind.class);
        table.put(NodeKind.TRANSACTION,
                (state, node) -> transaction(state, (BeancountParser.TransactionContext) node));
        table.put(NodeKind.OPEN, (state, node) -> open(state, (BeancountParser.OpenDirectiveContext) node));
        table.put(NodeKind.CLOSE, (state, node) -> close(state, (BeancountParser.CloseDirectiveContext) node));
        table.put(NodeKind.COMMODITY,
                (state, node) -> commodity(state, (BeancountParser.CommodityDirectiveContext) node));
        table.put(NodeKind.BALANCE,
                (state, node) -> balance(state, (BeancountParser.BalanceDirectiveContext) node));
        table.put(NodeKind.PAD, (state, node) -> pad(state, (BeancountParser.PadDirectiveContext) node));
        table.put(NodeKind.NOTE, (state, node) -> note(state, (BeancountParser.NoteDirectiveContext) node));
        table.put(NodeKind.DOCUMENT,
                (state, node) -> document(state, (BeancountParser.DocumentDirectiveContext) node));
        table.put(NodeKind.EVENT, (state, node) -> event(state, (BeancountParser.EventDirectiveContext) node));
        table.put(NodeKind.QUERY, (state, node) -> query(state, (BeancountParser.QueryDirectiveContext) node));
        table.put(NodeKind.PRICE, (state, node) -> price(state, (BeancountParser.PriceDirectiveContext) node));
        table.put(NodeKind.CUSTOM,
                (state, node) -> custom(state, (BeancountParser.CustomDirectiveContext) node));
        table.put(NodeKind.OPTION,
                (state, node) -> option(state, (BeancountParser.OptionDirectiveContext) node));
        table.put(NodeKind.PLUGIN,
                (state, node) -> plugin(state, (BeancountParser.PluginDirectiveContext) node));
        table.put(NodeKind.INCLUDE,
                (state, node) -> include(state, (BeancountParser.IncludeDirectiveContext) node));
        table.put(NodeKind.PUSHTAG, (state, node) -> {
            state.pushTag(state.value(((BeancountParser.PushtagDirectiveContext) node).tag(), String.class));
            return HandlerOutcome.skipped();
        });
        table.put(NodeKind.POPTAG, (state, node) -> {
            state.popTag(node, state.value(((BeancountParser.PoptagDirectiveContext) node).tag(), String.class));
            return HandlerOutcome.skipped();
        });
        table.put(NodeKind.PUSHMETA, (state, node) -> {
            KeyValue keyValue =
                    state.value(((BeancountParser.PushmetaDirectiveContext) node).keyValue(), KeyValue.class);
            state.pushMeta(keyValue.getKey(), keyValue.getValue());
            return HandlerOutcome.skipped();
        });
        table.put(NodeKind.POPMETA, (state, node) -> {
            state.popMeta(node, state.value(((BeancountParser.PopmetaDirectiveContext) node).key(), String.class));
            return HandlerOutcome.skipped();
        });
        table.put(NodeKind.BLANK_LINE, (state, node) -> HandlerOutcome.skipped());
        table.put(NodeKind.ERROR_LINE, (state, node) -> HandlerOutcome.syntaxProblem(null));
        return table;
    }

    private record PendingPosting(
            BeancountParser.PostingContext node, int indent, Map<String, Object> meta) {}

    private static HandlerOutcome transaction(ParseState state, BeancountParser.TransactionContext ctx)
            throws MalformedNodeException {
        LocalDate date = state.value(ctx.date(), LocalDate.class);
        String flag = state.value(ctx.txnFlag(), String.class);
        String payee = null;
        String narration = null;
        List<BeancountParser.StringContext> strings = ctx.string();
        if (strings.size() == 1) {
            narration = state.value(strings.get(0), String.class);
        } else if (strings.size() == 2) {
            payee = state.value(strings.get(0), String.class);
            narration = state.value(strings.get(1), String.class);
        }
        Set<String> tags = new LinkedHashSet<>(state.currentTags());
        Set<String> links = new LinkedHashSet<>();
        collectTagsAndLinks(state, ctx.tag(), ctx.link(), tags, links);

        Map<String, Object> meta = new LinkedHashMap<>();
        List<PendingPosting> pending = new ArrayList<>();
        for (BeancountParser.TransactionLineContext line : ctx.transactionLine()) {
            int indent = line.INDENT().getText().length();
            if (line.posting() != null) {
                pending.add(new PendingPosting(line.posting(), indent, new LinkedHashMap<>()));
            } else if (line.keyValue() != null) {
                KeyValue keyValue = state.value(line.keyValue(), KeyValue.class);
                PendingPosting last = pending.isEmpty() ? null : pending.get(pending.size() - 1);
                if (last != null && indent > last.indent()) {
                    last.meta().put(keyValue.getKey(), keyValue.getValue());
                } else {
                    meta.put(keyValue.getKey(), keyValue.getValue());
                }
            } else {
                collectTagsAndLinks(state, line.tag(), line.link(), tags, links);
            }
        }
        List<Posting> postings = new ArrayList<>(pending.size());
        for (PendingPosting posting : pending) {
            postings.add(posting(state, posting.node(), posting.meta()));
        }
        return HandlerOutcome.produced(
                new TransactionEntry(
                        date, state.newMeta(ctx, meta), flag, payee, narration, tags, links, postings));
    }

    private static Posting posting(
            ParseState state, BeancountParser.PostingContext ctx, Map<String, Object> meta)
            throws MalformedNodeException {
        String flag = state.value(ctx.postingFlag(), String.class);
        String account = state.value(ctx.account(), String.class);
        Amount units = state.value(ctx.incompleteAmount(), Amount.class);
        CostSpec cost = state.value(ctx.costSpec(), CostSpec.class);
        Amount price = state.value(ctx.priceAnnotation(), Amount.class);
        if (price != null && ctx.priceAnnotation().ATAT() != null) {
            price = perUnitPrice(price, units);
        }
        return new Posting(flag, account, units, cost, price, meta);
    }

    /** Converts an {@code @@} total price to a per-unit price when the units are known. */
    private static Amount perUnitPrice(Amount total, Amount units) {
        if (total.getNumber() == null
                || units == null
                || units.getNumber() == null
                || units.getNumber().signum() == 0) {
            return total;
        }
        BigDecimal perUnit = total.getNumber().divide(units.getNumber().abs(), MathContext.DECIMAL128);
        return new Amount(perUnit, total.getCurrency());
    }

    private static HandlerOutcome open(ParseState state, BeancountParser.OpenDirectiveContext ctx)
            throws MalformedNodeException {
        List<String> currencies = NodeValues.currencies(ctx.currencyList());
        return HandlerOutcome.produced(
                new OpenEntry(
                        state.value(ctx.date(), LocalDate.class),
                        state.newMeta(ctx, metadata(state, ctx.metadataLine())),
                        state.value(ctx.account(), String.class),
                        currencies,
                        state.value(ctx.string(), String.class)));
    }

    private static HandlerOutcome close(ParseState state, BeancountParser.CloseDirectiveContext ctx)
            throws MalformedNodeException {
        return HandlerOutcome.produced(
                new CloseEntry(
                        state.value(ctx.date(), LocalDate.class),
                        state.newMeta(ctx, metadata(state, ctx.metadataLine())),
                        state.value(ctx.account(), String.class)));
    }

    private static HandlerOutcome commodity(
            ParseState state, BeancountParser.CommodityDirectiveContext ctx) throws MalformedNodeException {
        return HandlerOutcome.produced(
                new CommodityEntry(
                        state.value(ctx.date(), LocalDate.class),
                        state.newMeta(ctx, metadata(state, ctx.metadataLine())),
                        state.value(ctx.currency(), String.class)));
    }

    private static HandlerOutcome balance(ParseState state, BeancountParser.BalanceDirectiveContext ctx)
            throws MalformedNodeException {
        BigDecimal number = state.value(ctx.number(0), BigDecimal.class);
        BigDecimal tolerance = ctx.TILDE() == null ? null : state.value(ctx.number(1), BigDecimal.class);
        String currency = state.value(ctx.currency(), String.class);
        state.updateDisplayContext(number, currency);
        return HandlerOutcome.produced(
                new BalanceEntry(
                        state.value(ctx.date(), LocalDate.class),
                        state.newMeta(ctx, metadata(state, ctx.metadataLine())),
                        state.value(ctx.account(), String.class),
                        new Amount(number, currency),
                        tolerance));
    }

    private static HandlerOutcome pad(ParseState state, BeancountParser.PadDirectiveContext ctx)
            throws MalformedNodeException {
        return HandlerOutcome.produced(
                new PadEntry(
                        state.value(ctx.date(), LocalDate.class),
                        state.newMeta(ctx, metadata(state, ctx.metadataLine())),
                        state.value(ctx.account(0), String.class),
                        state.value(ctx.account(1), String.class)));
    }

    private static HandlerOutcome note(ParseState state, BeancountParser.NoteDirectiveContext ctx)
            throws MalformedNodeException {
        return HandlerOutcome.produced(
                new NoteEntry(
                        state.value(ctx.date(), LocalDate.class),
                        state.newMeta(ctx, metadata(state, ctx.metadataLine())),
                        state.value(ctx.account(), String.class),
                        state.value(ctx.string(), String.class)));
    }

    private static HandlerOutcome document(
            ParseState state, BeancountParser.DocumentDirectiveContext ctx) throws MalformedNodeException {
        Set<String> tags = new LinkedHashSet<>(state.currentTags());
        Set<String> links = new LinkedHashSet<>();
        collectTagsAndLinks(state, ctx.tag(), ctx.link(), tags, links);
        String documentPath = state.value(ctx.string(), String.class);
        Path current = state.getFilename();
        if (current != null && current.getParent() != null && !Path.of(documentPath).isAbsolute()) {
            documentPath = current.getParent().resolve(documentPath).normalize().toString();
        }
        return HandlerOutcome.produced(
                new DocumentEntry(
                        state.value(ctx.date(), LocalDate.class),
                        state.newMeta(ctx, metadata(state, ctx.metadataLine())),
                        state.value(ctx.account(), String.class),
                        documentPath,
                        tags,
                        links));
    }

    private static HandlerOutcome event(ParseState state, BeancountParser.EventDirectiveContext ctx)
            throws MalformedNodeException {
        return HandlerOutcome.produced(
                new EventEntry(
                        state.value(ctx.date(), LocalDate.class),
                        state.newMeta(ctx, metadata(state, ctx.metadataLine())),
                        state.value(ctx.string(0), String.class),
                        state.value(ctx.string(1), String.class)));
    }

    private static HandlerOutcome query(ParseState state, BeancountParser.QueryDirectiveContext ctx)
            throws MalformedNodeException {
        return HandlerOutcome.produced(
                new QueryEntry(
                        state.value(ctx.date(), LocalDate.class),
                        state.newMeta(ctx, metadata(state, ctx.metadataLine())),
                        state.value(ctx.string(0), String.class),
                        state.value(ctx.string(1), String.class)));
    }

    private static HandlerOutcome price(ParseState state, BeancountParser.PriceDirectiveContext ctx)
            throws MalformedNodeException {
        return HandlerOutcome.produced(
                new PriceEntry(
                        state.value(ctx.date(), LocalDate.class),
                        state.newMeta(ctx, metadata(state, ctx.metadataLine())),
                        state.value(ctx.currency(), String.class),
                        state.value(ctx.amount(), Amount.class)));
    }

    private static HandlerOutcome custom(ParseState state, BeancountParser.CustomDirectiveContext ctx)
            throws MalformedNodeException {
        List<Object> values = new ArrayList<>();
        for (BeancountParser.CustomValueContext value : ctx.customValue()) {
            values.add(state.value(value));
        }
        return HandlerOutcome.produced(
                new CustomEntry(
                        state.value(ctx.date(), LocalDate.class),
                        state.newMeta(ctx, metadata(state, ctx.metadataLine())),
                        state.value(ctx.string(), String.class),
                        values));
    }

    private static HandlerOutcome option(ParseState state, BeancountParser.OptionDirectiveContext ctx)
            throws MalformedNodeException {
        String name = state.value(ctx.string(0), String.class);
        String value = state.value(ctx.string(1), String.class);
        state.getOptions().setOption(name, value);
        switch (name) {
            case "display_precision" -> displayPrecision(state, ctx, value);
            case "render_commas" -> state.getDisplayContext()
                    .setRenderCommas(
                            "true".equals(value.toLowerCase(Locale.ROOT)) || "1".equals(value));
            default -> {
                // recorded only
            }
        }
        return HandlerOutcome.skipped();
    }

    /** {@code option "display_precision" "USD:0.01"} pins USD to two fractional digits. */
    private static void displayPrecision(
            ParseState state, BeancountParser.OptionDirectiveContext ctx, String value) {
        int separator = value.indexOf(':');
        if (separator <= 0) {
            state.recordError(ctx, "Invalid display_precision option: '" + value + "'");
            return;
        }
        try {
            BigDecimal example = DecimalParser.parse(value.substring(separator + 1));
            if (example == null) {
                state.recordError(ctx, "Invalid display_precision option: '" + value + "'");
                return;
            }
            state.getDisplayContext()
                    .setFixedPrecision(value.substring(0, separator).trim(), Math.max(0, example.scale()));
        } catch (NumberFormatException ex) {
            state.recordError(ctx, "Invalid display_precision option: '" + value + "'");
        }
    }

    private static HandlerOutcome plugin(ParseState state, BeancountParser.PluginDirectiveContext ctx)
            throws MalformedNodeException {
        String module = state.value(ctx.string(0), String.class);
        String config = ctx.string().size() > 1 ? state.value(ctx.string(1), String.class) : null;
        state.getOptions().addPlugin(new LedgerOptions.Plugin(module, config));
        return HandlerOutcome.skipped();
    }

    private static HandlerOutcome include(ParseState state, BeancountParser.IncludeDirectiveContext ctx)
            throws MalformedNodeException {
        return HandlerOutcome.includeRequest(new IncludeDirective(state.value(ctx.string(), String.class)));
    }

    private static Map<String, Object> metadata(
            ParseState state, List<BeancountParser.MetadataLineContext> lines)
            throws MalformedNodeException {
        Map<String, Object> meta = new LinkedHashMap<>();
        for (BeancountParser.MetadataLineContext line : lines) {
            if (line.keyValue() != null) {
                KeyValue keyValue = state.value(line.keyValue(), KeyValue.class);
                meta.put(keyValue.getKey(), keyValue.getValue());
            }
        }
        return meta;
    }

    private static void collectTagsAndLinks(
            ParseState state,
            List<BeancountParser.TagContext> tagNodes,
            List<BeancountParser.LinkContext> linkNodes,
            Set<String> tags,
            Set<String> links)
            throws MalformedNodeException {
        for (BeancountParser.TagContext tag : tagNodes) {
            tags.add(state.value(tag, String.class));
        }
        for (BeancountParser.LinkContext link : linkNodes) {
            links.add(state.value(link, String.class));
        }
    }
}
