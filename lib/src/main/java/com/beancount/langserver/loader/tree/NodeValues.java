package com.beancount.langserver.loader.tree;

import com.beancount.langserver.ledger.Amount;
import com.beancount.langserver.ledger.CostSpec;
import com.beancount.langserver.loader.DecimalParser;
import com.beancount.langserver.loader.grammar.BeancountParser;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Extraction rules for component nodes. Amount-bearing nodes widen the display context of the
 * state they are resolved against.
 */
final class NodeValues {

    private NodeValues() {}

    static Object value(ParseState state, ParseTree node) throws MalformedNodeException {
        if (node == null) {
            return null;
        }
        if (node instanceof TerminalNode) {
            return node.getText();
        }
        ParserRuleContext context = (ParserRuleContext) node;
        NodeKind kind = NodeKind.forRuleIndex(context.getRuleIndex());
        if (kind.getRole() != NodeKind.Role.COMPONENT) {
            throw new IllegalStateException("No value extraction for node kind " + kind);
        }
        return switch (kind) {
            case ACCOUNT, CURRENCY, POSTING_FLAG -> context.getText();
            case TXN_FLAG -> "txn".equals(context.getText()) ? "*" : context.getText();
            case STRING -> unquote(context, context.getText());
            case DATE -> date(context, context.getText());
            case NUMBER -> number(context, context.getText());
            case TAG, LINK -> context.getText().substring(1);
            case KEY -> {
                String text = context.getText();
                yield text.substring(0, text.length() - 1);
            }
            case BOOL -> Boolean.valueOf("TRUE".equals(context.getText()));
            case AMOUNT -> amount(state, (BeancountParser.AmountContext) context);
            case INCOMPLETE_AMOUNT ->
                    incompleteAmount(state, (BeancountParser.IncompleteAmountContext) context);
            case PRICE_ANNOTATION ->
                    value(state, ((BeancountParser.PriceAnnotationContext) context).incompleteAmount());
            case COST_SPEC -> costSpec(state, (BeancountParser.CostSpecContext) context);
            case KEY_VALUE -> keyValue(state, (BeancountParser.KeyValueContext) context);
            case META_VALUE, CUSTOM_VALUE -> value(state, context.getChild(0));
            case CURRENCY_LIST -> currencies((BeancountParser.CurrencyListContext) context);
            default -> throw new IllegalStateException("No value extraction for node kind " + kind);
        };
    }

    private static Amount amount(ParseState state, BeancountParser.AmountContext context)
            throws MalformedNodeException {
        BigDecimal number = (BigDecimal) value(state, context.number());
        String currency = context.currency().getText();
        state.updateDisplayContext(number, currency);
        return new Amount(number, currency);
    }

    private static Amount incompleteAmount(
            ParseState state, BeancountParser.IncompleteAmountContext context)
            throws MalformedNodeException {
        BigDecimal number = (BigDecimal) value(state, context.number());
        String currency = context.currency() == null ? null : context.currency().getText();
        state.updateDisplayContext(number, currency);
        return new Amount(number, currency);
    }

    private static CostSpec costSpec(ParseState state, BeancountParser.CostSpecContext context)
            throws MalformedNodeException {
        boolean total = context.LCURLCURL() != null;
        BigDecimal numberPer = null;
        BigDecimal numberTotal = null;
        String currency = null;
        LocalDate date = null;
        String label = null;
        boolean merge = false;
        if (context.costComponents() != null) {
            for (BeancountParser.CostComponentContext component :
                    context.costComponents().costComponent()) {
                if (component.incompleteAmount() != null) {
                    Amount amount = (Amount) value(state, component.incompleteAmount());
                    if (total) {
                        numberTotal = amount.getNumber();
                    } else {
                        numberPer = amount.getNumber();
                    }
                    currency = amount.getCurrency();
                } else if (component.date() != null) {
                    date = (LocalDate) value(state, component.date());
                } else if (component.string() != null) {
                    label = (String) value(state, component.string());
                } else if (component.STAR() != null) {
                    merge = true;
                }
            }
        }
        return new CostSpec(numberPer, numberTotal, currency, date, label, merge);
    }

    private static KeyValue keyValue(ParseState state, BeancountParser.KeyValueContext context)
            throws MalformedNodeException {
        String key = (String) value(state, context.key());
        return new KeyValue(key, value(state, context.metaValue()));
    }

    /** Currencies of an {@code open} constraint list; empty when the list is absent. */
    static List<String> currencies(BeancountParser.CurrencyListContext context) {
        List<String> currencies = new ArrayList<>();
        if (context == null) {
            return currencies;
        }
        for (BeancountParser.CurrencyContext currency : context.currency()) {
            currencies.add(currency.getText());
        }
        return currencies;
    }

    static LocalDate date(ParseTree node, String text) throws MalformedNodeException {
        String[] parts = text.split("[-/]");
        if (parts.length != 3) {
            throw new MalformedNodeException(node, "Invalid date: " + text);
        }
        try {
            return LocalDate.of(
                    Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
        } catch (DateTimeException | NumberFormatException ex) {
            throw new MalformedNodeException(node, "Invalid date: " + text, ex);
        }
    }

    static BigDecimal number(ParseTree node, String text) throws MalformedNodeException {
        try {
            return DecimalParser.parseLedgerNumber(text);
        } catch (NumberFormatException ex) {
            throw new MalformedNodeException(node, "Invalid number: " + text, ex);
        }
    }

    static String unquote(ParseTree node, String text) throws MalformedNodeException {
        if (text.length() < 2 || text.charAt(0) != '"' || text.charAt(text.length() - 1) != '"') {
            throw new MalformedNodeException(node, "Invalid string: " + text);
        }
        StringBuilder builder = new StringBuilder(text.length() - 2);
        for (int i = 1; i < text.length() - 1; i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length() - 1) {
                char next = text.charAt(++i);
                switch (next) {
                    case 'n' -> builder.append('\n');
                    case 't' -> builder.append('\t');
                    case 'r' -> builder.append('\r');
                    default -> builder.append(next);
                }
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }
}
