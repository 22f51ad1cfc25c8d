package com.beancount.langserver.loader.tree;

import com.beancount.langserver.loader.grammar.BeancountParser;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed set of named node kinds produced by the grammar. The table is checked against
 * {@link BeancountParser#ruleNames} when the class loads, so a grammar rule added without a kind
 * here (or the reverse) fails immediately instead of being silently ignored during a walk.
 */
public enum NodeKind {
    LEDGER("ledger", Role.ROOT),
    STATEMENT("statement", Role.WRAPPER),

    TRANSACTION("transaction", Role.STATEMENT),
    OPEN("openDirective", Role.STATEMENT),
    CLOSE("closeDirective", Role.STATEMENT),
    COMMODITY("commodityDirective", Role.STATEMENT),
    BALANCE("balanceDirective", Role.STATEMENT),
    PAD("padDirective", Role.STATEMENT),
    NOTE("noteDirective", Role.STATEMENT),
    DOCUMENT("documentDirective", Role.STATEMENT),
    EVENT("eventDirective", Role.STATEMENT),
    QUERY("queryDirective", Role.STATEMENT),
    PRICE("priceDirective", Role.STATEMENT),
    CUSTOM("customDirective", Role.STATEMENT),
    OPTION("optionDirective", Role.STATEMENT),
    PLUGIN("pluginDirective", Role.STATEMENT),
    INCLUDE("includeDirective", Role.STATEMENT),
    PUSHTAG("pushtagDirective", Role.STATEMENT),
    POPTAG("poptagDirective", Role.STATEMENT),
    PUSHMETA("pushmetaDirective", Role.STATEMENT),
    POPMETA("popmetaDirective", Role.STATEMENT),
    BLANK_LINE("blankLine", Role.STATEMENT),
    ERROR_LINE("errorLine", Role.STATEMENT),

    TRANSACTION_LINE("transactionLine", Role.STRUCTURE),
    POSTING("posting", Role.STRUCTURE),
    COST_COMPONENTS("costComponents", Role.STRUCTURE),
    COST_COMPONENT("costComponent", Role.STRUCTURE),
    METADATA_LINE("metadataLine", Role.STRUCTURE),
    EOL("eol", Role.STRUCTURE),

    TXN_FLAG("txnFlag", Role.COMPONENT),
    POSTING_FLAG("postingFlag", Role.COMPONENT),
    INCOMPLETE_AMOUNT("incompleteAmount", Role.COMPONENT),
    AMOUNT("amount", Role.COMPONENT),
    COST_SPEC("costSpec", Role.COMPONENT),
    PRICE_ANNOTATION("priceAnnotation", Role.COMPONENT),
    KEY_VALUE("keyValue", Role.COMPONENT),
    META_VALUE("metaValue", Role.COMPONENT),
    CUSTOM_VALUE("customValue", Role.COMPONENT),
    CURRENCY_LIST("currencyList", Role.COMPONENT),
    ACCOUNT("account", Role.COMPONENT),
    CURRENCY("currency", Role.COMPONENT),
    STRING("string", Role.COMPONENT),
    DATE("date", Role.COMPONENT),
    NUMBER("number", Role.COMPONENT),
    TAG("tag", Role.COMPONENT),
    LINK("link", Role.COMPONENT),
    KEY("key", Role.COMPONENT),
    BOOL("bool", Role.COMPONENT);

    /** How a kind takes part in a walk. */
    public enum Role {
        /** The file node. */
        ROOT,
        /** Transparent choice node wrapping exactly one statement. */
        WRAPPER,
        /** Top-level node handled by the dispatcher. */
        STATEMENT,
        /** Value node resolved through {@link NodeValues}. */
        COMPONENT,
        /** Grouping node read by its parent's handler. */
        STRUCTURE
    }

    private static final NodeKind[] BY_RULE_INDEX = buildIndex();

    private final String ruleName;
    private final Role role;

    NodeKind(String ruleName, Role role) {
        this.ruleName = ruleName;
        this.role = role;
    }

    public String getRuleName() {
        return ruleName;
    }

    public Role getRole() {
        return role;
    }

    public static NodeKind forRuleIndex(int ruleIndex) {
        if (ruleIndex < 0 || ruleIndex >= BY_RULE_INDEX.length) {
            throw new IllegalStateException("Unknown grammar rule index " + ruleIndex);
        }
        return BY_RULE_INDEX[ruleIndex];
    }

    private static NodeKind[] buildIndex() {
        Map<String, NodeKind> byName = new HashMap<>();
        for (NodeKind kind : values()) {
            byName.put(kind.ruleName, kind);
        }
        String[] ruleNames = BeancountParser.ruleNames;
        NodeKind[] index = new NodeKind[ruleNames.length];
        List<String> unmapped = new ArrayList<>();
        for (int i = 0; i < ruleNames.length; i++) {
            NodeKind kind = byName.remove(ruleNames[i]);
            if (kind == null) {
                unmapped.add(ruleNames[i]);
            }
            index[i] = kind;
        }
        if (!unmapped.isEmpty() || !byName.isEmpty()) {
            throw new IllegalStateException(
                    "Node kinds out of sync with grammar; rules without kind: "
                            + unmapped
                            + ", kinds without rule: "
                            + byName.keySet());
        }
        return index;
    }
}
