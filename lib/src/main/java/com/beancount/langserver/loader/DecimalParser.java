package com.beancount.langserver.loader;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.ParsePosition;
import java.util.Locale;

/**
 * Locale-neutral decimal parsing. Option values accept either dot or comma as the decimal separator;
 * ledger number tokens use a dot and may carry {@code ,} thousands grouping and a leading sign.
 */
public final class DecimalParser {

    private static final ThreadLocal<DecimalFormat> DOT_FORMAT =
            ThreadLocal.withInitial(() -> buildFormat('.'));
    private static final ThreadLocal<DecimalFormat> COMMA_FORMAT =
            ThreadLocal.withInitial(() -> buildFormat(','));

    private DecimalParser() {}

    /**
     * Parses an option value that may use either '.' or ',' as the decimal separator. Returns
     * {@code null} for null/empty input. Throws {@link NumberFormatException} for mixed separators,
     * grouping characters, or incomplete parses.
     */
    public static BigDecimal parse(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        boolean hasDot = trimmed.indexOf('.') >= 0;
        boolean hasComma = trimmed.indexOf(',') >= 0;
        if (hasDot && hasComma) {
            throw new NumberFormatException("Mixed decimal separators not allowed: " + text);
        }
        DecimalFormat format = hasComma ? COMMA_FORMAT.get() : DOT_FORMAT.get();
        ParsePosition position = new ParsePosition(0);
        Number parsed = format.parse(trimmed, position);
        if (parsed == null || position.getIndex() != trimmed.length()) {
            throw new NumberFormatException("Invalid decimal: " + text);
        }
        if (!(parsed instanceof BigDecimal)) {
            return new BigDecimal(parsed.toString());
        }
        return (BigDecimal) parsed;
    }

    /**
     * Parses a ledger number token such as {@code -1,234.50} or {@code +.5}, keeping its scale so
     * display precision can be inferred from it.
     */
    public static BigDecimal parseLedgerNumber(String token) {
        if (token == null || token.isEmpty()) {
            throw new NumberFormatException("Empty number");
        }
        String normalized = token.replace(",", "");
        if (normalized.startsWith("+")) {
            normalized = normalized.substring(1);
        }
        if (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return new BigDecimal(normalized);
    }

    private static DecimalFormat buildFormat(char decimalSeparator) {
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.ROOT);
        symbols.setDecimalSeparator(decimalSeparator);
        // Disable grouping to avoid silently accepting locale-specific thousand separators.
        DecimalFormat format = new DecimalFormat();
        format.setDecimalFormatSymbols(symbols);
        format.setParseBigDecimal(true);
        format.setGroupingUsed(false);
        format.setMaximumFractionDigits(Integer.MAX_VALUE);
        format.setMaximumIntegerDigits(Integer.MAX_VALUE);
        return format;
    }
}
