package com.beancount.langserver.loader.display;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per-currency number of fractional digits to render. Observed amounts only ever widen the
 * tracked precision; {@code option "display_precision"} pins it.
 */
public final class DisplayContext {
    private final Map<String, Integer> currencyPrecisions = new HashMap<>();
    private final Map<String, Integer> fixedPrecisions = new HashMap<>();
    private boolean renderCommas;

    public DisplayContext() {}

    public DisplayContext(DisplayContext other) {
        if (other != null) {
            this.currencyPrecisions.putAll(other.currencyPrecisions);
            this.fixedPrecisions.putAll(other.fixedPrecisions);
            this.renderCommas = other.renderCommas;
        }
    }

    /** Records an observed number; {@code null} number or currency is ignored. */
    public void update(BigDecimal number, String currency) {
        if (number == null || currency == null) {
            return;
        }
        int digits = Math.max(0, number.scale());
        currencyPrecisions.merge(currency, digits, Math::max);
    }

    public void setFixedPrecision(String currency, int fractionalDigits) {
        if (currency == null) {
            return;
        }
        fixedPrecisions.put(currency, fractionalDigits);
    }

    public void setRenderCommas(boolean renderCommas) {
        this.renderCommas = renderCommas;
    }

    public boolean isRenderCommas() {
        return renderCommas;
    }

    /** Observed maximum precision per currency, ignoring fixed overrides. */
    public Map<String, Integer> getCurrencyPrecisions() {
        return Collections.unmodifiableMap(currencyPrecisions);
    }

    public int getPrecision(String currency, int defaultPrecision) {
        if (currency == null) {
            return defaultPrecision;
        }
        Integer fixed = fixedPrecisions.get(currency);
        if (fixed != null) {
            return fixed;
        }
        return currencyPrecisions.getOrDefault(currency, defaultPrecision);
    }

    public String key() {
        return String.format(
                Locale.ROOT,
                "commas=%s,precisions=%s,fixed=%s",
                renderCommas,
                currencyPrecisions,
                fixedPrecisions);
    }

    public DisplayContext copy() {
        return new DisplayContext(this);
    }
}
