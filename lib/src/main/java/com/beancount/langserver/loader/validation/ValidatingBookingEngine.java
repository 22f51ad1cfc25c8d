package com.beancount.langserver.loader.validation;

import com.beancount.langserver.ledger.Entry;
import com.beancount.langserver.loader.BookingEngine;
import com.beancount.langserver.loader.BookingResult;
import com.beancount.langserver.loader.LedgerOptions;
import com.beancount.langserver.loader.display.DisplayContext;
import java.util.List;
import java.util.Objects;

/**
 * Booking collaborator shipped with the loader: leaves entries untouched and runs the validation
 * rules over them. Balancing and interpolation are left to a full accounting engine.
 */
public final class ValidatingBookingEngine implements BookingEngine {
    private final ValidationRunner runner;

    public ValidatingBookingEngine() {
        this(ValidationRunner.defaultRules());
    }

    public ValidatingBookingEngine(ValidationRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public BookingResult book(
            List<Entry> entries, LedgerOptions options, DisplayContext displayContext) {
        return new BookingResult(entries, runner.run(entries, options));
    }
}
