package com.beancount.langserver.ledger;

import java.time.LocalDate;
import java.util.List;

/** Records the value of a named variable (location, employer...) from a date onwards. */
public final class EventEntry extends Entry {
    private final String eventType;
    private final String description;

    public EventEntry(LocalDate date, EntryMeta meta, String eventType, String description) {
        super(date, meta);
        this.eventType = eventType;
        this.description = description;
    }

    public String getEventType() {
        return eventType;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String getType() {
        return "event";
    }

    @Override
    protected List<Object> fields() {
        return values(eventType, description);
    }
}
