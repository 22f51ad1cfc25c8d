package com.beancount.langserver.ledger;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Associates an external file with an account. */
public final class DocumentEntry extends Entry {
    private final String account;
    private final String filename;
    private final Set<String> tags;
    private final Set<String> links;

    public DocumentEntry(
            LocalDate date,
            EntryMeta meta,
            String account,
            String filename,
            Set<String> tags,
            Set<String> links) {
        super(date, meta);
        this.account = account;
        this.filename = filename;
        this.tags = copy(tags);
        this.links = copy(links);
    }

    public String getAccount() {
        return account;
    }

    public String getFilename() {
        return filename;
    }

    public Set<String> getTags() {
        return tags;
    }

    public Set<String> getLinks() {
        return links;
    }

    @Override
    public String getType() {
        return "document";
    }

    @Override
    protected List<Object> fields() {
        return values(account, filename, tags, links);
    }

    static Set<String> copy(Set<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
