package com.beancount.langserver.ledger;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/** A dated, flagged group of postings with optional payee, narration, tags and links. */
public final class TransactionEntry extends Entry {
    private final String flag;
    private final String payee;
    private final String narration;
    private final Set<String> tags;
    private final Set<String> links;
    private final List<Posting> postings;

    public TransactionEntry(
            LocalDate date,
            EntryMeta meta,
            String flag,
            String payee,
            String narration,
            Set<String> tags,
            Set<String> links,
            List<Posting> postings) {
        super(date, meta);
        this.flag = flag;
        this.payee = payee;
        this.narration = narration == null ? "" : narration;
        this.tags = DocumentEntry.copy(tags);
        this.links = DocumentEntry.copy(links);
        this.postings = postings == null ? List.of() : List.copyOf(postings);
    }

    public String getFlag() {
        return flag;
    }

    public String getPayee() {
        return payee;
    }

    public String getNarration() {
        return narration;
    }

    public Set<String> getTags() {
        return tags;
    }

    public Set<String> getLinks() {
        return links;
    }

    public List<Posting> getPostings() {
        return postings;
    }

    @Override
    public String getType() {
        return "txn";
    }

    @Override
    protected List<Object> fields() {
        return values(flag, payee, narration, tags, links, postings);
    }
}
