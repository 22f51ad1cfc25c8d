package com.beancount.langserver.ledger;

import java.util.Objects;

/** Filename and 1-based line of a directive or diagnostic. Line 0 denotes a whole-file position. */
public final class SourcePosition {
    private final String filename;
    private final int line;

    public SourcePosition(String filename, int line) {
        this.filename = Objects.requireNonNull(filename, "filename");
        this.line = line;
    }

    public String getFilename() {
        return filename;
    }

    public int getLine() {
        return line;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourcePosition)) {
            return false;
        }
        SourcePosition other = (SourcePosition) obj;
        return line == other.line && filename.equals(other.filename);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filename, line);
    }

    @Override
    public String toString() {
        return filename + ":" + line;
    }
}
