package org.sheetrenamer.model;

import java.util.Objects;

/**
 * Outcome of matching one row against the current file listing.
 */
public final class MatchResult {

    public enum Kind {
        MATCHED,
        EMPTY_KEY,
        NOT_FOUND,
    }

    private static final MatchResult EMPTY_KEY_RESULT = new MatchResult(
        Kind.EMPTY_KEY,
        null
    );
    private static final MatchResult NOT_FOUND_RESULT = new MatchResult(
        Kind.NOT_FOUND,
        null
    );

    private final Kind kind;
    private final FileEntry entry;

    private MatchResult(final Kind kind, final FileEntry entry) {
        this.kind = kind;
        this.entry = entry;
    }

    public static MatchResult matched(final FileEntry entry) {
        return new MatchResult(Kind.MATCHED, Objects.requireNonNull(entry));
    }

    public static MatchResult emptyKey() {
        return EMPTY_KEY_RESULT;
    }

    public static MatchResult notFound() {
        return NOT_FOUND_RESULT;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isMatched() {
        return kind == Kind.MATCHED;
    }

    /**
     * @return the matched file when {@link #getKind()} is MATCHED; otherwise null
     */
    public FileEntry getEntry() {
        return entry;
    }

    @Override
    public String toString() {
        return isMatched() ? "MATCHED(" + entry.baseName() + ")" : kind.name();
    }
}
