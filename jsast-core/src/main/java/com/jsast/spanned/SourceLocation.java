package com.jsast.spanned;

import java.util.Comparator;

/**
 * A range of source text, from {@code start} (inclusive) to {@code end} (exclusive).
 * Ordered by start, then end.
 */
public record SourceLocation(Position start, Position end) implements Comparable<SourceLocation> {

    private static final SourceLocation ZERO = new SourceLocation(Position.ZERO, Position.ZERO);

    private static final Comparator<SourceLocation> ORDER =
        Comparator.comparing(SourceLocation::start).thenComparing(SourceLocation::end);

    public SourceLocation {
        if (start == null || end == null) {
            throw new IllegalArgumentException("SourceLocation requires both a start and an end");
        }
        if (start.compareTo(end) > 0) {
            throw new IllegalArgumentException("SourceLocation start " + start + " is after end " + end);
        }
    }

    public SourceLocation(int startLine, int startColumn, int endLine, int endColumn) {
        this(new Position(startLine, startColumn), new Position(endLine, endColumn));
    }

    /**
     * The location used for empty collections; callers with surrounding brackets override it.
     */
    public static SourceLocation zero() {
        return ZERO;
    }

    /**
     * The union running from the start of {@code first} to the end of {@code last}.
     */
    public static SourceLocation span(SourceLocation first, SourceLocation last) {
        return new SourceLocation(first.start(), last.end());
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    public boolean contains(SourceLocation other) {
        return start.compareTo(other.start) <= 0 && end.compareTo(other.end) >= 0;
    }

    @Override
    public int compareTo(SourceLocation other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }

    /**
     * A line/column point. Lines and columns are counted however the producer counts them;
     * this type only orders and offsets them.
     */
    public record Position(int line, int column) implements Comparable<Position> {

        static final Position ZERO = new Position(0, 0);

        public Position plusColumns(int columns) {
            return new Position(line, column + columns);
        }

        public Position plus(Position delta) {
            return new Position(line + delta.line, column + delta.column);
        }

        public Position minus(Position delta) {
            return new Position(line - delta.line, column - delta.column);
        }

        @Override
        public int compareTo(Position other) {
            if (line != other.line) {
                return Integer.compare(line, other.line);
            }
            return Integer.compare(column, other.column);
        }

        @Override
        public String toString() {
            return line + ":" + column;
        }
    }
}
