package com.jsast.ast;

import java.util.Objects;

/**
 * Borrowed text: a window onto a source buffer that shares the buffer instead of copying it.
 *
 * <p>Trees built over {@code SourceSlice} keep the original source alive for as long as
 * they are reachable. Use {@link #toString()} to obtain owned text.</p>
 */
public final class SourceSlice implements CharSequence {

    private final CharSequence source;
    private final int from;
    private final int to;

    public SourceSlice(CharSequence source, int from, int to) {
        Objects.requireNonNull(source, "source");
        if (from < 0 || to > source.length() || from > to) {
            throw new IndexOutOfBoundsException(
                "Slice [" + from + ", " + to + ") outside source of length " + source.length());
        }
        this.source = source;
        this.from = from;
        this.to = to;
    }

    public static SourceSlice of(CharSequence source, int from, int to) {
        return new SourceSlice(source, from, to);
    }

    @Override
    public int length() {
        return to - from;
    }

    @Override
    public char charAt(int index) {
        if (index < 0 || index >= length()) {
            throw new IndexOutOfBoundsException(index);
        }
        return source.charAt(from + index);
    }

    @Override
    public SourceSlice subSequence(int start, int end) {
        if (start < 0 || end > length() || start > end) {
            throw new IndexOutOfBoundsException("[" + start + ", " + end + ")");
        }
        return new SourceSlice(source, from + start, from + end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceSlice other)) {
            return false;
        }
        return toString().equals(other.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        return source.subSequence(from, to).toString();
    }
}
