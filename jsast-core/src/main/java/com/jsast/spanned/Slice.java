package com.jsast.spanned;

import java.util.Objects;

/**
 * A piece of source text together with the location it was read from.
 *
 * @param <T> the text storage, e.g. {@link String} or {@link com.jsast.ast.SourceSlice}
 */
public record Slice<T extends CharSequence>(T source, SourceLocation loc) implements Node {

    public Slice {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(loc, "loc");
    }

    /**
     * A slice that does not span lines: its end is its start plus the text length.
     */
    public static <T extends CharSequence> Slice<T> of(T source, int line, int column) {
        return new Slice<>(source, new SourceLocation(line, column, line, column + source.length()));
    }

    @Override
    public String toString() {
        return source.toString();
    }
}
