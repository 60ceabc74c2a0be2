package com.jsast.spanned;

public record Ident<T extends CharSequence>(Slice<T> slice) implements Expr<T>, Pat<T> {

    public static <T extends CharSequence> Ident<T> of(T name, int line, int column) {
        return new Ident<>(Slice.of(name, line, column));
    }

    public T name() {
        return slice.source();
    }
}
