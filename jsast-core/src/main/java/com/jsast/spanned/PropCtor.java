package com.jsast.spanned;

import java.util.List;

/**
 * A class {@code constructor}; {@code keyword} is the key naming it.
 */
public record PropCtor<T extends CharSequence>(
    PropInitKey<T> keyword,
    Token openParen,
    List<ListEntry<FuncArg<T>>> params,
    Token closeParen,
    FuncBody<T> body
) implements Prop<T> {
    public PropCtor {
        params = List.copyOf(params);
    }
}
