package com.jsast.spanned;

import java.util.List;

public record PropMethod<T extends CharSequence>(
    Token staticKeyword,
    Token asyncKeyword,
    PropInitKey<T> id,
    Token star,
    Token openParen,
    List<ListEntry<FuncArg<T>>> params,
    Token closeParen,
    FuncBody<T> body
) implements Prop<T>, PropValue<T> {
    public PropMethod {
        params = List.copyOf(params);
    }
}
