package com.jsast.spanned;

public record PropSet<T extends CharSequence>(
    Token staticKeyword,
    Token setKeyword,
    PropInitKey<T> id,
    Token openParen,
    ListEntry<FuncArg<T>> arg,
    Token closeParen,
    FuncBody<T> body
) implements Prop<T> {
}
