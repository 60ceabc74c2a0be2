package com.jsast.spanned;

public record PropGet<T extends CharSequence>(
    Token staticKeyword,
    Token getKeyword,
    PropInitKey<T> id,
    Token openParen,
    Token closeParen,
    FuncBody<T> body
) implements Prop<T> {
}
