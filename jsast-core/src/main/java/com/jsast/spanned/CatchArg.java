package com.jsast.spanned;

public record CatchArg<T extends CharSequence>(Token openParen, Pat<T> param, Token closeParen) implements Node {
}
