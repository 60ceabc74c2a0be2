package com.jsast.spanned;

/**
 * {@code new.target} or {@code import.meta}.
 */
public record MetaProp<T extends CharSequence>(Ident<T> meta, Token period, Ident<T> property) implements Expr<T> {
}
