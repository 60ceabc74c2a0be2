package com.jsast.spanned;

/**
 * A parenthesized expression. Only the spanned tree keeps the parens.
 */
public record WrappedExpr<T extends CharSequence>(Token openParen, Expr<T> expr, Token closeParen) implements Expr<T> {
}
