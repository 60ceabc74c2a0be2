package com.jsast.spanned;

/**
 * {@code yield}, {@code yield value} or {@code yield* value}.
 */
public record YieldExpr<T extends CharSequence>(Token keyword, Token star, Expr<T> argument) implements Expr<T> {
}
