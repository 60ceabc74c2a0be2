package com.jsast.spanned;

/**
 * {@code test ? consequent : alternate}. The consequent is the branch taken when the test
 * holds, matching ESTree.
 */
public record ConditionalExpr<T extends CharSequence>(
    Expr<T> test,
    Token questionMark,
    Expr<T> consequent,
    Token colon,
    Expr<T> alternate
) implements Expr<T> {
}
