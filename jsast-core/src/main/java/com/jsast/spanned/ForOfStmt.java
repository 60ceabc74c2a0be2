package com.jsast.spanned;

/**
 * {@code for (left of right)}, or {@code for await (...)} when {@code awaitKeyword} is present.
 */
public record ForOfStmt<T extends CharSequence>(
    Token keyword,
    Token awaitKeyword,
    Token openParen,
    LoopLeft<T> left,
    Token of,
    Expr<T> right,
    Token closeParen,
    Stmt<T> body
) implements Stmt<T> {
}
