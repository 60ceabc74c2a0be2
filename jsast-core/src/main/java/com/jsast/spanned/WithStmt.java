package com.jsast.spanned;

public record WithStmt<T extends CharSequence>(
    Token keyword,
    Token openParen,
    Expr<T> object,
    Token closeParen,
    Stmt<T> body
) implements Stmt<T> {
}
