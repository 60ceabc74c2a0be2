package com.jsast.spanned;

public record WhileStmt<T extends CharSequence>(
    Token keyword,
    Token openParen,
    Expr<T> test,
    Token closeParen,
    Stmt<T> body
) implements Stmt<T> {
}
