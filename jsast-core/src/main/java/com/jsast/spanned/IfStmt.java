package com.jsast.spanned;

public record IfStmt<T extends CharSequence>(
    Token keyword,
    Token openParen,
    Expr<T> test,
    Token closeParen,
    Stmt<T> consequent,
    ElseClause<T> alternate
) implements Stmt<T> {
}
