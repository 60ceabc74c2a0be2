package com.jsast.spanned;

public record ForInStmt<T extends CharSequence>(
    Token keyword,
    Token openParen,
    LoopLeft<T> left,
    Token in,
    Expr<T> right,
    Token closeParen,
    Stmt<T> body
) implements Stmt<T> {
}
