package com.jsast.spanned;

public record ForStmt<T extends CharSequence>(
    Token keyword,
    Token openParen,
    LoopInit<T> init,
    Token firstSemicolon,
    Expr<T> test,
    Token secondSemicolon,
    Expr<T> update,
    Token closeParen,
    Stmt<T> body
) implements Stmt<T> {
}
