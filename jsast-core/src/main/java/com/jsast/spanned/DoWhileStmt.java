package com.jsast.spanned;

public record DoWhileStmt<T extends CharSequence>(
    Token doKeyword,
    Stmt<T> body,
    Token whileKeyword,
    Token openParen,
    Expr<T> test,
    Token closeParen,
    Token semicolon
) implements Stmt<T> {
}
