package com.jsast.spanned;

public record TryStmt<T extends CharSequence>(
    Token keyword,
    BlockStmt<T> block,
    CatchClause<T> handler,
    FinallyClause<T> finalizer
) implements Stmt<T> {
}
