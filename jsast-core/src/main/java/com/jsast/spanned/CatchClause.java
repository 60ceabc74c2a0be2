package com.jsast.spanned;

public record CatchClause<T extends CharSequence>(Token keyword, CatchArg<T> param, BlockStmt<T> body) implements Node {
}
