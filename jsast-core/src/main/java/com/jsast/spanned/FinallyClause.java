package com.jsast.spanned;

public record FinallyClause<T extends CharSequence>(Token keyword, BlockStmt<T> body) implements Node {
}
