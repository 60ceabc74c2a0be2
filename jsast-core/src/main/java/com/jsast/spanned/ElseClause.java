package com.jsast.spanned;

public record ElseClause<T extends CharSequence>(Token keyword, Stmt<T> body) implements Node {
}
