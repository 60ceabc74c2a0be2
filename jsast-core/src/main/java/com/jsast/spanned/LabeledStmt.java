package com.jsast.spanned;

public record LabeledStmt<T extends CharSequence>(Ident<T> label, Token colon, Stmt<T> body) implements Stmt<T> {
}
