package com.jsast.spanned;

public record AwaitExpr<T extends CharSequence>(Token keyword, Expr<T> expr) implements Expr<T> {
}
