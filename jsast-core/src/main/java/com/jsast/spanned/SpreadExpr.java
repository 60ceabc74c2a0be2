package com.jsast.spanned;

public record SpreadExpr<T extends CharSequence>(Token ellipsis, Expr<T> expr) implements Expr<T>, ObjProp<T> {
}
