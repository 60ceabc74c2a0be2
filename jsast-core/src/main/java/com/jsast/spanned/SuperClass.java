package com.jsast.spanned;

public record SuperClass<T extends CharSequence>(Token extendsKeyword, Expr<T> expr) implements Node {
}
