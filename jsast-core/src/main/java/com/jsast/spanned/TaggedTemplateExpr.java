package com.jsast.spanned;

public record TaggedTemplateExpr<T extends CharSequence>(Expr<T> tag, TemplateLit<T> quasi) implements Expr<T> {
}
