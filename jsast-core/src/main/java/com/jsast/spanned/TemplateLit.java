package com.jsast.spanned;

import java.util.List;

/**
 * A template literal. There is always one more quasi than there are expressions.
 */
public record TemplateLit<T extends CharSequence>(
    List<TemplateElement<T>> quasis,
    List<Expr<T>> expressions
) implements Lit<T> {
    public TemplateLit {
        quasis = List.copyOf(quasis);
        expressions = List.copyOf(expressions);
    }
}
