package com.jsast.ast;

import java.util.List;

public record TemplateLiteral<T extends CharSequence>(
    List<TemplateElement<T>> quasis,
    List<Expression<T>> expressions
) implements Expression<T> {

    @Override
    public String type() {
        return "TemplateLiteral";
    }
}
