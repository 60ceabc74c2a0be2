package com.jsast.ast;

public record TaggedTemplateExpression<T extends CharSequence>(
    Expression<T> tag,
    TemplateLiteral<T> quasi
) implements Expression<T> {

    @Override
    public String type() {
        return "TaggedTemplateExpression";
    }
}
