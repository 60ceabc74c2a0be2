package com.jsast.ast;

public record LabeledStatement<T extends CharSequence>(
    Identifier<T> label,
    Statement<T> body
) implements Statement<T> {

    @Override
    public String type() {
        return "LabeledStatement";
    }
}
