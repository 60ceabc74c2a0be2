package com.jsast.ast;

public record MetaProperty<T extends CharSequence>(
    Identifier<T> meta,
    Identifier<T> property
) implements Expression<T> {

    @Override
    public String type() {
        return "MetaProperty";
    }
}
