package com.jsast.ast;

import java.util.List;

public record ObjectExpression<T extends CharSequence>(
    List<ObjectMember<T>> properties
) implements Expression<T> {

    @Override
    public String type() {
        return "ObjectExpression";
    }
}
