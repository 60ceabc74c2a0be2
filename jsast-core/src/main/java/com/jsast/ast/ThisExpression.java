package com.jsast.ast;

public record ThisExpression<T extends CharSequence>() implements Expression<T> {

    @Override
    public String type() {
        return "ThisExpression";
    }
}
