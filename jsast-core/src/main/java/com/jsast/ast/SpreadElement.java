package com.jsast.ast;

public record SpreadElement<T extends CharSequence>(
    Expression<T> argument
) implements Expression<T>, ObjectMember<T> {

    @Override
    public String type() {
        return "SpreadElement";
    }
}
