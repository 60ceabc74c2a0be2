package com.jsast.ast;

public record RestElement<T extends CharSequence>(
    Pattern<T> argument
) implements FunctionParameter<T>, ArrayPatternElement<T>, ObjectPatternPart<T> {

    @Override
    public String type() {
        return "RestElement";
    }
}
