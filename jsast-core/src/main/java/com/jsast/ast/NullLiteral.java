package com.jsast.ast;

public record NullLiteral<T extends CharSequence>() implements Literal<T> {

    @Override
    public String type() {
        return "Literal";
    }
}
