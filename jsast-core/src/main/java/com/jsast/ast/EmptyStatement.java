package com.jsast.ast;

public record EmptyStatement<T extends CharSequence>() implements Statement<T> {

    @Override
    public String type() {
        return "EmptyStatement";
    }
}
