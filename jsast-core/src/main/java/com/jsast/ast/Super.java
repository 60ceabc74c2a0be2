package com.jsast.ast;

public record Super<T extends CharSequence>() implements Expression<T> {

    @Override
    public String type() {
        return "Super";
    }
}
