package com.jsast.ast;

public enum UpdateOperator implements FixedText {
    INCREMENT("++"),
    DECREMENT("--");

    private final String text;

    UpdateOperator(String text) {
        this.text = text;
    }

    @Override
    public String text() {
        return text;
    }
}
