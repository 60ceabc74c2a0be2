package com.jsast.ast;

public enum LogicalOperator implements FixedText {
    OR("||"),
    AND("&&"),
    NULLISH_COALESCING("??");

    private final String text;

    LogicalOperator(String text) {
        this.text = text;
    }

    @Override
    public String text() {
        return text;
    }
}
