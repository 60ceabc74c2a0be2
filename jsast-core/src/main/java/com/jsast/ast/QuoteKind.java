package com.jsast.ast;

public enum QuoteKind implements FixedText {
    DOUBLE("\""),
    SINGLE("'");

    private final String text;

    QuoteKind(String text) {
        this.text = text;
    }

    @Override
    public String text() {
        return text;
    }
}
