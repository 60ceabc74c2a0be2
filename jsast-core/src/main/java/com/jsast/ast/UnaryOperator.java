package com.jsast.ast;

public enum UnaryOperator implements FixedText {
    MINUS("-"),
    PLUS("+"),
    NOT("!"),
    TILDE("~"),
    TYPE_OF("typeof"),
    VOID("void"),
    DELETE("delete");

    private final String text;

    UnaryOperator(String text) {
        this.text = text;
    }

    @Override
    public String text() {
        return text;
    }
}
