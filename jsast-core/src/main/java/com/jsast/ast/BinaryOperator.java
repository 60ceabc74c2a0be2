package com.jsast.ast;

public enum BinaryOperator implements FixedText {
    EQUAL("=="),
    NOT_EQUAL("!="),
    STRICT_EQUAL("==="),
    STRICT_NOT_EQUAL("!=="),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_THAN_EQUAL("<="),
    GREATER_THAN_EQUAL(">="),
    LEFT_SHIFT("<<"),
    RIGHT_SHIFT(">>"),
    UNSIGNED_RIGHT_SHIFT(">>>"),
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    OVER("/"),
    MOD("%"),
    OR("|"),
    XOR("^"),
    AND("&"),
    IN("in"),
    INSTANCE_OF("instanceof"),
    POW("**");

    private final String text;

    BinaryOperator(String text) {
        this.text = text;
    }

    @Override
    public String text() {
        return text;
    }
}
