package com.jsast.ast;

public enum AssignOperator implements FixedText {
    EQUAL("="),
    PLUS_EQUAL("+="),
    MINUS_EQUAL("-="),
    TIMES_EQUAL("*="),
    DIV_EQUAL("/="),
    MOD_EQUAL("%="),
    LEFT_SHIFT_EQUAL("<<="),
    RIGHT_SHIFT_EQUAL(">>="),
    UNSIGNED_RIGHT_SHIFT_EQUAL(">>>="),
    OR_EQUAL("|="),
    XOR_EQUAL("^="),
    AND_EQUAL("&="),
    POW_EQUAL("**="),
    LOGICAL_AND_EQUAL("&&="),
    LOGICAL_OR_EQUAL("||="),
    NULLISH_EQUAL("??=");

    private final String text;

    AssignOperator(String text) {
        this.text = text;
    }

    @Override
    public String text() {
        return text;
    }
}
