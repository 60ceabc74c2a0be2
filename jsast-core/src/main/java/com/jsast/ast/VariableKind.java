package com.jsast.ast;

public enum VariableKind implements FixedText {
    VAR("var"),
    LET("let"),
    CONST("const");

    private final String text;

    VariableKind(String text) {
        this.text = text;
    }

    @Override
    public String text() {
        return text;
    }
}
