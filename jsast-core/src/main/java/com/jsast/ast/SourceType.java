package com.jsast.ast;

/**
 * Whether a program was parsed as a classic script or as an ES module.
 */
public enum SourceType implements FixedText {
    SCRIPT("script"),
    MODULE("module");

    private final String text;

    SourceType(String text) {
        this.text = text;
    }

    @Override
    public String text() {
        return text;
    }
}
