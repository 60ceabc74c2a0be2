package com.jsast.ast;

/**
 * The kind of an object or class member. Object literal methods serialize as {@code init}.
 */
public enum PropertyKind implements FixedText {
    INIT("init"),
    METHOD("method"),
    CONSTRUCTOR("constructor"),
    GET("get"),
    SET("set");

    private final String text;

    PropertyKind(String text) {
        this.text = text;
    }

    @Override
    public String text() {
        return text;
    }
}
