package com.jsast.ast;

/**
 * A directive prologue entry such as {@code "use strict"}. {@code directive} is the
 * literal's text without quotes and without escape processing.
 */
public record Directive<T extends CharSequence>(
    StringLiteral<T> expression,
    T directive
) implements ProgramPart<T> {

    @Override
    public String type() {
        return "ExpressionStatement";
    }
}
