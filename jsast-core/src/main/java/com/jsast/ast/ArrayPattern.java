package com.jsast.ast;

import java.util.List;

/**
 * Elided elements are null entries of {@code elements}.
 */
public record ArrayPattern<T extends CharSequence>(
    List<ArrayPatternElement<T>> elements
) implements Pattern<T> {

    @Override
    public String type() {
        return "ArrayPattern";
    }
}
