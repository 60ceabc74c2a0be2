package com.jsast.ast;

import java.util.List;

public record ObjectPattern<T extends CharSequence>(
    List<ObjectPatternPart<T>> properties
) implements Pattern<T> {

    @Override
    public String type() {
        return "ObjectPattern";
    }
}
