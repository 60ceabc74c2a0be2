package com.jsast.ast;

import java.util.List;

/**
 * {@code expression} is true when the body is a bare expression rather than a block.
 */
public record ArrowFunctionExpression<T extends CharSequence>(
    List<FunctionParameter<T>> params,
    ArrowBody<T> body,
    boolean expression,
    boolean async
) implements Expression<T> {

    @Override
    public String type() {
        return "ArrowFunctionExpression";
    }
}
