package com.jsast.ast;

/**
 * Literal values, all serialized with the {@code Literal} type.
 */
public sealed interface Literal<T extends CharSequence> extends Expression<T>
    permits NullLiteral, BooleanLiteral, NumberLiteral, StringLiteral, RegExpLiteral {
}
