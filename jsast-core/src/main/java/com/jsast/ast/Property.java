package com.jsast.ast;

/**
 * A member of an object literal, object pattern or class body.
 *
 * <p>{@code value} is null for a shorthand member, whose value is its key. Methods, getters,
 * setters and constructors carry a {@link FunctionExpression} value.</p>
 */
public record Property<T extends CharSequence>(
    PropertyKey<T> key,
    PropertyValue<T> value,
    PropertyKind kind,
    boolean method,
    boolean computed,
    boolean shorthand,
    boolean isStatic
) implements ObjectMember<T>, ObjectPatternPart<T> {

    @Override
    public String type() {
        return "Property";
    }
}
