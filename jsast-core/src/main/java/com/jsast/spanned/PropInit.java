package com.jsast.spanned;

/**
 * {@code key: value}, or the shorthand forms {@code key} and {@code key = default}
 * which have no colon.
 */
public record PropInit<T extends CharSequence>(
    PropInitKey<T> key,
    Token colon,
    PropValue<T> value
) implements Prop<T> {

    public boolean isShorthand() {
        return colon == null && !key.isComputed();
    }
}
