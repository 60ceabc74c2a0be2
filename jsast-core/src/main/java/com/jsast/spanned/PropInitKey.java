package com.jsast.spanned;

/**
 * A property key, with its brackets when the key is computed.
 */
public record PropInitKey<T extends CharSequence>(
    PropKey<T> value,
    Token openBracket,
    Token closeBracket
) implements Node {

    public PropInitKey(PropKey<T> value) {
        this(value, null, null);
    }

    public boolean isComputed() {
        return openBracket != null;
    }
}
