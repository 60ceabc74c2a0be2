package com.jsast.spanned;

/**
 * {@code as name}
 */
public record Alias<T extends CharSequence>(Token as, Ident<T> ident) implements Node {
}
