package com.jsast.spanned;

/**
 * {@code left = default} in a binding position.
 */
public record AssignPat<T extends CharSequence>(Pat<T> left, Token eq, Expr<T> right) implements Pat<T> {
}
