package com.jsast.spanned;

/**
 * {@code object.property} or {@code object[property]}; exactly one of {@code period}
 * and the bracket pair is present.
 */
public record MemberExpr<T extends CharSequence>(
    Expr<T> object,
    Token period,
    Token openBracket,
    Expr<T> property,
    Token closeBracket
) implements Expr<T> {

    public static <T extends CharSequence> MemberExpr<T> dotted(Expr<T> object, Token period, Expr<T> property) {
        return new MemberExpr<>(object, period, null, property, null);
    }

    public static <T extends CharSequence> MemberExpr<T> computed(
        Expr<T> object, Token openBracket, Expr<T> property, Token closeBracket) {
        return new MemberExpr<>(object, null, openBracket, property, closeBracket);
    }

    public boolean isComputed() {
        return openBracket != null;
    }
}
