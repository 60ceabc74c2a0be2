package com.jsast.spanned;

public record ClassDef<T extends CharSequence>(
    Token keyword,
    Ident<T> id,
    SuperClass<T> superClass,
    ClassBody<T> body
) implements Decl<T>, Expr<T> {
}
