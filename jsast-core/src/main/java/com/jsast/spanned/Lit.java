package com.jsast.spanned;

/**
 * Literal values. String, regex and template literals have their own files.
 */
public sealed interface Lit<T extends CharSequence> extends Expr<T>
    permits Lit.Null, Lit.Bool, Lit.Num, StringLit, RegExLit, TemplateLit {

    record Null<T extends CharSequence>(Token keyword) implements Lit<T> {
    }

    /** {@code true} or {@code false}, told apart by the token kind. */
    record Bool<T extends CharSequence>(Token keyword) implements Lit<T> {

        public boolean value() {
            return keyword.is(TokenKind.TRUE);
        }
    }

    /** A numeric literal, kept as its raw source text. */
    record Num<T extends CharSequence>(Slice<T> raw) implements Lit<T> {

        public static <T extends CharSequence> Num<T> of(T raw, int line, int column) {
            return new Num<>(Slice.of(raw, line, column));
        }
    }
}
