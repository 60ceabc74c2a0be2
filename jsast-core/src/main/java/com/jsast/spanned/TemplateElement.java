package com.jsast.spanned;

/**
 * One quasi of a template. It opens with a backtick or the brace closing a substitution,
 * and closes with a backtick or the dollar-brace opening the next substitution.
 */
public record TemplateElement<T extends CharSequence>(
    Token openQuote,
    Slice<T> content,
    Token closeQuote
) implements Node {

    public boolean isTail() {
        return closeQuote.is(TokenKind.BACK_TICK);
    }
}
