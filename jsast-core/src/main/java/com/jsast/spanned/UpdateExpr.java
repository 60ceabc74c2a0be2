package com.jsast.spanned;

import com.jsast.ast.UpdateOperator;

public record UpdateExpr<T extends CharSequence>(
    OperatorToken<UpdateOperator> operator,
    Expr<T> argument
) implements Expr<T> {

    /**
     * True for {@code ++x}, false for {@code x++}.
     */
    public boolean isPrefix() {
        return operator.start().compareTo(argument.start()) < 0;
    }
}
