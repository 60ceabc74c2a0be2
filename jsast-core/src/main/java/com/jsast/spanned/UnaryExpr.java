package com.jsast.spanned;

import com.jsast.ast.UnaryOperator;

public record UnaryExpr<T extends CharSequence>(
    OperatorToken<UnaryOperator> operator,
    Expr<T> argument
) implements Expr<T> {

    /**
     * True when the operator is written before its argument.
     */
    public boolean isPrefix() {
        return operator.start().compareTo(argument.start()) < 0;
    }
}
