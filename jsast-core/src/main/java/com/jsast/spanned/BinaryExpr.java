package com.jsast.spanned;

import com.jsast.ast.BinaryOperator;

public record BinaryExpr<T extends CharSequence>(
    Expr<T> left,
    OperatorToken<BinaryOperator> operator,
    Expr<T> right
) implements Expr<T> {
}
