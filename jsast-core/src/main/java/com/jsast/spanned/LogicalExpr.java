package com.jsast.spanned;

import com.jsast.ast.LogicalOperator;

public record LogicalExpr<T extends CharSequence>(
    Expr<T> left,
    OperatorToken<LogicalOperator> operator,
    Expr<T> right
) implements Expr<T> {
}
