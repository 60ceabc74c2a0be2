package com.jsast.spanned;

import com.jsast.ast.FixedText;
import com.jsast.spanned.SourceLocation.Position;

import java.util.Objects;

/**
 * An operator or declaration keyword whose value matters to the plain tree.
 *
 * @param <O> one of the operator enums, or {@link com.jsast.ast.VariableKind}
 */
public record OperatorToken<O extends FixedText>(O operator, Position start) implements Node {

    public OperatorToken {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(start, "start");
    }

    public static <O extends FixedText> OperatorToken<O> of(O operator, int line, int column) {
        return new OperatorToken<>(operator, new Position(line, column));
    }

    @Override
    public Position end() {
        return start.plusColumns(operator.text().length());
    }

    @Override
    public SourceLocation loc() {
        return new SourceLocation(start, end());
    }
}
