package com.jsast.ast;

import java.util.List;

/**
 * A {@code case}; the {@code default} case has a null test.
 */
public record SwitchCase<T extends CharSequence>(
    Expression<T> test,
    List<ProgramPart<T>> consequent
) implements Node {

    @Override
    public String type() {
        return "SwitchCase";
    }
}
