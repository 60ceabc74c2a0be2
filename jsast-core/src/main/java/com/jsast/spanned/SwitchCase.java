package com.jsast.spanned;

import java.util.List;

/**
 * {@code case test:} or {@code default:} followed by its statements. A default case has no test.
 */
public record SwitchCase<T extends CharSequence>(
    Token keyword,
    Expr<T> test,
    Token colon,
    List<ProgramPart<T>> consequent
) implements Node {
    public SwitchCase {
        consequent = List.copyOf(consequent);
    }
}
