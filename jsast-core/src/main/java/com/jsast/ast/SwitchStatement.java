package com.jsast.ast;

import java.util.List;

public record SwitchStatement<T extends CharSequence>(
    Expression<T> discriminant,
    List<SwitchCase<T>> cases
) implements Statement<T> {

    @Override
    public String type() {
        return "SwitchStatement";
    }
}
