package com.jsast.ast;

/**
 * {@code imported as local}; {@code local} is null when no alias was written.
 */
public record ImportSpecifier<T extends CharSequence>(
    Identifier<T> imported,
    Identifier<T> local
) implements ImportClause<T> {

    @Override
    public String type() {
        return "ImportSpecifier";
    }
}
