package com.jsast.ast;

/**
 * {@code local as exported}; {@code exported} is null when no alias was written.
 */
public record ExportSpecifier<T extends CharSequence>(
    Identifier<T> local,
    Identifier<T> exported
) implements Node {

    @Override
    public String type() {
        return "ExportSpecifier";
    }
}
