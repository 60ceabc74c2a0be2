package com.jsast.ast;

import java.util.List;

/**
 * Either an exported declaration, or a specifier list with an optional source module.
 */
public record ExportNamedDeclaration<T extends CharSequence>(
    Declaration<T> declaration,
    List<ExportSpecifier<T>> specifiers,
    StringLiteral<T> source
) implements Declaration<T> {

    @Override
    public String type() {
        return "ExportNamedDeclaration";
    }
}
