package com.jsast.ast;

public record ExportDefaultDeclaration<T extends CharSequence>(
    DefaultExportable<T> declaration
) implements Declaration<T> {

    @Override
    public String type() {
        return "ExportDefaultDeclaration";
    }
}
