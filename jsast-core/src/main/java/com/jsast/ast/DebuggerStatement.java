package com.jsast.ast;

public record DebuggerStatement<T extends CharSequence>() implements Statement<T> {

    @Override
    public String type() {
        return "DebuggerStatement";
    }
}
