package com.jsast.ast;

import java.util.List;

public record BlockStatement<T extends CharSequence>(
    List<ProgramPart<T>> body
) implements Statement<T> {

    @Override
    public String type() {
        return "BlockStatement";
    }
}
