package com.jsast.ast;

import java.util.List;

/**
 * The block of a function. Its leading directives are already split out.
 */
public record FunctionBody<T extends CharSequence>(
    List<ProgramPart<T>> body
) implements ArrowBody<T> {

    @Override
    public String type() {
        return "BlockStatement";
    }
}
