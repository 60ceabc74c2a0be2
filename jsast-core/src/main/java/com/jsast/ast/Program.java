package com.jsast.ast;

import java.util.List;

/**
 * The root of a plain tree.
 */
public record Program<T extends CharSequence>(
    List<ProgramPart<T>> body,
    SourceType sourceType
) implements Node {

    @Override
    public String type() {
        return "Program";
    }
}
