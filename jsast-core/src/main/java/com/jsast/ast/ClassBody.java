package com.jsast.ast;

import java.util.List;

public record ClassBody<T extends CharSequence>(
    List<Property<T>> body
) implements Node {

    @Override
    public String type() {
        return "ClassBody";
    }
}
