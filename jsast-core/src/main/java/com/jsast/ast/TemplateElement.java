package com.jsast.ast;

/**
 * One quasi of a template; {@code raw} is the source text with escapes untouched.
 */
public record TemplateElement<T extends CharSequence>(
    T raw,
    boolean tail
) implements Node {

    @Override
    public String type() {
        return "TemplateElement";
    }
}
