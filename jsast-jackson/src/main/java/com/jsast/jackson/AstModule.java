package com.jsast.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.jsast.ast.Node;

/**
 * Jackson module that writes plain AST nodes as ESTree JSON.
 *
 * Every {@link Node} goes through {@link NodeSerializer}. Boxed numbers written next to
 * a tree, such as counts or values in a surrounding map, use {@link JavaScriptNumberSerializer}
 * so they print the same way as number literals inside it.
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(0, 1, 0, null, "com.jsast", "jsast-jackson"));
        addSerializer(Node.class, new NodeSerializer());
        addSerializer(Number.class, new JavaScriptNumberSerializer());
    }
}
