package com.jsast.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for ObjectMapper instances that write plain AST nodes as ESTree JSON.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = EstreeJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(PlainTreeConverter.convert(program));
 * </pre>
 */
public final class EstreeJackson {

    private EstreeJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper with {@link AstModule} registered.
     *
     * Absent optional children are written as explicit nulls, as ESTree consumers expect.
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new AstModule());
        return mapper;
    }
}
