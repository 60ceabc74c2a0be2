package com.jsast.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.jsast.ast.Node;
import com.jsast.json.AstJsonException;
import com.jsast.json.AstJsonProvider;
import com.jsast.json.AstJsonSerializer;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;

    public JacksonAstJsonProvider() {
        this.mapper = EstreeJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper, for writing to streams or building JsonNode trees.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectWriter compact;
        private final ObjectWriter pretty;

        JacksonSerializer(ObjectMapper mapper) {
            this.compact = mapper.writer();
            this.pretty = mapper.writerWithDefaultPrettyPrinter();
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            return write(compact, node);
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            return write(pretty, node);
        }

        private static String write(ObjectWriter writer, Node node) {
            try {
                return writer.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.type() + " node", e);
            }
        }
    }
}
