package com.wrenparser.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.wrenparser.ast.Node;
import com.wrenparser.json.AstJsonException;
import com.wrenparser.json.AstJsonProvider;
import com.wrenparser.json.AstJsonSerializer;

/**
 * Writes Wren syntax trees with a mapper from {@link WrenParserJackson}.
 * Listed in {@code META-INF/services}, so {@link AstJsonProvider#getProvider()}
 * finds it whenever this module is on the classpath.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;

    public JacksonAstJsonProvider() {
        this.mapper = WrenParserJackson.createObjectMapper();
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
     * The mapper behind the serializer, for reading the output back as a
     * {@code JsonNode} tree or writing to a stream.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectWriter compact;
        private final ObjectWriter pretty;

        JacksonSerializer(ObjectMapper mapper) {
            this.compact = mapper.writer();
            this.pretty = mapper.writerWithDefaultPrettyPrinter();
        }

        @Override
        public String serialize(Node node) {
            return write(compact, node);
        }

        @Override
        public String serializePretty(Node node) {
            return write(pretty, node);
        }

        private static String write(ObjectWriter writer, Node node) {
            try {
                return writer.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Cannot write " + node.type() + " as JSON", e);
            }
        }
    }
}
