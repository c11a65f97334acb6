package com.wrenparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for creating properly configured ObjectMapper instances for AST serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = WrenParserJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(Parser.parse("main.wren", text).module());
 * </pre>
 */
public final class WrenParserJackson {

    private WrenParserJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for AST serialization.
     *
     * The returned mapper:
     * - Writes a "type" property on every node
     * - Writes tokens as {kind, text, line, column} objects
     * - Leaves out absent optional parts, except call arguments where null and empty differ
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Exclude null values by default
        // Call arguments are included even when null via mixins in AstModule
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
