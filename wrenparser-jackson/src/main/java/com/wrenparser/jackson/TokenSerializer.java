package com.wrenparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.wrenparser.Token;

import java.io.IOException;

/**
 * Writes a token as its kind label, source text and 1-based start position.
 * The source buffer the token points into is not written.
 */
public class TokenSerializer extends StdSerializer<Token> {

    public TokenSerializer() {
        super(Token.class);
    }

    @Override
    public void serialize(Token token, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("kind", token.kind().label());
        gen.writeStringField("text", token.text());
        gen.writeNumberField("line", token.line());
        gen.writeNumberField("column", token.column());
        gen.writeEndObject();
    }
}
