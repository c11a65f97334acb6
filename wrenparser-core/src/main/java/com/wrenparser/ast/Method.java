package com.wrenparser.ast;

import com.wrenparser.Token;

import java.util.List;

/**
 * A method definition inside a class body.
 *
 * <p>The name may be an operator token for operator overloads, a {@code [}
 * for the subscript operator, or {@code !}/{@code ~} for unary operators.</p>
 */
public record Method(
    Token foreignKeyword,    // Can be null
    Token staticKeyword,     // Can be null
    Token constructKeyword,  // Can be null
    Token name,
    List<Token> parameters,  // Can be null
    Body body                // Null for foreign methods
) implements Node {

    public boolean isForeign() {
        return foreignKeyword != null;
    }

    public boolean isStatic() {
        return staticKeyword != null;
    }

    public boolean isConstructor() {
        return constructKeyword != null;
    }

    @Override
    public String type() {
        return "Method";
    }
}
