package com.wrenparser.ast;

import com.wrenparser.Token;

import java.util.List;

/**
 * A one-line body such as {@code { a + b }}. The single entry may also be one
 * of the statements that read as an expression on one line, e.g. {@code return 1}.
 */
public record ExpressionBody(
    List<Token> parameters,  // Can be null
    Stmt expression
) implements Body {
    @Override
    public <R> R accept(BodyVisitor<R> visitor) {
        return visitor.visitExpressionBody(this);
    }

    @Override
    public String type() {
        return "ExpressionBody";
    }
}
