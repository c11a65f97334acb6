package com.wrenparser.ast;

import com.wrenparser.Token;

import java.util.List;

public record StatementBody(
    List<Token> parameters,  // Can be null
    List<Stmt> statements
) implements Body {
    @Override
    public <R> R accept(BodyVisitor<R> visitor) {
        return visitor.visitStatementBody(this);
    }

    @Override
    public String type() {
        return "StatementBody";
    }
}
