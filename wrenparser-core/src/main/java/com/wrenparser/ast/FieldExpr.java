package com.wrenparser.ast;

import com.wrenparser.Token;

public record FieldExpr(
    Token name
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitFieldExpr(this);
    }

    @Override
    public String type() {
        return "FieldExpr";
    }
}
