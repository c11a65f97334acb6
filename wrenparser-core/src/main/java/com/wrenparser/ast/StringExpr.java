package com.wrenparser.ast;

import com.wrenparser.Token;

public record StringExpr(
    Token value
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitStringExpr(this);
    }

    @Override
    public String type() {
        return "StringExpr";
    }
}
