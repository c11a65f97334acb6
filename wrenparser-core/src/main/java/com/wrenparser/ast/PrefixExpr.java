package com.wrenparser.ast;

import com.wrenparser.Token;

public record PrefixExpr(
    Token operator,
    Expr right
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitPrefixExpr(this);
    }

    @Override
    public String type() {
        return "PrefixExpr";
    }
}
