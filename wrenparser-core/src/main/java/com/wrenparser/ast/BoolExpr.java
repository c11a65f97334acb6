package com.wrenparser.ast;

import com.wrenparser.Token;

public record BoolExpr(
    Token value
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBoolExpr(this);
    }

    @Override
    public String type() {
        return "BoolExpr";
    }
}
