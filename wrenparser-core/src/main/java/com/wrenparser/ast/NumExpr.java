package com.wrenparser.ast;

import com.wrenparser.Token;

public record NumExpr(
    Token value
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNumExpr(this);
    }

    @Override
    public String type() {
        return "NumExpr";
    }
}
