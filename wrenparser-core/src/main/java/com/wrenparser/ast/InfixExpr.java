package com.wrenparser.ast;

import com.wrenparser.Token;

public record InfixExpr(
    Expr left,
    Token operator,
    Expr right
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitInfixExpr(this);
    }

    @Override
    public String type() {
        return "InfixExpr";
    }
}
