package com.wrenparser.ast;

import com.wrenparser.Token;

public record ThisExpr(
    Token keyword
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitThisExpr(this);
    }

    @Override
    public String type() {
        return "ThisExpr";
    }
}
