package com.wrenparser.ast;

import com.wrenparser.Token;

public record StaticFieldExpr(
    Token name
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitStaticFieldExpr(this);
    }

    @Override
    public String type() {
        return "StaticFieldExpr";
    }
}
