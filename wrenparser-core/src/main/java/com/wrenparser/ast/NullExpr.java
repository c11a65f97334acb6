package com.wrenparser.ast;

import com.wrenparser.Token;

public record NullExpr(
    Token value
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNullExpr(this);
    }

    @Override
    public String type() {
        return "NullExpr";
    }
}
