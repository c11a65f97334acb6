package com.wrenparser.ast;

import com.wrenparser.Token;

import java.util.List;

public record SuperExpr(
    Token keyword,
    Token name,            // Can be null
    List<Expr> arguments,  // Null for a getter, empty for "()"
    Body blockArgument     // Can be null
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitSuperExpr(this);
    }

    @Override
    public String type() {
        return "SuperExpr";
    }
}
