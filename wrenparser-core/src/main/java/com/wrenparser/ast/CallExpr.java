package com.wrenparser.ast;

import com.wrenparser.Token;

import java.util.List;

public record CallExpr(
    Expr receiver,         // Null for a bare name
    Token name,
    List<Expr> arguments,  // Null for a getter, empty for "()"
    Body blockArgument     // Can be null
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCallExpr(this);
    }

    @Override
    public String type() {
        return "CallExpr";
    }
}
