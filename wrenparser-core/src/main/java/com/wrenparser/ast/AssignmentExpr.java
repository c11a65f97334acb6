package com.wrenparser.ast;

import com.wrenparser.Token;

/**
 * {@code target = value}. Any expression is accepted as the target here.
 */
public record AssignmentExpr(
    Expr target,
    Token equal,
    Expr value
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitAssignmentExpr(this);
    }

    @Override
    public String type() {
        return "AssignmentExpr";
    }
}
