package com.wrenparser.ast;

import com.wrenparser.Token;

public record GroupingExpr(
    Token leftParen,
    Expr expression,
    Token rightParen
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitGroupingExpr(this);
    }

    @Override
    public String type() {
        return "GroupingExpr";
    }
}
