package com.wrenparser.ast;

import com.wrenparser.Token;

public record ConditionalExpr(
    Expr condition,
    Token question,
    Expr thenBranch,
    Token colon,
    Expr elseBranch
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitConditionalExpr(this);
    }

    @Override
    public String type() {
        return "ConditionalExpr";
    }
}
