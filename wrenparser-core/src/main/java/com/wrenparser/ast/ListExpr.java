package com.wrenparser.ast;

import com.wrenparser.Token;

import java.util.List;

public record ListExpr(
    Token leftBracket,
    List<Expr> elements,
    Token rightBracket
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitListExpr(this);
    }

    @Override
    public String type() {
        return "ListExpr";
    }
}
