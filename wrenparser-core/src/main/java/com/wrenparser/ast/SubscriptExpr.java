package com.wrenparser.ast;

import com.wrenparser.Token;

import java.util.List;

public record SubscriptExpr(
    Expr receiver,
    Token leftBracket,
    List<Expr> arguments,
    Token rightBracket
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitSubscriptExpr(this);
    }

    @Override
    public String type() {
        return "SubscriptExpr";
    }
}
