package com.wrenparser.ast;

import com.wrenparser.Token;

import java.util.List;

public record MapExpr(
    Token leftBrace,
    List<MapEntry> entries,
    Token rightBrace
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitMapExpr(this);
    }

    @Override
    public String type() {
        return "MapExpr";
    }
}
