package com.wrenparser.ast;

public record MapEntry(Expr key, Expr value) implements Node {
    @Override
    public String type() {
        return "MapEntry";
    }
}
