package com.wrenparser.ast;

import com.wrenparser.Token;

public record ReturnStmt(
    Token keyword,
    Expr value  // Can be null
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitReturnStmt(this);
    }

    @Override
    public String type() {
        return "ReturnStmt";
    }
}
