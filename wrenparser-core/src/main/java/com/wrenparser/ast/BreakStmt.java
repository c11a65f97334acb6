package com.wrenparser.ast;

import com.wrenparser.Token;

public record BreakStmt(
    Token keyword
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitBreakStmt(this);
    }

    @Override
    public String type() {
        return "BreakStmt";
    }
}
