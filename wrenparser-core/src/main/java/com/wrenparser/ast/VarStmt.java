package com.wrenparser.ast;

import com.wrenparser.Token;

public record VarStmt(
    Token varKeyword,
    Token name,
    Expr initializer  // Can be null
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitVarStmt(this);
    }

    @Override
    public String type() {
        return "VarStmt";
    }
}
