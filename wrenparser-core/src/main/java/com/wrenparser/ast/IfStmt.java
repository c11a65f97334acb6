package com.wrenparser.ast;

import com.wrenparser.Token;

public record IfStmt(
    Token ifKeyword,
    Expr condition,
    Stmt thenBranch,
    Token elseKeyword,  // Can be null
    Stmt elseBranch     // Can be null
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitIfStmt(this);
    }

    @Override
    public String type() {
        return "IfStmt";
    }
}
