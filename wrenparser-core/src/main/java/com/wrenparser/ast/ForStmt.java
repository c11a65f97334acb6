package com.wrenparser.ast;

import com.wrenparser.Token;

public record ForStmt(
    Token forKeyword,
    Token variable,
    Expr iterator,
    Stmt body
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitForStmt(this);
    }

    @Override
    public String type() {
        return "ForStmt";
    }
}
