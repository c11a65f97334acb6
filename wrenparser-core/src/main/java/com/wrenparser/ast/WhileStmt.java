package com.wrenparser.ast;

import com.wrenparser.Token;

public record WhileStmt(
    Token whileKeyword,
    Expr condition,
    Stmt body
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitWhileStmt(this);
    }

    @Override
    public String type() {
        return "WhileStmt";
    }
}
