package com.wrenparser.ast;

import com.wrenparser.Token;

import java.util.List;

public record BlockStmt(
    Token leftBrace,
    List<Stmt> statements,
    Token rightBrace
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitBlockStmt(this);
    }

    @Override
    public String type() {
        return "BlockStmt";
    }
}
