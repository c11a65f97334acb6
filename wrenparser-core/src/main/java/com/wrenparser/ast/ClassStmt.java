package com.wrenparser.ast;

import com.wrenparser.Token;

import java.util.List;

public record ClassStmt(
    Token foreignKeyword,  // Can be null
    Token classKeyword,
    Token name,
    Token superclass,      // Can be null
    List<Method> methods
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitClassStmt(this);
    }

    @Override
    public String type() {
        return "ClassStmt";
    }
}
