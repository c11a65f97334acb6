package com.wrenparser.ast;

import com.wrenparser.Token;

import java.util.List;

public record ImportStmt(
    Token importKeyword,
    Token path,
    List<Token> variables  // Null when there is no "for" clause
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitImportStmt(this);
    }

    @Override
    public String type() {
        return "ImportStmt";
    }
}
