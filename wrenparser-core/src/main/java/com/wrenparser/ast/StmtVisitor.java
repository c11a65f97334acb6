package com.wrenparser.ast;

public interface StmtVisitor<R> {
    R visitClassStmt(ClassStmt stmt);
    R visitImportStmt(ImportStmt stmt);
    R visitVarStmt(VarStmt stmt);
    R visitIfStmt(IfStmt stmt);
    R visitForStmt(ForStmt stmt);
    R visitWhileStmt(WhileStmt stmt);
    R visitReturnStmt(ReturnStmt stmt);
    R visitBreakStmt(BreakStmt stmt);
    R visitBlockStmt(BlockStmt stmt);
    R visitExpressionStmt(Expr expr);
}
