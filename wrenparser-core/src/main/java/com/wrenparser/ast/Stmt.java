package com.wrenparser.ast;

/**
 * A statement. Every expression is also a statement.
 */
public sealed interface Stmt extends Node permits
    ClassStmt,
    ImportStmt,
    VarStmt,
    IfStmt,
    ForStmt,
    WhileStmt,
    ReturnStmt,
    BreakStmt,
    BlockStmt,
    Expr {

    <R> R accept(StmtVisitor<R> visitor);
}
