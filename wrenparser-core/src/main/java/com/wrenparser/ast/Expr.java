package com.wrenparser.ast;

public sealed interface Expr extends Stmt permits
    ListExpr,
    MapExpr,
    GroupingExpr,
    ThisExpr,
    NullExpr,
    BoolExpr,
    NumExpr,
    StringExpr,
    FieldExpr,
    StaticFieldExpr,
    AssignmentExpr,
    ConditionalExpr,
    InfixExpr,
    PrefixExpr,
    CallExpr,
    SuperExpr,
    SubscriptExpr,
    InterpolationExpr {

    <R> R accept(ExprVisitor<R> visitor);

    // Used as a statement, an expression is visited as an expression statement.
    @Override
    default <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitExpressionStmt(this);
    }
}
