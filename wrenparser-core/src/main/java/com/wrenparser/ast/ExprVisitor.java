package com.wrenparser.ast;

public interface ExprVisitor<R> {
    R visitListExpr(ListExpr expr);
    R visitMapExpr(MapExpr expr);
    R visitGroupingExpr(GroupingExpr expr);
    R visitThisExpr(ThisExpr expr);
    R visitNullExpr(NullExpr expr);
    R visitBoolExpr(BoolExpr expr);
    R visitNumExpr(NumExpr expr);
    R visitStringExpr(StringExpr expr);
    R visitFieldExpr(FieldExpr expr);
    R visitStaticFieldExpr(StaticFieldExpr expr);
    R visitAssignmentExpr(AssignmentExpr expr);
    R visitConditionalExpr(ConditionalExpr expr);
    R visitInfixExpr(InfixExpr expr);
    R visitPrefixExpr(PrefixExpr expr);
    R visitCallExpr(CallExpr expr);
    R visitSuperExpr(SuperExpr expr);
    R visitSubscriptExpr(SubscriptExpr expr);
    R visitInterpolationExpr(InterpolationExpr expr);
}
