package com.wrenparser.ast;

public interface BodyVisitor<R> {
    R visitExpressionBody(ExpressionBody body);
    R visitStatementBody(StatementBody body);
}
