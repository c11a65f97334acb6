package com.wrenparser.ast;

import com.wrenparser.Token;

import java.util.List;

/**
 * The body of a method or block argument: either a single expression or a
 * sequence of statements, never both.
 */
public sealed interface Body extends Node permits ExpressionBody, StatementBody {

    /** Block parameters, or {@code null} when none were written. */
    List<Token> parameters();

    <R> R accept(BodyVisitor<R> visitor);
}
