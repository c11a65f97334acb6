package com.wrenparser.ast;

import com.wrenparser.Token;

import java.util.List;

/**
 * A string with embedded {@code %(...)} expressions. The string segments
 * surround the expressions, so there is always one more segment than there
 * are expressions.
 */
public record InterpolationExpr(
    List<Token> strings,
    List<Expr> expressions
) implements Expr {
    public InterpolationExpr {
        if (strings.size() != expressions.size() + 1) {
            throw new IllegalArgumentException(
                "Expected " + (expressions.size() + 1) + " string segments but got " + strings.size());
        }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitInterpolationExpr(this);
    }

    @Override
    public String type() {
        return "InterpolationExpr";
    }
}
