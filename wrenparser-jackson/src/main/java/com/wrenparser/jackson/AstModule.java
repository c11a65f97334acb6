package com.wrenparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.wrenparser.Token;
import com.wrenparser.ast.*;
import com.wrenparser.ast.Module;

import java.util.List;

/**
 * Jackson module that configures serialization for the AST classes.
 *
 * This module handles:
 * - The "type" property on every node
 * - Token serialization via {@link TokenSerializer}
 * - Null call arguments, which mark a getter and so are always written
 * - The modifier flags of method definitions
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.wrenparser", "wrenparser-jackson"));
        addSerializer(Token.class, new TokenSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Registered on each record: mixins on the sealed interfaces are not
        // reliably inherited by the implementing records.
        context.setMixInAnnotations(Module.class, NodeMixin.class);
        context.setMixInAnnotations(Method.class, MethodMixin.class);
        context.setMixInAnnotations(MapEntry.class, NodeMixin.class);
        context.setMixInAnnotations(ExpressionBody.class, NodeMixin.class);
        context.setMixInAnnotations(StatementBody.class, NodeMixin.class);

        // Statements
        context.setMixInAnnotations(ClassStmt.class, NodeMixin.class);
        context.setMixInAnnotations(ImportStmt.class, NodeMixin.class);
        context.setMixInAnnotations(VarStmt.class, NodeMixin.class);
        context.setMixInAnnotations(IfStmt.class, NodeMixin.class);
        context.setMixInAnnotations(ForStmt.class, NodeMixin.class);
        context.setMixInAnnotations(WhileStmt.class, NodeMixin.class);
        context.setMixInAnnotations(ReturnStmt.class, NodeMixin.class);
        context.setMixInAnnotations(BreakStmt.class, NodeMixin.class);
        context.setMixInAnnotations(BlockStmt.class, NodeMixin.class);

        // Expressions
        context.setMixInAnnotations(ListExpr.class, NodeMixin.class);
        context.setMixInAnnotations(MapExpr.class, NodeMixin.class);
        context.setMixInAnnotations(GroupingExpr.class, NodeMixin.class);
        context.setMixInAnnotations(ThisExpr.class, NodeMixin.class);
        context.setMixInAnnotations(NullExpr.class, NodeMixin.class);
        context.setMixInAnnotations(BoolExpr.class, NodeMixin.class);
        context.setMixInAnnotations(NumExpr.class, NodeMixin.class);
        context.setMixInAnnotations(StringExpr.class, NodeMixin.class);
        context.setMixInAnnotations(FieldExpr.class, NodeMixin.class);
        context.setMixInAnnotations(StaticFieldExpr.class, NodeMixin.class);
        context.setMixInAnnotations(AssignmentExpr.class, NodeMixin.class);
        context.setMixInAnnotations(ConditionalExpr.class, NodeMixin.class);
        context.setMixInAnnotations(InfixExpr.class, NodeMixin.class);
        context.setMixInAnnotations(PrefixExpr.class, NodeMixin.class);
        context.setMixInAnnotations(CallExpr.class, CallMixin.class);
        context.setMixInAnnotations(SuperExpr.class, SuperMixin.class);
        context.setMixInAnnotations(SubscriptExpr.class, NodeMixin.class);
        context.setMixInAnnotations(InterpolationExpr.class, NodeMixin.class);
    }

    // ==================== Serialization Mixins ====================

    @JsonPropertyOrder({"type"})
    private abstract static class NodeMixin {
        @JsonProperty("type")
        abstract String type();
    }

    // A getter call has null arguments, "()" has an empty list
    private abstract static class CallMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract List<Expr> arguments();
    }

    private abstract static class SuperMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract List<Expr> arguments();
    }

    private abstract static class MethodMixin extends NodeMixin {
        @JsonProperty("foreign")
        abstract boolean isForeign();

        @JsonProperty("static")
        abstract boolean isStatic();

        @JsonProperty("construct")
        abstract boolean isConstructor();
    }
}
