package com.wrenparser.ast;

import com.wrenparser.Token;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders a tree as a compact parenthesized expression, for debugging and tests.
 *
 * <p>Examples: {@code 1 + 2 * 3} prints as {@code (+ 1 (* 2 3))}, a bare name
 * such as {@code a} prints as {@code a}, and {@code list.add(1)} prints as
 * {@code (call list add (1))}.</p>
 */
public final class AstPrinter implements StmtVisitor<String>, ExprVisitor<String>, BodyVisitor<String> {

    private static final AstPrinter INSTANCE = new AstPrinter();

    private AstPrinter() {
    }

    public static String print(Module module) {
        return INSTANCE.list("module", module.statements(), INSTANCE::stmt);
    }

    public static String print(Stmt stmt) {
        return INSTANCE.stmt(stmt);
    }

    private String stmt(Stmt stmt) {
        return stmt.accept((StmtVisitor<String>) this);
    }

    private String expr(Expr expr) {
        return expr.accept((ExprVisitor<String>) this);
    }

    // ==================== Statements ====================

    @Override
    public String visitClassStmt(ClassStmt stmt) {
        StringBuilder out = new StringBuilder("(class");
        if (stmt.foreignKeyword() != null) {
            out.append(" foreign");
        }
        out.append(' ').append(stmt.name().text());
        if (stmt.superclass() != null) {
            out.append(" is ").append(stmt.superclass().text());
        }
        for (Method method : stmt.methods()) {
            out.append(' ').append(method(method));
        }
        return out.append(')').toString();
    }

    private String method(Method method) {
        StringBuilder out = new StringBuilder("(method");
        if (method.isForeign()) out.append(" foreign");
        if (method.isStatic()) out.append(" static");
        if (method.isConstructor()) out.append(" construct");
        out.append(' ').append(method.name().text());
        if (method.parameters() != null) {
            out.append(' ').append(names(method.parameters()));
        }
        if (method.body() != null) {
            out.append(' ').append(method.body().accept(this));
        }
        return out.append(')').toString();
    }

    @Override
    public String visitImportStmt(ImportStmt stmt) {
        String path = "(import " + stmt.path().text();
        if (stmt.variables() != null) {
            path += " " + names(stmt.variables());
        }
        return path + ")";
    }

    @Override
    public String visitVarStmt(VarStmt stmt) {
        if (stmt.initializer() == null) {
            return "(var " + stmt.name().text() + ")";
        }
        return "(var " + stmt.name().text() + " " + expr(stmt.initializer()) + ")";
    }

    @Override
    public String visitIfStmt(IfStmt stmt) {
        String out = "(if " + expr(stmt.condition()) + " " + stmt(stmt.thenBranch());
        if (stmt.elseBranch() != null) {
            out += " " + stmt(stmt.elseBranch());
        }
        return out + ")";
    }

    @Override
    public String visitForStmt(ForStmt stmt) {
        return "(for " + stmt.variable().text() + " " + expr(stmt.iterator()) + " " + stmt(stmt.body()) + ")";
    }

    @Override
    public String visitWhileStmt(WhileStmt stmt) {
        return "(while " + expr(stmt.condition()) + " " + stmt(stmt.body()) + ")";
    }

    @Override
    public String visitReturnStmt(ReturnStmt stmt) {
        return stmt.value() == null ? "(return)" : "(return " + expr(stmt.value()) + ")";
    }

    @Override
    public String visitBreakStmt(BreakStmt stmt) {
        return "(break)";
    }

    @Override
    public String visitBlockStmt(BlockStmt stmt) {
        return list("block", stmt.statements(), this::stmt);
    }

    @Override
    public String visitExpressionStmt(Expr expr) {
        return expr(expr);
    }

    // ==================== Bodies ====================
    // Bodies print their content only; block parameters are printed by the call.

    @Override
    public String visitExpressionBody(ExpressionBody body) {
        return stmt(body.expression());
    }

    @Override
    public String visitStatementBody(StatementBody body) {
        return list("block", body.statements(), this::stmt);
    }

    private String blockArgument(Body body) {
        if (body.parameters() == null) {
            return "(fn " + body.accept(this) + ")";
        }
        return "(fn " + names(body.parameters()) + " " + body.accept(this) + ")";
    }

    // ==================== Expressions ====================

    @Override
    public String visitListExpr(ListExpr expr) {
        return list("list", expr.elements(), this::expr);
    }

    @Override
    public String visitMapExpr(MapExpr expr) {
        return list("map", expr.entries(), entry -> "(" + expr(entry.key()) + " " + expr(entry.value()) + ")");
    }

    @Override
    public String visitGroupingExpr(GroupingExpr expr) {
        return "(group " + expr(expr.expression()) + ")";
    }

    @Override
    public String visitThisExpr(ThisExpr expr) {
        return expr.keyword().text();
    }

    @Override
    public String visitNullExpr(NullExpr expr) {
        return "null";
    }

    @Override
    public String visitBoolExpr(BoolExpr expr) {
        return expr.value().text();
    }

    @Override
    public String visitNumExpr(NumExpr expr) {
        return expr.value().text();
    }

    @Override
    public String visitStringExpr(StringExpr expr) {
        return expr.value().text();
    }

    @Override
    public String visitFieldExpr(FieldExpr expr) {
        return expr.name().text();
    }

    @Override
    public String visitStaticFieldExpr(StaticFieldExpr expr) {
        return expr.name().text();
    }

    @Override
    public String visitAssignmentExpr(AssignmentExpr expr) {
        return "(= " + expr(expr.target()) + " " + expr(expr.value()) + ")";
    }

    @Override
    public String visitConditionalExpr(ConditionalExpr expr) {
        return "(? " + expr(expr.condition()) + " " + expr(expr.thenBranch()) + " " + expr(expr.elseBranch()) + ")";
    }

    @Override
    public String visitInfixExpr(InfixExpr expr) {
        return "(" + expr.operator().text() + " " + expr(expr.left()) + " " + expr(expr.right()) + ")";
    }

    @Override
    public String visitPrefixExpr(PrefixExpr expr) {
        return "(" + expr.operator().text() + " " + expr(expr.right()) + ")";
    }

    @Override
    public String visitCallExpr(CallExpr expr) {
        // A bare getter on the implicit receiver reads like a variable.
        if (expr.receiver() == null && expr.arguments() == null && expr.blockArgument() == null) {
            return expr.name().text();
        }

        StringBuilder out = new StringBuilder("(call");
        if (expr.receiver() != null) {
            out.append(' ').append(expr(expr.receiver()));
        }
        out.append(' ').append(expr.name().text());
        appendCallTail(out, expr.arguments(), expr.blockArgument());
        return out.append(')').toString();
    }

    @Override
    public String visitSuperExpr(SuperExpr expr) {
        StringBuilder out = new StringBuilder("(super");
        if (expr.name() != null) {
            out.append(' ').append(expr.name().text());
        }
        appendCallTail(out, expr.arguments(), expr.blockArgument());
        return out.append(')').toString();
    }

    private void appendCallTail(StringBuilder out, List<Expr> arguments, Body blockArgument) {
        if (arguments != null) {
            out.append(' ').append(arguments.stream().map(this::expr).collect(Collectors.joining(" ", "(", ")")));
        }
        if (blockArgument != null) {
            out.append(' ').append(blockArgument(blockArgument));
        }
    }

    @Override
    public String visitSubscriptExpr(SubscriptExpr expr) {
        String arguments = expr.arguments().stream().map(this::expr).collect(Collectors.joining(" "));
        return "(subscript " + expr(expr.receiver()) + " " + arguments + ")";
    }

    @Override
    public String visitInterpolationExpr(InterpolationExpr expr) {
        StringBuilder out = new StringBuilder("(interpolate");
        List<Token> strings = expr.strings();
        for (int i = 0; i < expr.expressions().size(); i++) {
            out.append(' ').append(strings.get(i).text());
            out.append(' ').append(expr(expr.expressions().get(i)));
        }
        out.append(' ').append(strings.get(strings.size() - 1).text());
        return out.append(')').toString();
    }

    // ==================== Helpers ====================

    private static String names(List<Token> tokens) {
        return tokens.stream().map(Token::text).collect(Collectors.joining(" ", "(", ")"));
    }

    private <T> String list(String head, List<T> items, Function<T, String> render) {
        StringBuilder out = new StringBuilder("(").append(head);
        for (T item : items) {
            out.append(' ').append(render.apply(item));
        }
        return out.append(')').toString();
    }
}
