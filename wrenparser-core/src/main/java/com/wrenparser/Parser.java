package com.wrenparser;

import com.wrenparser.ast.*;
import com.wrenparser.ast.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.wrenparser.TokenKind.*;

/**
 * Recursive descent parser with one token of lookahead.
 *
 * <pre>
 *  module      = line* ( definition ( line+ definition )* )? line* eof
 *  definition  = classDef | "foreign" classDef | importStmt | varStmt | statement
 *  classDef    = "class" name ( "is" name )? "{" ( method line+ )* "}"
 *  method      = "foreign"? "static"? "construct"? methodName ( "(" params? ")" )? body?
 *  methodName  = name | infixOperator | "!" | "~" | "[" params "]"
 *  statement   = "break" | ifStmt | forStmt | whileStmt | returnStmt | block | expression
 *  body        = "{" ( "}" | expression "}" | line+ ( definition line+ )* "}" )
 *  expression  = assignment
 *  assignment  = conditional ( "=" assignment )?
 *  conditional = logicalOr ( "?" conditional ":" assignment )?
 *  binary      = prefix ( infixOperator prefix )*   see BINARY_PRECEDENCE
 *  prefix      = ( "-" | "!" | "~" )* call
 *  call        = primary ( "[" arguments "]" | "." name callTail )*
 *  callTail    = ( "(" arguments? ")" )? ( "{" ( "|" params "|" )? body )?
 * </pre>
 *
 * <p>The parser never throws on malformed input. Each mismatch is recorded as
 * a {@link Problem} and parsing carries on with whatever token was found, so
 * the result is always a complete tree. There is no resynchronization, so one
 * missing token can lead to further problems later in the same construct.</p>
 *
 * <p>Brackets, blocks and interpolations nest at most {@link #MAX_NESTING}
 * deep. A construct that would go deeper is reported and skipped up to its
 * matching closer, which keeps recursion bounded on any input.</p>
 */
public class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    /** Deepest allowed nesting of brackets, blocks and string interpolations. */
    public static final int MAX_NESTING = 64;

    // ========================================================================
    // Binary operators, one row per precedence level, loosest first.
    // Every level is left-associative.
    // ========================================================================
    private static final TokenKind[][] BINARY_PRECEDENCE = {
        {PIPE_PIPE},
        {AMP_AMP},
        {EQUAL_EQUAL, BANG_EQUAL},
        {IS},
        {LESS, LESS_EQUAL, GREATER, GREATER_EQUAL},
        {PIPE},
        {CARET},
        {AMP},
        {LESS_LESS, GREATER_GREATER},
        {DOT_DOT, DOT_DOT_DOT},
        {PLUS, MINUS},
        {STAR, SLASH, PERCENT}
    };

    private static final TokenKind[] PREFIX_OPERATORS = {MINUS, BANG, TILDE};

    // Every binary operator, all of which can be overloaded by a method
    private static final TokenKind[] INFIX_OPERATORS = {
        PIPE_PIPE, AMP_AMP,
        EQUAL_EQUAL, BANG_EQUAL,
        IS,
        LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
        PIPE, CARET, AMP,
        LESS_LESS, GREATER_GREATER,
        DOT_DOT, DOT_DOT_DOT,
        PLUS, MINUS,
        STAR, SLASH, PERCENT
    };

    private final Lexer lexer;
    private final List<Problem> problems = new ArrayList<>();

    // The lookahead token, or null once consumed until the next one is read
    private Token current;
    private Token previous;

    // Brackets, blocks and interpolations currently open
    private int nesting = 0;

    public Parser(Lexer lexer) {
        this.lexer = lexer;
        this.current = lexer.readToken();
    }

    public static ParseResult parse(String path, String text) {
        return parse(new SourceBuffer(path, text));
    }

    public static ParseResult parse(SourceBuffer source) {
        return parse(source, false);
    }

    public static ParseResult parse(SourceBuffer source, boolean strictLiterals) {
        long startNanos = System.nanoTime();
        Parser parser = new Parser(new Lexer(source, strictLiterals));
        Module module = parser.parseModule();
        if (logger.isDebugEnabled()) {
            logger.debug("Parsed {}: {} top-level statement(s), {} problem(s) in {} us",
                    source.id(), module.statements().size(), parser.problems.size(),
                    (System.nanoTime() - startNanos) / 1000);
        }
        return new ParseResult(module, parser.problems);
    }

    /**
     * Problems recorded so far, in the order they were found.
     */
    public List<Problem> problems() {
        return Collections.unmodifiableList(problems);
    }

    public Module parseModule() {
        ignoreLine();

        List<Stmt> statements = new ArrayList<>();
        while (peek() != EOF) {
            statements.add(definition());
            if (peek() == EOF) {
                break;
            }

            consumeLine("Expect newline.");
        }

        consume(EOF, "Expect end of input.");
        return new Module(statements);
    }

    // ========================================================================
    // Definitions and statements
    // ========================================================================

    private Stmt definition() {
        if (match(CLASS)) {
            return finishClass(null);
        }

        if (match(FOREIGN)) {
            Token foreignKeyword = previous;
            consume(CLASS, "Expect 'class' after 'foreign'.");
            return finishClass(foreignKeyword);
        }

        if (match(IMPORT)) {
            return finishImport();
        }

        if (match(VAR)) {
            Token varKeyword = previous;
            Token name = consume(NAME, "Expect variable name.");
            Expr initializer = null;
            if (match(EQUAL)) {
                initializer = expression();
            }
            return new VarStmt(varKeyword, name, initializer);
        }

        return statement();
    }

    private ImportStmt finishImport() {
        Token importKeyword = previous;
        Token path = consume(STRING, "Expect import path.");

        List<Token> variables = null;
        if (match(FOR)) {
            variables = new ArrayList<>();
            do {
                ignoreLine();
                variables.add(consume(NAME, "Expect imported variable name."));
            } while (match(COMMA));
        }

        return new ImportStmt(importKeyword, path, variables);
    }

    // Parses the rest of a class definition after the "class" keyword.
    private ClassStmt finishClass(Token foreignKeyword) {
        Token classKeyword = previous;
        Token name = consume(NAME, "Expect class name.");

        Token superclass = null;
        if (match(IS)) {
            superclass = consume(NAME, "Expect name of superclass.");
        }

        List<Method> methods = new ArrayList<>();
        consume(LEFT_BRACE, "Expect '{' after class name.");
        ignoreLine();

        while (!match(RIGHT_BRACE)) {
            if (peek() == EOF) {
                error("Expect '}' after class body.");
                break;
            }

            // Already reported when consumed.
            if (match(ERROR)) {
                continue;
            }

            methods.add(method());

            // The last definition may be followed directly by "}".
            if (match(RIGHT_BRACE)) {
                break;
            }

            consumeLine("Expect newline after definition in class.");
        }

        return new ClassStmt(foreignKeyword, classKeyword, name, superclass, methods);
    }

    // Accepts some modifier combinations that are not meaningful, such as
    // "static construct"; those are left for later stages to reject.
    private Method method() {
        Token foreignKeyword = match(FOREIGN) ? previous : null;
        Token staticKeyword = match(STATIC) ? previous : null;
        Token constructKeyword = match(CONSTRUCT) ? previous : null;

        Token name;
        List<Token> parameters = null;
        boolean allowParameters;

        if (match(LEFT_BRACKET)) {
            // Subscript operator
            name = previous;
            parameters = parameterList();
            consume(RIGHT_BRACKET, "Expect ']' after parameters.");
            allowParameters = false;
        } else if (match(INFIX_OPERATORS)) {
            name = previous;
            allowParameters = true;
        } else if (match(BANG, TILDE)) {
            name = previous;
            allowParameters = false;
        } else {
            name = consume(NAME, "Expect method name.");
            allowParameters = true;
        }

        if (match(LEFT_PAREN)) {
            if (!allowParameters) {
                error("A parameter list is not allowed for this method.");
            }

            // Parsed even when not allowed so the rest of the method reads cleanly.
            List<Token> parenthesized = new ArrayList<>();
            ignoreLine();
            if (!match(RIGHT_PAREN)) {
                parenthesized = parameterList();
                ignoreLine();
                consume(RIGHT_PAREN, "Expect ')' after parameters.");
            }

            if (allowParameters) {
                parameters = parenthesized;
            }
        }

        Body body = null;
        if (foreignKeyword == null) {
            consume(LEFT_BRACE, "Expect '{' before method body.");
            List<Token> bodyParameters = parameters;
            body = nested(() -> finishBody(bodyParameters), brace -> new StatementBody(bodyParameters, new ArrayList<>()));
        }

        return new Method(foreignKeyword, staticKeyword, constructKeyword, name, parameters, body);
    }

    private Stmt statement() {
        if (match(BREAK)) {
            return new BreakStmt(previous);
        }

        if (match(IF)) {
            Token ifKeyword = previous;
            consume(LEFT_PAREN, "Expect '(' after 'if'.");
            ignoreLine();
            Expr condition = expression();
            consume(RIGHT_PAREN, "Expect ')' after if condition.");
            Stmt thenBranch = statement();

            Token elseKeyword = null;
            Stmt elseBranch = null;
            if (match(ELSE)) {
                elseKeyword = previous;
                elseBranch = statement();
            }
            return new IfStmt(ifKeyword, condition, thenBranch, elseKeyword, elseBranch);
        }

        if (match(FOR)) {
            Token forKeyword = previous;
            consume(LEFT_PAREN, "Expect '(' after 'for'.");
            Token variable = consume(NAME, "Expect for loop variable name.");
            consume(IN, "Expect 'in' after loop variable.");
            ignoreLine();
            Expr iterator = expression();
            consume(RIGHT_PAREN, "Expect ')' after loop expression.");
            Stmt body = statement();
            return new ForStmt(forKeyword, variable, iterator, body);
        }

        if (match(WHILE)) {
            Token whileKeyword = previous;
            consume(LEFT_PAREN, "Expect '(' after 'while'.");
            ignoreLine();
            Expr condition = expression();
            consume(RIGHT_PAREN, "Expect ')' after while condition.");
            Stmt body = statement();
            return new WhileStmt(whileKeyword, condition, body);
        }

        if (match(RETURN)) {
            Token keyword = previous;
            Expr value = null;
            if (peek() != LINE && peek() != RIGHT_BRACE && peek() != EOF) {
                value = expression();
            }
            return new ReturnStmt(keyword, value);
        }

        if (match(LEFT_BRACE)) {
            return nested(this::block, NullExpr::new);
        }

        return expression();
    }

    private BlockStmt block() {
        Token leftBrace = previous;
        List<Stmt> statements = new ArrayList<>();
        ignoreLine();

        while (peek() != RIGHT_BRACE && peek() != EOF) {
            statements.add(definition());

            // The last statement may be followed directly by "}".
            if (peek() == RIGHT_BRACE) {
                break;
            }

            consumeLine("Expect newline after statement.");
        }

        Token rightBrace = consume(RIGHT_BRACE, "Expect '}' after block.");
        return new BlockStmt(leftBrace, statements, rightBrace);
    }

    // Parses the rest of a method body or block argument after its "{" (and
    // block parameters, if any).
    private Body finishBody(List<Token> parameters) {
        if (match(RIGHT_BRACE)) {
            return new StatementBody(parameters, new ArrayList<>());
        }

        // No newline after "{" means a single-line body.
        if (!matchLine()) {
            Stmt expression = inlineStatement();
            ignoreLine();
            consume(RIGHT_BRACE, "Expect '}' at end of block.");
            return new ExpressionBody(parameters, expression);
        }

        List<Stmt> statements = new ArrayList<>();
        if (match(RIGHT_BRACE)) {
            return new StatementBody(parameters, statements);
        }

        while (peek() != EOF) {
            statements.add(definition());
            consumeLine("Expect newline after statement.");

            if (match(RIGHT_BRACE)) {
                break;
            }
        }

        return new StatementBody(parameters, statements);
    }

    // The entry of a single-line body: an expression, or one of the
    // keyword-led statements that can only appear as a statement.
    private Stmt inlineStatement() {
        switch (peek()) {
            case RETURN:
            case BREAK:
            case IF:
            case FOR:
            case WHILE:
                return statement();
            default:
                return expression();
        }
    }

    // ========================================================================
    // Expressions, lowest precedence first
    // ========================================================================

    private Expr expression() {
        return assignment();
    }

    private Expr assignment() {
        Expr expr = conditional();
        if (!match(EQUAL)) {
            return expr;
        }

        Token equal = previous;
        Expr value = assignment();
        return new AssignmentExpr(expr, equal, value);
    }

    private Expr conditional() {
        Expr expr = logicalOr();
        if (!match(QUESTION)) {
            return expr;
        }

        Token question = previous;
        Expr thenBranch = conditional();
        Token colon = consume(COLON, "Expect ':' after then branch of conditional operator.");
        Expr elseBranch = assignment();
        return new ConditionalExpr(expr, question, thenBranch, colon, elseBranch);
    }

    private Expr logicalOr() {
        return binary(0);
    }

    // Parses a left-associative chain of the operators at {@code level}, with
    // operands at the next tighter level.
    private Expr binary(int level) {
        if (level == BINARY_PRECEDENCE.length) {
            return prefix();
        }

        Expr expr = binary(level + 1);
        while (match(BINARY_PRECEDENCE[level])) {
            Token operator = previous;
            ignoreLine();
            Expr right = binary(level + 1);
            expr = new InfixExpr(expr, operator, right);
        }
        return expr;
    }

    private Expr prefix() {
        List<Token> operators = new ArrayList<>();
        while (match(PREFIX_OPERATORS)) {
            operators.add(previous);
        }

        // Applied innermost first, so "-!x" is -(!x).
        Expr expr = call();
        for (int i = operators.size() - 1; i >= 0; i--) {
            expr = new PrefixExpr(operators.get(i), expr);
        }
        return expr;
    }

    private Expr call() {
        Expr expr = primary();

        while (true) {
            if (match(LEFT_BRACKET)) {
                Token leftBracket = previous;
                List<Expr> arguments = argumentList();
                Token rightBracket = consume(RIGHT_BRACKET, "Expect ']' after subscript arguments.");
                expr = new SubscriptExpr(expr, leftBracket, arguments, rightBracket);
            } else if (match(DOT)) {
                Token name = consume(NAME, "Expect method name after '.'.");
                expr = methodCall(expr, name);
            } else {
                break;
            }
        }

        return expr;
    }

    private Expr primary() {
        if (match(LEFT_PAREN)) return nested(this::grouping, NullExpr::new);
        if (match(LEFT_BRACKET)) return nested(this::listLiteral, NullExpr::new);
        if (match(LEFT_BRACE)) return nested(this::mapLiteral, NullExpr::new);
        // A bare name is a call on the implicit receiver.
        if (match(NAME)) return methodCall(null, previous);
        if (match(SUPER)) return superCall();

        if (match(TRUE, FALSE)) return new BoolExpr(previous);
        if (match(NULL)) return new NullExpr(previous);
        if (match(THIS)) return new ThisExpr(previous);

        if (match(FIELD)) return new FieldExpr(previous);
        if (match(STATIC_FIELD)) return new StaticFieldExpr(previous);

        if (match(NUMBER)) return new NumExpr(previous);
        if (match(STRING)) return new StringExpr(previous);

        if (match(INTERPOLATION)) return nested(this::stringInterpolation, NullExpr::new);

        // Already reported when consumed.
        if (match(ERROR)) return new NullExpr(previous);

        error("Expect expression.");
        // Stand-in so callers never see a null expression.
        return new NullExpr(current);
    }

    private static String describeError(Token token) {
        String text = token.text();
        if (text.startsWith("/*")) {
            return "Unterminated block comment.";
        }
        // A string segment resumed after an interpolation starts with ")".
        if (text.startsWith("\"") || text.startsWith(")")) {
            return "Unterminated string.";
        }
        return "Unexpected character.";
    }

    private GroupingExpr grouping() {
        Token leftParen = previous;
        Expr expression = expression();
        Token rightParen = consume(RIGHT_PAREN, "Expect ')' after expression.");
        return new GroupingExpr(leftParen, expression, rightParen);
    }

    private ListExpr listLiteral() {
        Token leftBracket = previous;
        List<Expr> elements = new ArrayList<>();

        ignoreLine();
        while (peek() != RIGHT_BRACKET) {
            elements.add(expression());

            ignoreLine();
            if (!match(COMMA)) {
                break;
            }
            ignoreLine();
        }

        Token rightBracket = consume(RIGHT_BRACKET, "Expect ']' after list elements.");
        return new ListExpr(leftBracket, elements, rightBracket);
    }

    private MapExpr mapLiteral() {
        Token leftBrace = previous;
        List<MapEntry> entries = new ArrayList<>();

        ignoreLine();
        while (peek() != RIGHT_BRACE) {
            Expr key = expression();
            consume(COLON, "Expect ':' after map key.");
            Expr value = expression();
            entries.add(new MapEntry(key, value));

            ignoreLine();
            if (!match(COMMA)) {
                break;
            }
            ignoreLine();
        }

        Token rightBrace = consume(RIGHT_BRACE, "Expect '}' after map entries.");
        return new MapExpr(leftBrace, entries, rightBrace);
    }

    private SuperExpr superCall() {
        Token keyword = previous;
        Token name = null;
        if (match(DOT)) {
            name = consume(NAME, "Expect method name after 'super.'.");
        }

        CallTail tail = finishCall();
        return new SuperExpr(keyword, name, tail.arguments(), tail.blockArgument());
    }

    private CallExpr methodCall(Expr receiver, Token name) {
        CallTail tail = finishCall();
        return new CallExpr(receiver, name, tail.arguments(), tail.blockArgument());
    }

    /**
     * The optional argument list and block argument that follow a method name.
     * {@code arguments} is null when there were no parentheses at all, which
     * makes the call a getter; "()" gives an empty list.
     */
    private record CallTail(List<Expr> arguments, Body blockArgument) {}

    private CallTail finishCall() {
        List<Expr> arguments = null;
        if (match(LEFT_PAREN)) {
            if (match(RIGHT_PAREN)) {
                arguments = new ArrayList<>();
            } else {
                arguments = argumentList();
                consume(RIGHT_PAREN, "Expect ')' after arguments.");
            }
        }

        Body blockArgument = null;
        if (match(LEFT_BRACE)) {
            blockArgument = nested(this::blockArgument, brace -> new StatementBody(null, new ArrayList<>()));
        }

        return new CallTail(arguments, blockArgument);
    }

    private Body blockArgument() {
        List<Token> parameters = null;
        if (match(PIPE)) {
            parameters = parameterList();
            consume(PIPE, "Expect '|' after block parameters.");
        }
        return finishBody(parameters);
    }

    private List<Expr> argumentList() {
        List<Expr> arguments = new ArrayList<>();

        do {
            ignoreLine();
            arguments.add(expression());
        } while (match(COMMA));

        return arguments;
    }

    private List<Token> parameterList() {
        List<Token> parameters = new ArrayList<>();

        do {
            ignoreLine();
            parameters.add(consume(NAME, "Expect parameter name."));
        } while (match(COMMA));

        return parameters;
    }

    // Parses the rest of an interpolated string after its first segment.
    private InterpolationExpr stringInterpolation() {
        List<Token> strings = new ArrayList<>();
        List<Expr> expressions = new ArrayList<>();

        do {
            strings.add(previous);
            expressions.add(expression());
        } while (match(INTERPOLATION));

        // The lexer always closes an interpolation with a string segment, so
        // this only fails when input ends inside the embedded expression.
        strings.add(consume(STRING, "Expect end of string interpolation."));
        return new InterpolationExpr(strings, expressions);
    }

    // ========================================================================
    // Nesting
    // ========================================================================

    /**
     * Parses a construct whose opening token was just consumed, one level
     * deeper. Past {@link #MAX_NESTING} the construct is reported, skipped up
     * to its matching closer and replaced by {@code tooDeep} applied to the
     * opening token.
     */
    private <T> T nested(Supplier<T> inner, Function<Token, T> tooDeep) {
        Token opener = previous;
        if (nesting >= MAX_NESTING) {
            problems.add(new Problem("Expression nesting is too deep.", opener));
            skipNested();
            return tooDeep.apply(opener);
        }

        nesting++;
        T result = inner.get();
        nesting--;
        return result;
    }

    // Consumes tokens until the construct just opened is closed, or input ends.
    private void skipNested() {
        int depth = 1;
        while (depth > 0 && peek() != EOF) {
            Token token = consumeNext();
            if (opensNesting(token)) {
                depth++;
            } else if (closesNesting(token)) {
                depth--;
            }
        }
    }

    // A segment that resumes after an interpolated expression starts with ")",
    // so it both closes one expression and opens the next.
    private static boolean opensNesting(Token token) {
        switch (token.kind()) {
            case LEFT_PAREN:
            case LEFT_BRACKET:
            case LEFT_BRACE:
                return true;
            case INTERPOLATION:
                return !token.text().startsWith(")");
            default:
                return false;
        }
    }

    private static boolean closesNesting(Token token) {
        switch (token.kind()) {
            case RIGHT_PAREN:
            case RIGHT_BRACKET:
            case RIGHT_BRACE:
                return true;
            case STRING:
                return token.text().startsWith(")");
            default:
                return false;
        }
    }

    // ========================================================================
    // Token helpers
    // ========================================================================

    // The kind of the lookahead token, reading it if needed.
    private TokenKind peek() {
        if (current == null) {
            current = lexer.readToken();
        }
        return current.kind();
    }

    private boolean check(TokenKind kind) {
        return peek() == kind;
    }

    // Consumes the lookahead if it is any of {@code kinds}.
    private boolean match(TokenKind... kinds) {
        for (TokenKind kind : kinds) {
            if (check(kind)) {
                consumeNext();
                return true;
            }
        }
        return false;
    }

    // Consumes zero or more newlines. Returns true if there was at least one.
    private boolean matchLine() {
        if (!match(LINE)) {
            return false;
        }

        while (match(LINE)) {
            // Discard the rest.
        }
        return true;
    }

    // Discards newlines where they carry no meaning.
    private void ignoreLine() {
        matchLine();
    }

    // Requires at least one newline.
    private void consumeLine(String message) {
        consume(LINE, message);
        ignoreLine();
    }

    // Every error token is reported here, once, wherever it is consumed.
    private Token consumeNext() {
        peek();
        previous = current;
        current = null;
        if (previous.is(ERROR)) {
            problems.add(new Problem(describeError(previous), previous));
        }
        return previous;
    }

    /**
     * Consumes the lookahead whatever it is. If it is not {@code kind}, a
     * problem is recorded, unless it is an error token, which has its own;
     * the token is returned either way.
     */
    private Token consume(TokenKind kind, String message) {
        Token token = consumeNext();
        if (token.kind() != kind && !token.is(ERROR)) {
            error(message);
        }
        return token;
    }

    private void error(String message) {
        problems.add(new Problem(message, current != null ? current : previous));
    }
}
