package org.shadowlang.compiler.frontend.parser;

import org.shadowlang.compiler.api.CompilerErrorCode;
import org.shadowlang.compiler.api.SourceInfo;
import org.shadowlang.compiler.diagnostics.DiagnosticsEngine;
import org.shadowlang.compiler.frontend.lexer.Token;
import org.shadowlang.compiler.frontend.lexer.TokenType;
import org.shadowlang.compiler.frontend.parser.ast.Assignment;
import org.shadowlang.compiler.frontend.parser.ast.Ast;
import org.shadowlang.compiler.frontend.parser.ast.BinaryOp;
import org.shadowlang.compiler.frontend.parser.ast.Block;
import org.shadowlang.compiler.frontend.parser.ast.Condition;
import org.shadowlang.compiler.frontend.parser.ast.Constant;
import org.shadowlang.compiler.frontend.parser.ast.Expression;
import org.shadowlang.compiler.frontend.parser.ast.Loop;
import org.shadowlang.compiler.frontend.parser.ast.Operator;
import org.shadowlang.compiler.frontend.parser.ast.Statement;
import org.shadowlang.compiler.frontend.parser.ast.Type;
import org.shadowlang.compiler.frontend.parser.ast.UnaryOp;
import org.shadowlang.compiler.frontend.parser.ast.Variable;
import org.shadowlang.compiler.frontend.semantics.SymbolTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The recursive-descent parser. It pulls tokens from a {@link TokenStream} and produces an
 * {@link Ast}. There is one method per grammar production:
 * <pre>
 * statement      ::= condition | loop | assignment
 * condition      ::= 'if' expression '{' {statement} '}' ['else' '{' {statement} '}']
 * loop           ::= 'for' [assignment] ';' [expressionList] ';' [assignment] '{' {statement} '}'
 * assignment     ::= varList '=' expressionList
 * varList        ::= var {',' var}
 * var            ::= ['shadow'] identifier
 * expressionList ::= expression {',' expression}
 * expression     ::= unaryExpr | simpleExpr [binaryOperator expression]
 * unaryExpr      ::= ('-' | '!') expression
 * simpleExpr     ::= var | constant | '(' expression ')'
 * </pre>
 * A production whose first token does not fit pushes that token back and returns {@code null}
 * so the caller can try the next alternative. Once a production has consumed tokens, a mismatch
 * throws a {@link ParseException}, which aborts parsing.
 * <p>
 * Binary operators have no precedence: the right operand is always the entire rest of the
 * expression, so {@code a OP1 b OP2 c} is {@code a OP1 (b OP2 c)}.
 */
public class Parser {

    private final TokenStream tokens;
    private final DiagnosticsEngine diagnostics;

    /**
     * Constructs a new Parser.
     * @param tokens The token stream to parse.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(TokenStream tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the whole token stream. A critical parse error is reported to the diagnostics
     * engine and ends parsing.
     * @return The parsed AST with an empty symbol table, or {@code null} if parsing failed.
     */
    public Ast parse() {
        try {
            return parseOrThrow();
        } catch (ParseException e) {
            diagnostics.reportError(e.getCode(), e.getMessage(), e.getToken().source());
            return null;
        }
    }

    /**
     * Parses the whole token stream.
     * @return The parsed AST with an empty symbol table.
     * @throws ParseException on the first critical parse error.
     */
    public Ast parseOrThrow() {
        SourceInfo start = tokens.peek().source();
        List<Statement> statements = statementList();
        Token end = tokens.next();
        if (end.type() != TokenType.END_OF_FILE) {
            throw unexpected("Expected statement", end);
        }
        return new Ast(new Block(statements, start), new SymbolTable());
    }

    /**
     * Parses statements until one does not match.
     * @return The statements, possibly none.
     */
    List<Statement> statementList() {
        List<Statement> statements = new ArrayList<>();
        Statement statement = statement();
        while (statement != null) {
            statements.add(statement);
            statement = statement();
        }
        return statements;
    }

    /**
     * statement ::= condition | loop | assignment
     * @return The statement, or {@code null} if no alternative matches.
     */
    Statement statement() {
        Statement statement = condition();
        if (statement != null) {
            return statement;
        }
        statement = loop();
        if (statement != null) {
            return statement;
        }
        return assignment();
    }

    /**
     * condition ::= 'if' expression '{' {statement} '}' ['else' '{' {statement} '}']
     * @return The condition, or {@code null} if the next token is not {@code if}.
     */
    Condition condition() {
        Token ifToken = tokens.next();
        if (!ifToken.is(TokenType.KEYWORD, "if")) {
            tokens.pushBack(ifToken);
            return null;
        }
        Expression test = expression();
        if (test == null) {
            throw unexpected("Expected expression after 'if'", tokens.next());
        }
        Block thenBlock = braceBlock("if");
        Block elseBlock;
        Token elseToken = tokens.next();
        if (elseToken.is(TokenType.KEYWORD, "else")) {
            elseBlock = braceBlock("else");
        } else {
            tokens.pushBack(elseToken);
            elseBlock = new Block(List.of(), elseToken.source());
        }
        return new Condition(test, thenBlock, elseBlock, ifToken.source());
    }

    /**
     * loop ::= 'for' [assignment] ';' [expressionList] ';' [assignment] '{' {statement} '}'
     * @return The loop, or {@code null} if the next token is not {@code for}.
     */
    Loop loop() {
        Token forToken = tokens.next();
        if (!forToken.is(TokenType.KEYWORD, "for")) {
            tokens.pushBack(forToken);
            return null;
        }
        Assignment init = optionalAssignment();
        expect(TokenType.SEMICOLON, "Expected ';' after loop initialization");
        List<Expression> tests = expressionList();
        expect(TokenType.SEMICOLON, "Expected ';' after loop condition");
        Assignment step = optionalAssignment();
        Block body = braceBlock("for");
        return new Loop(init, tests, step, body, forToken.source());
    }

    private Assignment optionalAssignment() {
        SourceInfo position = tokens.peek().source();
        Assignment assignment = assignment();
        return assignment != null ? assignment : Assignment.empty(position);
    }

    /**
     * assignment ::= varList '=' expressionList
     * @return The assignment, or {@code null} if the next token does not start a variable.
     */
    Assignment assignment() {
        List<Variable> targets = varList();
        if (targets == null) {
            return null;
        }
        expect(TokenType.ASSIGNMENT, "Expected '=' in assignment");
        Token first = tokens.peek();
        List<Expression> values = expressionList();
        if (values.isEmpty()) {
            throw unexpected("Expected expression after '='", first);
        }
        if (targets.size() != values.size()) {
            throw new ParseException(CompilerErrorCode.ASSIGNMENT_ARITY_MISMATCH,
                    String.format("Assignment has %d target(s) but %d value(s).", targets.size(), values.size()),
                    first);
        }
        return new Assignment(targets, values, targets.get(0).source());
    }

    /**
     * varList ::= var {',' var}
     * @return The variables, or {@code null} if the first one does not match.
     */
    List<Variable> varList() {
        Variable first = variable();
        if (first == null) {
            return null;
        }
        List<Variable> variables = new ArrayList<>();
        variables.add(first);
        while (tokens.match(TokenType.SEPARATOR)) {
            Variable next = variable();
            if (next == null) {
                throw unexpected("Expected variable after ','", tokens.next());
            }
            variables.add(next);
        }
        return variables;
    }

    /**
     * var ::= ['shadow'] identifier
     * @return The variable, or {@code null} if the next token is neither {@code shadow} nor an identifier.
     */
    Variable variable() {
        Token token = tokens.next();
        if (token.is(TokenType.KEYWORD, "shadow")) {
            Token name = tokens.next();
            if (name.type() != TokenType.IDENTIFIER) {
                throw unexpected("Expected identifier after 'shadow'", name);
            }
            return new Variable(name.text(), true, token.source());
        }
        if (token.type() == TokenType.IDENTIFIER) {
            return new Variable(token.text(), false, token.source());
        }
        tokens.pushBack(token);
        return null;
    }

    /**
     * expressionList ::= expression {',' expression}
     * @return The expressions; empty if the first one does not match.
     */
    List<Expression> expressionList() {
        List<Expression> expressions = new ArrayList<>();
        Expression first = expression();
        if (first == null) {
            return expressions;
        }
        expressions.add(first);
        while (tokens.match(TokenType.SEPARATOR)) {
            Expression next = expression();
            if (next == null) {
                throw unexpected("Expected expression after ','", tokens.next());
            }
            expressions.add(next);
        }
        return expressions;
    }

    /**
     * expression ::= unaryExpr | simpleExpr [binaryOperator expression]
     * @return The expression, or {@code null} if the next token starts none.
     */
    Expression expression() {
        Expression unary = unaryExpression();
        if (unary != null) {
            return unary;
        }
        Expression left = simpleExpression();
        if (left == null) {
            return null;
        }
        Token operatorToken = tokens.next();
        if (operatorToken.type() != TokenType.OPERATOR) {
            tokens.pushBack(operatorToken);
            return left;
        }
        Optional<Operator> operator = Operator.fromBinarySymbol(operatorToken.text());
        if (operator.isEmpty()) {
            throw new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN,
                    String.format("Operator '%s' cannot be used as a binary operator.", operatorToken.text()),
                    operatorToken);
        }
        Expression right = expression();
        if (right == null) {
            throw unexpected("Expected expression after operator '" + operatorToken.text() + "'", tokens.next());
        }
        return new BinaryOp(operator.get(), left, right, Type.UNKNOWN, operatorToken.source());
    }

    /**
     * unaryExpr ::= ('-' | '!') expression
     * @return The unary expression, or {@code null} if the next token is not a unary operator.
     */
    Expression unaryExpression() {
        Token operatorToken = tokens.next();
        Optional<Operator> operator = operatorToken.type() == TokenType.OPERATOR
                ? Operator.fromUnarySymbol(operatorToken.text())
                : Optional.empty();
        if (operator.isEmpty()) {
            tokens.pushBack(operatorToken);
            return null;
        }
        Expression operand = expression();
        if (operand == null) {
            throw unexpected("Expected expression after unary '" + operatorToken.text() + "'", tokens.next());
        }
        return new UnaryOp(operator.get(), operand, Type.UNKNOWN, operatorToken.source());
    }

    /**
     * simpleExpr ::= var | constant | '(' expression ')'
     * @return The expression, or {@code null} if the next token starts none.
     */
    Expression simpleExpression() {
        Variable variable = variable();
        if (variable != null) {
            return variable;
        }
        Token token = tokens.next();
        if (token.type() == TokenType.CONSTANT) {
            return new Constant(token.text(), token.source());
        }
        if (token.type() == TokenType.PAREN_OPEN) {
            Expression inner = expression();
            if (inner == null) {
                throw unexpected("Expected expression after '('", tokens.next());
            }
            expect(TokenType.PAREN_CLOSE, "Expected ')' to close '(' at line " + token.line());
            return inner;
        }
        tokens.pushBack(token);
        return null;
    }

    /**
     * '{' {statement} '}'
     * @param owner The keyword the block belongs to, for error messages.
     * @return The block.
     */
    Block braceBlock(String owner) {
        Token open = expect(TokenType.CURLY_OPEN, "Expected '{' after '" + owner + "'");
        List<Statement> statements = statementList();
        expect(TokenType.CURLY_CLOSE, "Expected statement or '}' in '" + owner + "' block");
        return new Block(statements, open.source());
    }

    private Token expect(TokenType type, String message) {
        Token token = tokens.next();
        if (token.type() != type) {
            throw unexpected(message, token);
        }
        return token;
    }

    private ParseException unexpected(String expectation, Token found) {
        return new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN,
                String.format("%s, but found %s.", expectation, found.describe()), found);
    }
}
