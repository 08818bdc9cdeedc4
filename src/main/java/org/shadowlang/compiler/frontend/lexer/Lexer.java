package org.shadowlang.compiler.frontend.lexer;

import org.shadowlang.compiler.api.CompilerErrorCode;
import org.shadowlang.compiler.api.SourceInfo;
import org.shadowlang.compiler.diagnostics.Diagnostic;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Tokens are produced lazily, one per {@link #nextToken()} call. The lexer stops at the first
 * character that starts no token: it records a single lexical error and from then on only
 * returns {@link TokenType#END_OF_FILE}. The error is not reported into a
 * {@link org.shadowlang.compiler.diagnostics.DiagnosticsEngine} because the lexer may run on
 * its own thread; callers pick it up through {@link #lexicalError()}.
 */
public class Lexer implements TokenSource {

    /** Reserved words lexed as {@link TokenType#KEYWORD}. */
    public static final Set<String> KEYWORDS = Set.of("if", "else", "for", "shadow");
    /** Reserved words lexed as boolean {@link TokenType#CONSTANT}s. */
    public static final Set<String> BOOLEAN_LITERALS = Set.of("true", "false");

    private final String source;
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;
    private Token previousToken;
    private Diagnostic lexicalError;
    private boolean finished = false;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param logicalFileName The name of the file being lexed, for error reporting.
     */
    public Lexer(String source, String logicalFileName) {
        this.source = source;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire remaining source code.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_FILE);
        return tokens;
    }

    /**
     * Produces the next token.
     * @return The next token, or {@link TokenType#END_OF_FILE} once the input is exhausted
     *         or a lexical error was found.
     */
    @Override
    public Token nextToken() {
        if (finished) {
            return endOfFile();
        }
        skipWhitespaceAndComments();
        if (isAtEnd()) {
            finished = true;
            return endOfFile();
        }
        start = current;
        startLine = line;
        startColumn = column;
        Token token = scanToken(advance());
        if (token == null) {
            finished = true;
            return endOfFile();
        }
        previousToken = token;
        return token;
    }

    /**
     * @return The lexical error that ended the token stream, if any.
     */
    public Optional<Diagnostic> lexicalError() {
        return Optional.ofNullable(lexicalError);
    }

    private Token scanToken(char c) {
        switch (c) {
            case '(': return makeToken(TokenType.PAREN_OPEN);
            case ')': return makeToken(TokenType.PAREN_CLOSE);
            case '{': return makeToken(TokenType.CURLY_OPEN);
            case '}': return makeToken(TokenType.CURLY_CLOSE);
            case ',': return makeToken(TokenType.SEPARATOR);
            case ';': return makeToken(TokenType.SEMICOLON);
            case '+', '*', '/': return makeToken(TokenType.OPERATOR);
            case '-':
                // A minus directly followed by a digit is a negative literal, unless the
                // previous token closes an operand: then it is the binary minus.
                if (isDigit(peek()) && !previousEndsOperand()) {
                    return number();
                }
                return makeToken(TokenType.OPERATOR);
            case '=':
                return match('=') ? makeToken(TokenType.OPERATOR) : makeToken(TokenType.ASSIGNMENT);
            case '!', '<', '>':
                match('=');
                return makeToken(TokenType.OPERATOR);
            case '&':
                return match('&') ? makeToken(TokenType.OPERATOR) : unrecognized(c);
            case '|':
                return match('|') ? makeToken(TokenType.OPERATOR) : unrecognized(c);
            case '"':
                return string();
            default:
                if (isDigit(c)) {
                    return number();
                }
                if (isAlpha(c)) {
                    return identifier();
                }
                return unrecognized(c);
        }
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '\n') {
                advance();
                line++;
                column = 1;
            } else if (c == '/' && peekNext() == '/') {
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
            } else {
                return;
            }
        }
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        if (KEYWORDS.contains(text)) {
            return makeToken(TokenType.KEYWORD);
        }
        if (BOOLEAN_LITERALS.contains(text)) {
            return makeToken(TokenType.CONSTANT);
        }
        return makeToken(TokenType.IDENTIFIER);
    }

    private Token number() {
        while (isDigit(peek())) advance();
        if (peek() == '.') {
            advance(); // consume the '.'
            while (isDigit(peek())) advance();
        }
        return makeToken(TokenType.CONSTANT);
    }

    private Token string() {
        while (peek() != '"' && peek() != '\n' && !isAtEnd()) {
            advance();
        }
        if (peek() != '"') {
            lexicalError = new Diagnostic(Diagnostic.Type.ERROR, CompilerErrorCode.UNTERMINATED_STRING,
                    String.format("Unterminated string literal starting at line %d, column %d.", startLine, startColumn),
                    new SourceInfo(logicalFileName, startLine, startColumn));
            return null;
        }
        // The closing "
        advance();
        return makeToken(TokenType.CONSTANT);
    }

    private Token unrecognized(char c) {
        lexicalError = new Diagnostic(Diagnostic.Type.ERROR, CompilerErrorCode.UNRECOGNIZED_CHARACTER,
                String.format("Unrecognized character '%c' at line %d, column %d.", c, startLine, startColumn),
                new SourceInfo(logicalFileName, startLine, startColumn));
        return null;
    }

    private boolean previousEndsOperand() {
        if (previousToken == null) return false;
        return switch (previousToken.type()) {
            case IDENTIFIER, CONSTANT, PAREN_CLOSE -> true;
            default -> false;
        };
    }

    private Token makeToken(TokenType type) {
        return new Token(type, source.substring(start, current), startLine, startColumn, logicalFileName);
    }

    private Token endOfFile() {
        return new Token(TokenType.END_OF_FILE, "", line, column, logicalFileName);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || c == '_';
    }
}
