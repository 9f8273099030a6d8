package com.vaceline;

import com.vaceline.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

public class Parser {
    // ========================================================================
    // Binding Power Constants
    // ========================================================================
    // Higher binding power = tighter binding. 0 means "not a binary operator".
    private static final int BP_NONE = 0;
    private static final int BP_OR = 1;             // ||
    private static final int BP_AND = 2;            // &&
    private static final int BP_COMPARISON = 3;     // == != ~ !~ < > <= >=

    private static final Pattern DURATION = Pattern.compile("\\d+(\\.\\d+)?(ms|s|m|h|d|y)");
    private static final Pattern NUMERIC = Pattern.compile("\\d+(\\.\\d+)?");
    private static final Pattern CIDR = Pattern.compile("\\d{1,3}");

    private static final Set<String> RETURN_ACTIONS = Set.of(
        "pass", "hit_for_pass", "lookup", "pipe", "deliver", "deliver_stale", "fetch", "hash");

    private static final Set<String> DECLARE_TYPES = Set.of(
        "STRING", "BOOL", "BOOLEAN", "INTEGER", "FLOAT", "TIME", "RTIME", "IP");

    private final List<Token> tokens;
    private final List<Comment> comments;
    private int current = 0;
    private int nextComment = 0;

    public Parser(String source) {
        Lexer lexer = new Lexer(source);
        this.tokens = lexer.tokenize();
        this.comments = lexer.comments();
    }

    public Program parse() {
        List<Statement> body = new ArrayList<>();
        List<Comment> dangling = parseStatements(body, false);

        Token eof = peek();
        SourceLocation loc = new SourceLocation(
            new SourceLocation.Position(0, 1, 1),
            new SourceLocation.Position(eof.position(), eof.line(), eof.column()));
        return new Program(loc, new Comments(null, null, dangling), body);
    }

    // ========================================================================
    // Statements
    // ========================================================================

    /**
     * Parses statements until a closing brace (braced lists) or the end of input, attaching
     * leading, trailing and inner comments to each statement. Returns the comments left over
     * at the end of the list.
     */
    private List<Comment> parseStatements(List<Statement> body, boolean braced) {
        while (!isAtEnd() && !(braced && check(TokenType.RBRACE))) {
            Token startToken = peek();
            List<Comment> leading = takeCommentsBefore(startToken.position());

            Statement stmt = parseStatement();

            Token endToken = previous();
            stmt.comments().inner().addAll(takeCommentsBefore(endToken.endPosition()));
            stmt.comments().leading().addAll(leading);
            stmt.comments().trailing().addAll(takeTrailingComments(endToken));
            body.add(stmt);
        }
        if (braced && isAtEnd()) {
            throw new ParseException("Unterminated block, expected '}' but reached end of input", peek());
        }
        return takeCommentsBefore(peek().position());
    }

    /**
     * Parse a statement using switch dispatch on the leading keyword.
     * Anything that is not a keyword is parsed as an expression statement.
     */
    private Statement parseStatement() {
        Token token = peek();
        if (token.type() != TokenType.IDENTIFIER) {
            return parseExpressionStatement();
        }

        return switch (token.lexeme()) {
            // Module statements
            case "include" -> parseIncludeStatement();
            case "import" -> parseImportStatement();

            // Declarations
            case "sub" -> parseSubroutineStatement();
            case "acl" -> parseAclStatement();
            case "backend" -> parseBackendStatement();
            case "table" -> parseTableStatement();
            case "declare" -> parseDeclareStatement();

            // Assignments
            case "set" -> parseSetStatement();
            case "add" -> parseAddStatement();
            case "unset" -> parseUnsetStatement();

            // Control flow
            case "if" -> parseIfStatement();
            case "call" -> parseCallStatement();
            case "return" -> parseReturnStatement();
            case "error" -> parseErrorStatement();
            case "restart" -> parseRestartStatement();

            // Output
            case "synthetic" -> parseSyntheticStatement();
            case "log" -> parseLogStatement();

            default -> parseExpressionStatement();
        };
    }

    private ExpressionStatement parseExpressionStatement() {
        Token startToken = peek();
        Expression body = parseExpression();
        consume(TokenType.SEMICOLON, "Expected ';' after expression");
        return new ExpressionStatement(createLocation(startToken, previous()), null, body);
    }

    private IncludeStatement parseIncludeStatement() {
        Token startToken = advance(); // consume 'include'
        Token module = consume(TokenType.STRING, "Expected file name string after 'include'");
        consume(TokenType.SEMICOLON, "Expected ';' after include");
        StringLiteral literal = new StringLiteral(module.location(), module.lexeme());
        return new IncludeStatement(createLocation(startToken, previous()), null, literal);
    }

    private ImportStatement parseImportStatement() {
        Token startToken = advance(); // consume 'import'
        Identifier module = parseIdentifier("Expected module name after 'import'");
        consume(TokenType.SEMICOLON, "Expected ';' after import");
        return new ImportStatement(createLocation(startToken, previous()), null, module);
    }

    private CallStatement parseCallStatement() {
        Token startToken = advance(); // consume 'call'
        Identifier subroutine = parseIdentifier("Expected subroutine name after 'call'");
        consume(TokenType.SEMICOLON, "Expected ';' after call");
        return new CallStatement(createLocation(startToken, previous()), null, subroutine);
    }

    private DeclareStatement parseDeclareStatement() {
        Token startToken = advance(); // consume 'declare'
        Token scope = consume(TokenType.IDENTIFIER, "Expected 'local' after 'declare'");
        if (!scope.lexeme().equals("local")) {
            throw new ParseException("Expected 'local' after 'declare', found " + scope, scope);
        }
        Expression id = parseReference();
        Token valueType = consume(TokenType.IDENTIFIER, "Expected variable type in declaration");
        if (!DECLARE_TYPES.contains(valueType.lexeme())) {
            throw new ParseException("Unknown variable type '" + valueType.lexeme() + "'", valueType);
        }
        consume(TokenType.SEMICOLON, "Expected ';' after declaration");
        return new DeclareStatement(createLocation(startToken, previous()), null, id, valueType.lexeme());
    }

    private SetStatement parseSetStatement() {
        Token startToken = advance(); // consume 'set'
        Expression left = parseReference();
        if (!check(TokenType.ASSIGN) && !check(TokenType.COMPOUND_ASSIGN)) {
            throw new ParseException("Expected assignment operator after 'set' target, found " + peek(), peek());
        }
        Token operator = advance();
        Expression right = parseExpression();
        consume(TokenType.SEMICOLON, "Expected ';' after set");
        return new SetStatement(createLocation(startToken, previous()), null, left, operator.lexeme(), right);
    }

    private AddStatement parseAddStatement() {
        Token startToken = advance(); // consume 'add'
        Expression left = parseReference();
        Token operator = consume(TokenType.ASSIGN, "Expected '=' after 'add' target");
        Expression right = parseExpression();
        consume(TokenType.SEMICOLON, "Expected ';' after add");
        return new AddStatement(createLocation(startToken, previous()), null, left, operator.lexeme(), right);
    }

    private UnsetStatement parseUnsetStatement() {
        Token startToken = advance(); // consume 'unset'
        Expression id = parseReference();
        consume(TokenType.SEMICOLON, "Expected ';' after unset");
        return new UnsetStatement(createLocation(startToken, previous()), null, id);
    }

    private ReturnStatement parseReturnStatement() {
        Token startToken = advance(); // consume 'return'

        // Both return(pass); and return pass; are accepted
        boolean parenthesized = match(TokenType.LPAREN);
        Token action = consume(TokenType.IDENTIFIER, "Expected action after 'return'");
        if (!RETURN_ACTIONS.contains(action.lexeme())) {
            throw new ParseException("Unknown return action '" + action.lexeme() + "'", action);
        }
        if (parenthesized) {
            consume(TokenType.RPAREN, "Expected ')' after return action");
        }
        consume(TokenType.SEMICOLON, "Expected ';' after return");
        return new ReturnStatement(createLocation(startToken, previous()), null, action.lexeme());
    }

    private ErrorStatement parseErrorStatement() {
        Token startToken = advance(); // consume 'error'
        Token statusToken = consume(TokenType.NUMBER, "Expected status code after 'error'");
        Literal status = parseNumber(statusToken);
        if (!(status instanceof NumericLiteral)) {
            throw new ParseException("Invalid status code '" + statusToken.lexeme() + "'", statusToken);
        }

        Expression message = null;
        if (!check(TokenType.SEMICOLON)) {
            message = parseExpression();
        }
        consume(TokenType.SEMICOLON, "Expected ';' after error");
        return new ErrorStatement(createLocation(startToken, previous()), null, status, message);
    }

    private RestartStatement parseRestartStatement() {
        Token startToken = advance(); // consume 'restart'
        consume(TokenType.SEMICOLON, "Expected ';' after restart");
        return new RestartStatement(createLocation(startToken, previous()), null);
    }

    private SyntheticStatement parseSyntheticStatement() {
        Token startToken = advance(); // consume 'synthetic'
        Expression response = parseExpression();
        consume(TokenType.SEMICOLON, "Expected ';' after synthetic");
        return new SyntheticStatement(createLocation(startToken, previous()), null, response);
    }

    private LogStatement parseLogStatement() {
        Token startToken = advance(); // consume 'log'
        Expression content = parseExpression();
        consume(TokenType.SEMICOLON, "Expected ';' after log");
        return new LogStatement(createLocation(startToken, previous()), null, content);
    }

    /**
     * Parses {@code if (...) { ... }} with an optional {@code else}, {@code else if},
     * {@code elsif} or {@code elseif} continuation. Else-if chains nest as the alternate.
     */
    private IfStatement parseIfStatement() {
        Token startToken = advance(); // consume 'if', 'elsif' or 'elseif'

        consume(TokenType.LPAREN, "Expected '(' after 'if'");
        Expression test = parseExpression();
        consume(TokenType.RPAREN, "Expected ')' after if condition");

        List<Comment> inner = new ArrayList<>();
        List<Statement> consequent = parseBlock(inner);

        IfStatement alternate = null;
        List<Statement> alternateBody = null;
        if (checkKeyword("else")) {
            if (checkAhead(1, TokenType.IDENTIFIER) && tokens.get(current + 1).lexeme().equals("if")) {
                advance(); // consume 'else'
                alternate = parseIfStatement();
            } else {
                advance(); // consume 'else'
                alternateBody = parseBlock(inner);
            }
        } else if (checkKeyword("elsif") || checkKeyword("elseif")) {
            alternate = parseIfStatement();
        }

        Token endToken = previous();
        return new IfStatement(createLocation(startToken, endToken), new Comments(null, null, inner),
            test, consequent, alternate, alternateBody);
    }

    private SubroutineStatement parseSubroutineStatement() {
        Token startToken = advance(); // consume 'sub'
        Identifier id = parseIdentifier("Expected subroutine name after 'sub'");
        List<Comment> inner = new ArrayList<>();
        List<Statement> body = parseBlock(inner);
        return new SubroutineStatement(createLocation(startToken, previous()), new Comments(null, null, inner), id, body);
    }

    private AclStatement parseAclStatement() {
        Token startToken = advance(); // consume 'acl'
        Identifier id = parseIdentifier("Expected acl name after 'acl'");
        openBlock();

        List<Ip> entries = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw new ParseException("Unterminated acl, expected '}' but reached end of input", peek());
            }
            entries.add(parseIpEntry());
        }
        consume(TokenType.RBRACE, "Expected '}' to close acl");
        return new AclStatement(createLocation(startToken, previous()), null, id, entries);
    }

    private Ip parseIpEntry() {
        Token address = consume(TokenType.STRING, "Expected quoted IP address in acl");
        Integer cidr = null;
        if (match(TokenType.SLASH)) {
            Token bits = consume(TokenType.NUMBER, "Expected prefix length after '/'");
            if (!CIDR.matcher(bits.lexeme()).matches()) {
                throw new ParseException("Invalid prefix length '" + bits.lexeme() + "'", bits);
            }
            cidr = Integer.parseInt(bits.lexeme());
        }
        SourceLocation loc = createLocation(address, previous());
        consume(TokenType.SEMICOLON, "Expected ';' after acl entry");
        return new Ip(loc, unquote(address.lexeme()), cidr);
    }

    private BackendStatement parseBackendStatement() {
        Token startToken = advance(); // consume 'backend'
        Identifier id = parseIdentifier("Expected backend name after 'backend'");
        List<BackendDefinition> body = parseBackendBlock();
        return new BackendStatement(createLocation(startToken, previous()), null, id, body);
    }

    private List<BackendDefinition> parseBackendBlock() {
        openBlock();
        List<BackendDefinition> definitions = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw new ParseException("Unterminated backend, expected '}' but reached end of input", peek());
            }
            definitions.add(parseBackendDefinition());
        }
        consume(TokenType.RBRACE, "Expected '}' to close backend block");
        return definitions;
    }

    private BackendDefinition parseBackendDefinition() {
        Token startToken = consume(TokenType.DOT, "Expected '.' before backend property");
        Token key = consume(TokenType.IDENTIFIER, "Expected backend property name");
        consume(TokenType.ASSIGN, "Expected '=' after backend property");

        if (check(TokenType.LBRACE)) {
            List<BackendDefinition> nested = parseBackendBlock();
            match(TokenType.SEMICOLON);
            return new BackendDefinition(createLocation(startToken, previous()), key.lexeme(), null, nested);
        }

        Expression value = parseExpression();
        consume(TokenType.SEMICOLON, "Expected ';' after backend property");
        return new BackendDefinition(createLocation(startToken, previous()), key.lexeme(), value, null);
    }

    private TableStatement parseTableStatement() {
        Token startToken = advance(); // consume 'table'
        Identifier id = parseIdentifier("Expected table name after 'table'");
        openBlock();

        List<TableDefinition> entries = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw new ParseException("Unterminated table, expected '}' but reached end of input", peek());
            }
            Token key = consume(TokenType.STRING, "Expected string key in table");
            consume(TokenType.COLON, "Expected ':' after table key");
            Token value = consume(TokenType.STRING, "Expected string value in table");
            entries.add(new TableDefinition(createLocation(key, value), key.lexeme(), value.lexeme()));
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RBRACE, "Expected '}' to close table");
        return new TableStatement(createLocation(startToken, previous()), null, id, entries);
    }

    private List<Statement> parseBlock(List<Comment> inner) {
        Token open = consume(TokenType.LBRACE, "Expected '{'");
        // Comments between the statement keyword and '{' belong to the statement itself
        inner.addAll(takeCommentsBefore(open.endPosition()));
        List<Statement> body = new ArrayList<>();
        inner.addAll(parseStatements(body, true));
        consume(TokenType.RBRACE, "Expected '}' to close block");
        return body;
    }

    private void openBlock() {
        consume(TokenType.LBRACE, "Expected '{'");
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    /**
     * Parses an expression followed by any number of implicitly concatenated operands
     * ({@code "a" req.http.host "b"}, optionally joined by {@code +}). Each extra operand is
     * parsed speculatively; the first one that fails rewinds the cursor and ends the list.
     */
    private Expression parseExpression() {
        Token startToken = peek();
        Expression first = parseExpr(BP_OR);

        List<Expression> parts = new ArrayList<>();
        parts.add(first);
        while (!check(TokenType.SEMICOLON) && !isAtEnd()) {
            Expression next = speculate(() -> {
                match(TokenType.PLUS);
                return parsePrimaryExpression();
            });
            if (next == null) {
                break;
            }
            parts.add(next);
        }

        if (parts.size() == 1) {
            return first;
        }
        return new ConcatExpression(createLocation(startToken, previous()), parts);
    }

    /**
     * Runs {@code attempt}; if it raises a {@link ParseException} the cursor is restored to where
     * the attempt started and {@code null} is returned. Only implicit concatenation uses this.
     */
    private <T> T speculate(Supplier<T> attempt) {
        int savedCurrent = current;
        try {
            return attempt.get();
        } catch (ParseException e) {
            current = savedCurrent;
            return null;
        }
    }

    // Precedence climbing over the binary and logical operators; all of them are left-associative.
    private Expression parseExpr(int minBp) {
        Token startToken = peek();
        Expression left = parseUnaryExpression();

        while (true) {
            Token operator = peek();
            int bp = bindingPower(operator.type());
            if (bp == BP_NONE || bp < minBp) {
                return left;
            }
            advance();
            Expression right = parseExpr(bp + 1);
            SourceLocation loc = createLocation(startToken, previous());

            if (bp == BP_COMPARISON) {
                left = new BinaryExpression(loc, ungroupBinaryLeft(left), operator.lexeme(), right);
            } else {
                String op = operator.lexeme();
                left = new LogicalExpression(loc, ungroupLogicalOperand(left, op), op, ungroupLogicalOperand(right, op));
            }
        }
    }

    private static int bindingPower(TokenType type) {
        return switch (type) {
            case OR -> BP_OR;
            case AND -> BP_AND;
            case EQ, NE, MATCH, NOT_MATCH, LT, GT, LE, GE -> BP_COMPARISON;
            default -> BP_NONE;
        };
    }

    // The printer always parenthesizes a binary left operand, so (a == b) == c and a == b == c
    // must build the same tree for printed output to re-parse identically.
    private static Expression ungroupBinaryLeft(Expression left) {
        if (left instanceof BooleanExpression group && group.body() instanceof BinaryExpression) {
            return group.body();
        }
        return left;
    }

    // Same for an && operand of ||, which the printer parenthesizes on either side.
    private static Expression ungroupLogicalOperand(Expression operand, String operator) {
        if (operator.equals("||")
                && operand instanceof BooleanExpression group
                && group.body() instanceof LogicalExpression inner
                && inner.operator().equals("&&")) {
            return inner;
        }
        return operand;
    }

    private Expression parseUnaryExpression() {
        if (check(TokenType.BANG) || check(TokenType.MINUS)) {
            Token operator = advance();
            Expression argument = parseUnaryExpression();
            return new UnaryExpression(createLocation(operator, previous()), operator.lexeme(), argument);
        }
        return parsePrimaryExpression();
    }

    private Expression parsePrimaryExpression() {
        Token token = peek();
        return switch (token.type()) {
            case LPAREN -> {
                advance();
                Expression body = parseExpression();
                consume(TokenType.RPAREN, "Expected ')' to close group");
                yield new BooleanExpression(createLocation(token, previous()), body);
            }
            case STRING -> {
                advance();
                yield new StringLiteral(token.location(), token.lexeme());
            }
            case LONG_STRING -> {
                advance();
                yield new MultilineLiteral(token.location(), token.lexeme());
            }
            case NUMBER -> {
                advance();
                yield parseNumber(token);
            }
            case IDENTIFIER -> {
                if (token.lexeme().equals("true") || token.lexeme().equals("false")) {
                    advance();
                    yield new BooleanLiteral(token.location(), token.lexeme());
                }
                yield parseCallOrReference();
            }
            default -> throw new ParseException("Unexpected token " + token, token);
        };
    }

    private Expression parseCallOrReference() {
        Token startToken = peek();
        Expression callee = parseReference();
        if (!match(TokenType.LPAREN)) {
            return callee;
        }

        List<Expression> arguments = new ArrayList<>();
        while (!check(TokenType.RPAREN)) {
            arguments.add(parseExpression());
            // A trailing comma is allowed; the printer emits one when arguments wrap
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RPAREN, "Expected ')' after function arguments");
        return new FunCallExpression(createLocation(startToken, previous()), callee, arguments);
    }

    /**
     * Parses an identifier, a left-nested member chain, or a value pair ({@code base:name}).
     * Members that follow an {@code http} member are header names.
     */
    private Expression parseReference() {
        Token startToken = peek();
        Identifier root = parseIdentifier("Expected identifier, found " + startToken);
        Expression expr = root;
        String lastName = root.name();

        while (check(TokenType.DOT) && checkAhead(1, TokenType.IDENTIFIER)) {
            advance(); // consume '.'
            Token name = advance();
            Expression member = expr instanceof Member && lastName.equals("http")
                ? new Header(name.location(), name.lexeme())
                : new Identifier(name.location(), name.lexeme());
            expr = new Member(createLocation(startToken, name), expr, member);
            lastName = name.lexeme();
        }

        if (check(TokenType.COLON) && checkAhead(1, TokenType.IDENTIFIER)) {
            advance(); // consume ':'
            Token name = advance();
            expr = new ValuePair(createLocation(startToken, name), expr, new Identifier(name.location(), name.lexeme()));
        }
        return expr;
    }

    private Identifier parseIdentifier(String message) {
        Token token = consume(TokenType.IDENTIFIER, message);
        return new Identifier(token.location(), token.lexeme());
    }

    /**
     * Classifies a numeric token: a recognized unit suffix makes a duration, plain digits a
     * numeric literal. Numbers with a leading zero followed by more digits are rejected.
     */
    private Literal parseNumber(Token token) {
        String raw = token.lexeme();
        if (DURATION.matcher(raw).matches()) {
            return new DurationLiteral(token.location(), raw);
        }
        if (NUMERIC.matcher(raw).matches()) {
            if (raw.length() > 1 && raw.charAt(0) == '0' && raw.charAt(1) != '.') {
                throw new ParseException("Invalid number '" + raw + "'", token);
            }
            return new NumericLiteral(token.location(), raw);
        }
        throw new ParseException("Invalid numeric literal '" + raw + "'", token);
    }

    private static String unquote(String raw) {
        return raw.substring(1, raw.length() - 1);
    }

    // ========================================================================
    // Comments
    // ========================================================================

    private List<Comment> takeCommentsBefore(int offset) {
        List<Comment> taken = new ArrayList<>();
        while (nextComment < comments.size() && comments.get(nextComment).loc().start().offset() < offset) {
            taken.add(comments.get(nextComment++));
        }
        return taken;
    }

    // Comments starting on the line a statement ends on, before the next token
    private List<Comment> takeTrailingComments(Token endToken) {
        List<Comment> taken = new ArrayList<>();
        int limit = peek().position();
        while (nextComment < comments.size()) {
            Comment comment = comments.get(nextComment);
            SourceLocation.Position start = comment.loc().start();
            if (start.line() != endToken.endLine() || start.offset() >= limit) {
                break;
            }
            taken.add(comment);
            nextComment++;
        }
        return taken;
    }

    // Helper method to create SourceLocation from tokens
    private SourceLocation createLocation(Token start, Token end) {
        return new SourceLocation(
            new SourceLocation.Position(start.position(), start.line(), start.column()),
            new SourceLocation.Position(end.endPosition(), end.endLine(), end.endColumn())
        );
    }

    // Helper methods

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkAhead(int offset, TokenType type) {
        int pos = current + offset;
        if (pos >= tokens.size()) return false;
        return tokens.get(pos).type() == type;
    }

    private boolean checkKeyword(String keyword) {
        return peek().is(TokenType.IDENTIFIER, keyword);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message + ", found " + peek(), peek());
    }

    public static Program parse(String source) {
        return new Parser(source).parse();
    }
}
