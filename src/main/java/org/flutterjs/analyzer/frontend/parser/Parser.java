package org.flutterjs.analyzer.frontend.parser;

import org.flutterjs.analyzer.diagnostics.DiagnosticsEngine;
import org.flutterjs.analyzer.frontend.lexer.StringSegment;
import org.flutterjs.analyzer.frontend.lexer.Token;
import org.flutterjs.analyzer.frontend.lexer.TokenType;
import org.flutterjs.analyzer.frontend.parser.ast.AstNode;
import org.flutterjs.analyzer.frontend.parser.ast.ClassNode;
import org.flutterjs.analyzer.frontend.parser.ast.ConstructorNode;
import org.flutterjs.analyzer.frontend.parser.ast.EnumNode;
import org.flutterjs.analyzer.frontend.parser.ast.ExportNode;
import org.flutterjs.analyzer.frontend.parser.ast.ExtensionNode;
import org.flutterjs.analyzer.frontend.parser.ast.FieldNode;
import org.flutterjs.analyzer.frontend.parser.ast.ImportNode;
import org.flutterjs.analyzer.frontend.parser.ast.LibraryNode;
import org.flutterjs.analyzer.frontend.parser.ast.MethodNode;
import org.flutterjs.analyzer.frontend.parser.ast.MixinNode;
import org.flutterjs.analyzer.frontend.parser.ast.PartNode;
import org.flutterjs.analyzer.frontend.parser.ast.PartOfNode;
import org.flutterjs.analyzer.frontend.parser.ast.TypedefNode;
import org.flutterjs.analyzer.frontend.parser.ast.VariableNode;
import org.flutterjs.analyzer.ir.FunctionDeclaration;
import org.flutterjs.analyzer.ir.InitializerDeclaration;
import org.flutterjs.analyzer.ir.MethodKind;
import org.flutterjs.analyzer.ir.Modifier;
import org.flutterjs.analyzer.ir.ParameterDeclaration;
import org.flutterjs.analyzer.ir.SourceLocation;
import org.flutterjs.analyzer.ir.TypeRef;
import org.flutterjs.analyzer.ir.expr.Argument;
import org.flutterjs.analyzer.ir.expr.AssignmentExpr;
import org.flutterjs.analyzer.ir.expr.AwaitExpr;
import org.flutterjs.analyzer.ir.expr.BinaryExpr;
import org.flutterjs.analyzer.ir.expr.CascadeExpr;
import org.flutterjs.analyzer.ir.expr.CastExpr;
import org.flutterjs.analyzer.ir.expr.CollectionForExpr;
import org.flutterjs.analyzer.ir.expr.CollectionForLoopExpr;
import org.flutterjs.analyzer.ir.expr.CollectionIfExpr;
import org.flutterjs.analyzer.ir.expr.ConditionalExpr;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;
import org.flutterjs.analyzer.ir.expr.FunctionExpr;
import org.flutterjs.analyzer.ir.expr.IdentifierExpr;
import org.flutterjs.analyzer.ir.expr.IndexExpr;
import org.flutterjs.analyzer.ir.expr.InstanceCreationExpr;
import org.flutterjs.analyzer.ir.expr.InvocationExpr;
import org.flutterjs.analyzer.ir.expr.ListLiteralExpr;
import org.flutterjs.analyzer.ir.expr.LiteralExpr;
import org.flutterjs.analyzer.ir.expr.MapEntryExpr;
import org.flutterjs.analyzer.ir.expr.MapLiteralExpr;
import org.flutterjs.analyzer.ir.expr.MethodCallExpr;
import org.flutterjs.analyzer.ir.expr.PropertyAccessExpr;
import org.flutterjs.analyzer.ir.expr.SetLiteralExpr;
import org.flutterjs.analyzer.ir.expr.SpreadExpr;
import org.flutterjs.analyzer.ir.expr.StringTemplateExpr;
import org.flutterjs.analyzer.ir.expr.ThrowExpr;
import org.flutterjs.analyzer.ir.expr.TypeTestExpr;
import org.flutterjs.analyzer.ir.expr.UnaryExpr;
import org.flutterjs.analyzer.ir.stmt.AssertStmt;
import org.flutterjs.analyzer.ir.stmt.BlockStmt;
import org.flutterjs.analyzer.ir.stmt.BreakStmt;
import org.flutterjs.analyzer.ir.stmt.CatchClause;
import org.flutterjs.analyzer.ir.stmt.ContinueStmt;
import org.flutterjs.analyzer.ir.stmt.DoWhileStmt;
import org.flutterjs.analyzer.ir.stmt.ExpressionStmt;
import org.flutterjs.analyzer.ir.stmt.ForEachStmt;
import org.flutterjs.analyzer.ir.stmt.ForStmt;
import org.flutterjs.analyzer.ir.stmt.IfStmt;
import org.flutterjs.analyzer.ir.stmt.LocalFunctionStmt;
import org.flutterjs.analyzer.ir.stmt.ReturnStmt;
import org.flutterjs.analyzer.ir.stmt.StatementIR;
import org.flutterjs.analyzer.ir.stmt.SwitchCase;
import org.flutterjs.analyzer.ir.stmt.SwitchStmt;
import org.flutterjs.analyzer.ir.stmt.TryStmt;
import org.flutterjs.analyzer.ir.stmt.VariableDeclStmt;
import org.flutterjs.analyzer.ir.stmt.WhileStmt;
import org.flutterjs.analyzer.ir.stmt.YieldStmt;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the Dart subset used by Flutter UI code. It consumes the tokens
 * produced by the {@link org.flutterjs.analyzer.frontend.lexer.Lexer} and produces a list of
 * top-level declaration nodes. Function bodies, initializers and default values are parsed
 * straight into {@link StatementIR} and {@link ExpressionIR} trees.
 * <p>
 * Every syntax error is reported to the {@link DiagnosticsEngine}; the parser then skips to the
 * next declaration so that several errors can be reported in one pass.
 */
public class Parser {

    private static final Set<TokenType> ASSIGNMENT_OPERATORS = EnumSet.of(
            TokenType.EQUAL, TokenType.PLUS_EQUAL, TokenType.MINUS_EQUAL, TokenType.STAR_EQUAL,
            TokenType.SLASH_EQUAL, TokenType.TILDE_SLASH_EQUAL, TokenType.PERCENT_EQUAL, TokenType.AMP_EQUAL,
            TokenType.PIPE_EQUAL, TokenType.CARET_EQUAL, TokenType.LESS_LESS_EQUAL,
            TokenType.QUESTION_QUESTION_EQUAL);

    private static final Set<String> CLASS_MODIFIERS = Set.of("abstract", "base", "interface", "sealed", "final", "mixin");

    /** Maximum nesting of statements and expressions; deeper input is a syntax error. */
    static final int MAX_NESTING = 128;

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;
    private int nesting = 0;

    /**
     * Thrown after a syntax error has been reported, to unwind to the next declaration.
     */
    private static final class ParseError extends RuntimeException {
        ParseError(String message) {
            super(message);
        }
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by END_OF_FILE.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream and returns the top-level AST nodes in source order.
     * @return A list of parsed {@link AstNode}s.
     */
    public List<AstNode> parse() {
        List<AstNode> declarations = new ArrayList<>();
        while (!isAtEnd()) {
            int before = current;
            try {
                topLevelDeclaration(declarations);
            } catch (ParseError ex) {
                synchronize();
            }
            if (current == before) {
                advance();
            }
        }
        return declarations;
    }

    /**
     * Parses the token stream as a single expression, as found inside {@code ${...}}.
     * @return The expression, or {@code null} if it could not be parsed.
     */
    public ExpressionIR parseStandaloneExpression() {
        try {
            ExpressionIR expression = expression();
            if (!isAtEnd()) {
                throw error(peek(), "Unexpected '" + peek().text() + "' in string interpolation.");
            }
            return expression;
        } catch (ParseError ex) {
            return null;
        }
    }

    // ---------------------------------------------------------------- top level

    private void topLevelDeclaration(List<AstNode> out) {
        annotations();
        Token start = peek();
        if (start.isIdentifier("library")) {
            out.add(libraryDirective());
        } else if (start.isIdentifier("import")) {
            out.add(importDirective());
        } else if (start.isIdentifier("export")) {
            out.add(exportDirective());
        } else if (start.isIdentifier("part")) {
            out.add(partDirective());
        } else if (isClassStart()) {
            out.add(classDeclaration());
        } else if (start.isIdentifier("mixin") || (start.isIdentifier("base") && tokenAt(current + 1).isIdentifier("mixin"))) {
            if (start.isIdentifier("base")) advance();
            out.add(mixinDeclaration());
        } else if (start.isKeyword("enum")) {
            out.add(enumDeclaration());
        } else if (start.isIdentifier("typedef")) {
            out.add(typedefDeclaration());
        } else if (start.isIdentifier("extension") && !checkNext(TokenType.LEFT_PAREN)) {
            out.add(extensionDeclaration());
        } else {
            for (AstNode member : member(null)) {
                if (member instanceof FieldNode f) {
                    out.add(new VariableNode(f.name(), f.type(), f.modifiers(), f.initializer(), f.location()));
                } else {
                    out.add(member);
                }
            }
        }
    }

    private LibraryNode libraryDirective() {
        Token keyword = advance();
        String name = "";
        if (!check(TokenType.SEMICOLON)) {
            name = dottedName();
        }
        consume(TokenType.SEMICOLON, "Expected ';' after library directive.");
        return new LibraryNode(name, location(keyword));
    }

    private ImportNode importDirective() {
        Token keyword = advance();
        String uri = uriLiteral();
        configurations();
        boolean deferred = false;
        String prefix = null;
        if (peek().isIdentifier("deferred")) {
            advance();
            deferred = true;
        }
        if (peek().isIdentifier("as")) {
            advance();
            prefix = consume(TokenType.IDENTIFIER, "Expected prefix name after 'as'.").text();
        }
        List<String> show = new ArrayList<>();
        List<String> hide = new ArrayList<>();
        combinators(show, hide);
        consume(TokenType.SEMICOLON, "Expected ';' after import directive.");
        return new ImportNode(uri, prefix, show, hide, deferred, location(keyword));
    }

    private ExportNode exportDirective() {
        Token keyword = advance();
        String uri = uriLiteral();
        configurations();
        List<String> show = new ArrayList<>();
        List<String> hide = new ArrayList<>();
        combinators(show, hide);
        consume(TokenType.SEMICOLON, "Expected ';' after export directive.");
        return new ExportNode(uri, show, hide, location(keyword));
    }

    private AstNode partDirective() {
        Token keyword = advance();
        if (peek().isIdentifier("of")) {
            advance();
            String library = check(TokenType.STRING) ? uriLiteral() : dottedName();
            consume(TokenType.SEMICOLON, "Expected ';' after part-of directive.");
            return new PartOfNode(library, location(keyword));
        }
        String uri = uriLiteral();
        consume(TokenType.SEMICOLON, "Expected ';' after part directive.");
        return new PartNode(uri, location(keyword));
    }

    /** Skips conditional import configurations: {@code if (dart.library.io) 'io.dart'}. */
    private void configurations() {
        while (peek().isKeyword("if")) {
            advance();
            consume(TokenType.LEFT_PAREN, "Expected '(' after 'if' in configuration.");
            while (!check(TokenType.RIGHT_PAREN) && !isAtEnd()) advance();
            consume(TokenType.RIGHT_PAREN, "Expected ')' in configuration.");
            uriLiteral();
        }
    }

    private void combinators(List<String> show, List<String> hide) {
        while (peek().isIdentifier("show") || peek().isIdentifier("hide")) {
            List<String> target = advance().text().equals("show") ? show : hide;
            do {
                target.add(consume(TokenType.IDENTIFIER, "Expected name in combinator.").text());
            } while (match(TokenType.COMMA));
        }
    }

    private String uriLiteral() {
        Token token = consume(TokenType.STRING, "Expected URI string.");
        return stringText(token);
    }

    private String dottedName() {
        StringBuilder name = new StringBuilder(consume(TokenType.IDENTIFIER, "Expected name.").text());
        while (match(TokenType.DOT)) {
            name.append('.').append(consume(TokenType.IDENTIFIER, "Expected name after '.'.").text());
        }
        return name.toString();
    }

    // ---------------------------------------------------------------- type declarations

    private boolean isClassStart() {
        int i = current;
        while (CLASS_MODIFIERS.contains(tokenAt(i).text())
                && (tokenAt(i).type() == TokenType.IDENTIFIER || tokenAt(i).isKeyword("final"))) {
            i++;
        }
        return tokenAt(i).isKeyword("class");
    }

    private ClassNode classDeclaration() {
        boolean abstractClass = false;
        while (!peek().isKeyword("class")) {
            if (advance().text().equals("abstract")) abstractClass = true;
        }
        advance();
        Token name = consume(TokenType.IDENTIFIER, "Expected class name.");
        List<String> typeParameters = typeParameters();
        TypeRef superclass = null;
        List<TypeRef> mixins = new ArrayList<>();
        List<TypeRef> interfaces = new ArrayList<>();
        if (match(TokenType.EQUAL)) {
            // Mixin application: class A = B with C;
            superclass = parseType(false);
            if (matchKeyword("with")) mixins = typeList();
            if (matchIdentifier("implements")) interfaces = typeList();
            consume(TokenType.SEMICOLON, "Expected ';' after mixin application.");
            return new ClassNode(name.text(), abstractClass, typeParameters, superclass, mixins, interfaces,
                    List.of(), location(name));
        }
        if (matchKeyword("extends")) superclass = parseType(false);
        if (matchKeyword("with")) mixins = typeList();
        if (matchIdentifier("implements")) interfaces = typeList();
        List<AstNode> members = classBody(name.text());
        return new ClassNode(name.text(), abstractClass, typeParameters, superclass, mixins, interfaces,
                members, location(name));
    }

    private MixinNode mixinDeclaration() {
        advance();
        Token name = consume(TokenType.IDENTIFIER, "Expected mixin name.");
        List<String> typeParameters = typeParameters();
        List<TypeRef> onTypes = new ArrayList<>();
        List<TypeRef> interfaces = new ArrayList<>();
        if (matchIdentifier("on")) onTypes = typeList();
        if (matchIdentifier("implements")) interfaces = typeList();
        List<AstNode> members = classBody(name.text());
        return new MixinNode(name.text(), typeParameters, onTypes, interfaces, members, location(name));
    }

    private EnumNode enumDeclaration() {
        advance();
        Token name = consume(TokenType.IDENTIFIER, "Expected enum name.");
        typeParameters();
        List<TypeRef> mixins = new ArrayList<>();
        List<TypeRef> interfaces = new ArrayList<>();
        if (matchKeyword("with")) mixins = typeList();
        if (matchIdentifier("implements")) interfaces = typeList();
        consume(TokenType.LEFT_BRACE, "Expected '{' after enum name.");
        List<String> values = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !check(TokenType.SEMICOLON) && !isAtEnd()) {
            annotations();
            values.add(consume(TokenType.IDENTIFIER, "Expected enum value.").text());
            if (check(TokenType.LESS)) typeArguments();
            if (match(TokenType.DOT)) consume(TokenType.IDENTIFIER, "Expected constructor name.");
            if (check(TokenType.LEFT_PAREN)) arguments();
            if (!match(TokenType.COMMA)) break;
        }
        List<AstNode> members = new ArrayList<>();
        if (match(TokenType.SEMICOLON)) {
            while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                members.addAll(member(name.text()));
            }
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' after enum body.");
        return new EnumNode(name.text(), values, mixins, interfaces, members, location(name));
    }

    private ExtensionNode extensionDeclaration() {
        Token keyword = advance();
        String name = null;
        if (check(TokenType.IDENTIFIER) && !peek().isIdentifier("on")) {
            name = advance().text();
        }
        List<String> typeParameters = typeParameters();
        if (!matchIdentifier("on")) {
            throw error(peek(), "Expected 'on' in extension declaration.");
        }
        TypeRef onType = parseType(false);
        if (name == null) {
            name = "extension@" + keyword.line() + ":" + keyword.column();
        }
        List<AstNode> members = classBody(name);
        return new ExtensionNode(name, typeParameters, onType, members, location(keyword));
    }

    private TypedefNode typedefDeclaration() {
        advance();
        if (check(TokenType.IDENTIFIER) && (checkNext(TokenType.EQUAL) || checkNext(TokenType.LESS))) {
            Token name = advance();
            List<String> typeParameters = typeParameters();
            consume(TokenType.EQUAL, "Expected '=' in typedef.");
            TypeRef aliased = parseType(false);
            consume(TokenType.SEMICOLON, "Expected ';' after typedef.");
            return new TypedefNode(name.text(), typeParameters, aliased, location(name));
        }
        // Legacy function type alias: typedef void Callback(int value);
        if (isTypeFollowedByName(current)) parseType(false);
        Token name = consume(TokenType.IDENTIFIER, "Expected typedef name.");
        List<String> typeParameters = typeParameters();
        formalParameters();
        consume(TokenType.SEMICOLON, "Expected ';' after typedef.");
        return new TypedefNode(name.text(), typeParameters, TypeRef.of("Function"), location(name));
    }

    private List<AstNode> classBody(String className) {
        consume(TokenType.LEFT_BRACE, "Expected '{' before class body.");
        List<AstNode> members = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            int before = current;
            try {
                members.addAll(member(className));
            } catch (ParseError ex) {
                synchronizeMember();
            }
            if (current == before) advance();
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' after class body.");
        return members;
    }

    /**
     * Parses one member of a type body, or a top-level function or variable when
     * {@code className} is {@code null}.
     */
    private List<AstNode> member(String className) {
        Set<String> annotations = annotations();
        Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
        if (annotations.contains("override")) modifiers.add(Modifier.OVERRIDE);
        while (true) {
            Token t = peek();
            if (t.isIdentifier("external")) modifiers.add(Modifier.EXTERNAL);
            else if (t.isIdentifier("static") && !checkNext(TokenType.LEFT_PAREN)) modifiers.add(Modifier.STATIC);
            else if (t.isIdentifier("late") && !checkNext(TokenType.LEFT_PAREN)) modifiers.add(Modifier.LATE);
            else if (t.isIdentifier("factory") && checkNext(TokenType.IDENTIFIER)) modifiers.add(Modifier.FACTORY);
            else if (t.isIdentifier("abstract") && checkNext(TokenType.IDENTIFIER)) modifiers.add(Modifier.ABSTRACT);
            else if (t.isIdentifier("covariant") && checkNext(TokenType.IDENTIFIER)) { /* no effect on the IR */ }
            else if (t.isKeyword("final")) modifiers.add(Modifier.FINAL);
            else if (t.isKeyword("const")) modifiers.add(Modifier.CONST);
            else if (!t.isKeyword("var")) break;
            advance();
        }

        if (match(TokenType.SEMICOLON)) {
            return List.of();
        }
        if (className != null && peek().isIdentifier(className)
                && (checkNext(TokenType.LEFT_PAREN) || checkNext(TokenType.DOT))) {
            return List.of(constructor(modifiers));
        }

        TypeRef type = null;
        if (!atAccessorKeyword() && isTypeFollowedByName(current)) {
            type = parseType(false);
        }

        if (peek().isIdentifier("get") && checkNext(TokenType.IDENTIFIER)) {
            advance();
            Token name = advance();
            StatementIR body = functionBody(modifiers, true);
            return List.of(new MethodNode(name.text(), orDynamic(type), List.of(), body, MethodKind.GETTER,
                    modifiers, location(name)));
        }
        if (peek().isIdentifier("set") && checkNext(TokenType.IDENTIFIER)) {
            advance();
            Token name = advance();
            List<ParameterDeclaration> parameters = formalParameters();
            StatementIR body = functionBody(modifiers, true);
            return List.of(new MethodNode(name.text(), type == null ? TypeRef.of("void") : type, parameters, body,
                    MethodKind.SETTER, modifiers, location(name)));
        }
        if (peek().isIdentifier("operator") && atAccessorKeyword()) {
            Token keyword = advance();
            String operator = operatorName();
            List<ParameterDeclaration> parameters = formalParameters();
            StatementIR body = functionBody(modifiers, true);
            return List.of(new MethodNode(operator, orDynamic(type), parameters, body, MethodKind.OPERATOR,
                    modifiers, location(keyword)));
        }

        Token name = consume(TokenType.IDENTIFIER, "Expected member name.");
        if (check(TokenType.LEFT_PAREN) || check(TokenType.LESS)) {
            typeParameters();
            List<ParameterDeclaration> parameters = formalParameters();
            StatementIR body = functionBody(modifiers, true);
            return List.of(new MethodNode(name.text(), orDynamic(type), parameters, body, MethodKind.METHOD,
                    modifiers, location(name)));
        }

        List<AstNode> fields = new ArrayList<>();
        while (true) {
            ExpressionIR initializer = match(TokenType.EQUAL) ? expression() : null;
            fields.add(new FieldNode(name.text(), orDynamic(type), modifiers, initializer, location(name)));
            if (!match(TokenType.COMMA)) break;
            name = consume(TokenType.IDENTIFIER, "Expected field name after ','.");
        }
        consume(TokenType.SEMICOLON, "Expected ';' after field declaration.");
        return fields;
    }

    private boolean atAccessorKeyword() {
        Token t = peek();
        if (t.isIdentifier("get") || t.isIdentifier("set")) {
            return checkNext(TokenType.IDENTIFIER);
        }
        if (t.isIdentifier("operator")) {
            TokenType next = tokenAt(current + 1).type();
            return next != TokenType.LEFT_PAREN && next != TokenType.SEMICOLON && next != TokenType.EQUAL
                    && next != TokenType.COMMA && next != TokenType.IDENTIFIER;
        }
        return false;
    }

    private String operatorName() {
        if (match(TokenType.LEFT_BRACKET)) {
            consume(TokenType.RIGHT_BRACKET, "Expected ']' in operator name.");
            return match(TokenType.EQUAL) ? "[]=" : "[]";
        }
        if (check(TokenType.GREATER) && checkNext(TokenType.GREATER) && adjacent(current)) {
            advance();
            advance();
            return ">>";
        }
        if (check(TokenType.MINUS) && checkNext(TokenType.LEFT_PAREN) && tokenAt(current + 2).type() == TokenType.RIGHT_PAREN) {
            advance();
            return "unary-";
        }
        return advance().text();
    }

    private ConstructorNode constructor(Set<Modifier> modifiers) {
        Token className = advance();
        String name = null;
        if (match(TokenType.DOT)) {
            name = consume(TokenType.IDENTIFIER, "Expected constructor name after '.'.").text();
        }
        List<ParameterDeclaration> parameters = formalParameters();
        List<InitializerDeclaration> initializers = new ArrayList<>();
        if (match(TokenType.COLON)) {
            do {
                initializers.add(initializer());
            } while (match(TokenType.COMMA));
        } else if (modifiers.contains(Modifier.FACTORY) && match(TokenType.EQUAL)) {
            TypeRef target = parseType(false);
            String targetName = target.name();
            if (match(TokenType.DOT)) {
                targetName = targetName + "." + consume(TokenType.IDENTIFIER, "Expected constructor name.").text();
            }
            initializers.add(new InitializerDeclaration(InitializerDeclaration.Kind.REDIRECT, targetName, null, List.of()));
            consume(TokenType.SEMICOLON, "Expected ';' after redirecting factory.");
            return new ConstructorNode(name, parameters, modifiers, initializers, null, location(className));
        }
        StatementIR body;
        if (match(TokenType.SEMICOLON)) {
            body = null;
        } else {
            body = functionBody(EnumSet.noneOf(Modifier.class), true);
        }
        return new ConstructorNode(name, parameters, modifiers, initializers, body, location(className));
    }

    private InitializerDeclaration initializer() {
        if (matchKeyword("super")) {
            String name = match(TokenType.DOT) ? consume(TokenType.IDENTIFIER, "Expected constructor name.").text() : null;
            return new InitializerDeclaration(InitializerDeclaration.Kind.SUPER, name, null, arguments());
        }
        if (matchKeyword("assert")) {
            consume(TokenType.LEFT_PAREN, "Expected '(' after 'assert'.");
            ExpressionIR condition = expression();
            if (match(TokenType.COMMA) && !check(TokenType.RIGHT_PAREN)) {
                expression();
                match(TokenType.COMMA);
            }
            consume(TokenType.RIGHT_PAREN, "Expected ')' after assertion.");
            return new InitializerDeclaration(InitializerDeclaration.Kind.ASSERT, null, condition, List.of());
        }
        if (matchKeyword("this")) {
            if (check(TokenType.LEFT_PAREN)) {
                return new InitializerDeclaration(InitializerDeclaration.Kind.REDIRECT, null, null, arguments());
            }
            consume(TokenType.DOT, "Expected '.' after 'this'.");
            Token name = consume(TokenType.IDENTIFIER, "Expected field or constructor name.");
            if (check(TokenType.LEFT_PAREN)) {
                return new InitializerDeclaration(InitializerDeclaration.Kind.REDIRECT, name.text(), null, arguments());
            }
            consume(TokenType.EQUAL, "Expected '=' in field initializer.");
            return new InitializerDeclaration(InitializerDeclaration.Kind.FIELD, name.text(), conditional(), List.of());
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected initializer.");
        consume(TokenType.EQUAL, "Expected '=' in field initializer.");
        return new InitializerDeclaration(InitializerDeclaration.Kind.FIELD, name.text(), conditional(), List.of());
    }

    // ---------------------------------------------------------------- parameters and types

    private List<ParameterDeclaration> formalParameters() {
        consume(TokenType.LEFT_PAREN, "Expected '(' before parameter list.");
        List<ParameterDeclaration> parameters = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN) && !isAtEnd()) {
            if (match(TokenType.LEFT_BRACKET)) {
                while (!check(TokenType.RIGHT_BRACKET) && !isAtEnd()) {
                    parameters.add(formalParameter(ParameterDeclaration.Kind.OPTIONAL_POSITIONAL));
                    if (!match(TokenType.COMMA)) break;
                }
                consume(TokenType.RIGHT_BRACKET, "Expected ']' after optional parameters.");
            } else if (match(TokenType.LEFT_BRACE)) {
                while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                    parameters.add(formalParameter(ParameterDeclaration.Kind.NAMED));
                    if (!match(TokenType.COMMA)) break;
                }
                consume(TokenType.RIGHT_BRACE, "Expected '}' after named parameters.");
            } else {
                parameters.add(formalParameter(ParameterDeclaration.Kind.POSITIONAL));
            }
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after parameter list.");
        return parameters;
    }

    private ParameterDeclaration formalParameter(ParameterDeclaration.Kind kind) {
        Set<String> annotations = annotations();
        boolean required = kind == ParameterDeclaration.Kind.POSITIONAL || annotations.contains("required");
        if (peek().isIdentifier("required") && !isParameterNameEnd(tokenAt(current + 1))) {
            advance();
            required = true;
        }
        while (peek().isKeyword("final") || peek().isKeyword("var") || peek().isKeyword("const")
                || (peek().isIdentifier("covariant") && !isParameterNameEnd(tokenAt(current + 1)))) {
            advance();
        }
        TypeRef type = null;
        if (!peek().isKeyword("this") && !peek().isKeyword("super") && isTypeFollowedByParameterName(current)) {
            type = parseType(false);
        }
        boolean fieldFormal = false;
        boolean superFormal = false;
        if (matchKeyword("this")) {
            consume(TokenType.DOT, "Expected '.' after 'this'.");
            fieldFormal = true;
        } else if (matchKeyword("super")) {
            consume(TokenType.DOT, "Expected '.' after 'super'.");
            superFormal = true;
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected parameter name.");
        if (check(TokenType.LEFT_PAREN)) {
            // Function-typed parameter: void onTap()
            formalParameters();
            match(TokenType.QUESTION);
            type = TypeRef.of("Function");
        }
        ExpressionIR defaultValue = null;
        if (match(TokenType.EQUAL, TokenType.COLON)) {
            defaultValue = expression();
        }
        return new ParameterDeclaration(name.text(), orDynamic(type), kind, required, defaultValue, fieldFormal, superFormal);
    }

    private boolean isParameterNameEnd(Token token) {
        TokenType t = token.type();
        return t == TokenType.COMMA || t == TokenType.RIGHT_BRACE || t == TokenType.RIGHT_BRACKET
                || t == TokenType.RIGHT_PAREN || t == TokenType.EQUAL || t == TokenType.COLON;
    }

    private List<String> typeParameters() {
        List<String> names = new ArrayList<>();
        if (!match(TokenType.LESS)) return names;
        do {
            annotations();
            names.add(consume(TokenType.IDENTIFIER, "Expected type parameter name.").text());
            if (matchKeyword("extends")) parseType(false);
        } while (match(TokenType.COMMA));
        consume(TokenType.GREATER, "Expected '>' after type parameters.");
        return names;
    }

    private List<TypeRef> typeList() {
        List<TypeRef> types = new ArrayList<>();
        do {
            types.add(parseType(false));
        } while (match(TokenType.COMMA));
        return types;
    }

    private List<TypeRef> typeArguments() {
        consume(TokenType.LESS, "Expected '<'.");
        List<TypeRef> arguments = new ArrayList<>();
        do {
            arguments.add(parseType(false));
        } while (match(TokenType.COMMA));
        consume(TokenType.GREATER, "Expected '>' after type arguments.");
        return arguments;
    }

    /**
     * Parses a type reference. Inside expressions a trailing {@code ?} is only taken as the
     * nullability marker when it cannot start the middle part of a conditional expression.
     */
    private TypeRef parseType(boolean inExpression) {
        TypeRef type;
        if (matchKeyword("void")) {
            type = TypeRef.of("void");
        } else if (check(TokenType.LEFT_PAREN)) {
            // Record types are recorded by name only.
            skipBalanced(TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN);
            type = TypeRef.of("Record");
        } else {
            StringBuilder name = new StringBuilder(consume(TokenType.IDENTIFIER, "Expected type name.").text());
            while (check(TokenType.DOT) && checkNext(TokenType.IDENTIFIER)) {
                advance();
                name.append('.').append(advance().text());
            }
            List<TypeRef> arguments = check(TokenType.LESS) ? typeArguments() : List.of();
            if (name.toString().equals("Function") && check(TokenType.LEFT_PAREN)) {
                skipBalanced(TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN);
            }
            type = new TypeRef(name.toString(), arguments, false);
        }
        while (peek().isIdentifier("Function") && tokenAt(current + 1).type() != TokenType.IDENTIFIER) {
            advance();
            if (check(TokenType.LESS)) skipBalanced(TokenType.LESS, TokenType.GREATER);
            if (check(TokenType.LEFT_PAREN)) skipBalanced(TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN);
            type = TypeRef.of("Function");
        }
        if (check(TokenType.QUESTION) && (!inExpression || endsNullableTypeInExpression(tokenAt(current + 1)))) {
            advance();
            type = new TypeRef(type.name(), type.typeArguments(), true);
        }
        return type;
    }

    private boolean endsNullableTypeInExpression(Token next) {
        return switch (next.type()) {
            case RIGHT_PAREN, SEMICOLON, COMMA, AMP_AMP, PIPE_PIPE, RIGHT_BRACKET, RIGHT_BRACE, QUESTION,
                    END_OF_FILE -> true;
            default -> false;
        };
    }

    private void skipBalanced(TokenType open, TokenType close) {
        int depth = 0;
        do {
            Token t = advance();
            if (t.type() == open) depth++;
            else if (t.type() == close) depth--;
        } while (depth > 0 && !isAtEnd());
    }

    // ---------------------------------------------------------------- lookahead

    /** Returns the index after a type starting at {@code i}, or -1 if no type starts there. */
    private int skipType(int i) {
        Token t = tokenAt(i);
        if (t.isKeyword("void")) {
            i++;
        } else if (t.type() == TokenType.IDENTIFIER) {
            i++;
            while (tokenAt(i).type() == TokenType.DOT && tokenAt(i + 1).type() == TokenType.IDENTIFIER) {
                i += 2;
            }
            if (tokenAt(i).type() == TokenType.LESS) {
                i = skipTypeArguments(i);
                if (i < 0) return -1;
            }
            if (t.text().equals("Function") && tokenAt(i).type() == TokenType.LEFT_PAREN) {
                i = skipBalancedAt(i, TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN);
                if (i < 0) return -1;
            }
        } else {
            return -1;
        }
        while (tokenAt(i).isIdentifier("Function") && tokenAt(i + 1).type() != TokenType.IDENTIFIER) {
            i++;
            if (tokenAt(i).type() == TokenType.LESS) {
                i = skipTypeArguments(i);
                if (i < 0) return -1;
            }
            if (tokenAt(i).type() != TokenType.LEFT_PAREN) return -1;
            i = skipBalancedAt(i, TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN);
            if (i < 0) return -1;
            if (tokenAt(i).type() == TokenType.QUESTION) i++;
        }
        if (tokenAt(i).type() == TokenType.QUESTION) i++;
        return i;
    }

    private int skipTypeArguments(int i) {
        int depth = 0;
        while (true) {
            Token t = tokenAt(i);
            switch (t.type()) {
                case LESS -> depth++;
                case GREATER -> {
                    depth--;
                    if (depth == 0) return i + 1;
                }
                case IDENTIFIER, COMMA, DOT, QUESTION, LEFT_PAREN, RIGHT_PAREN -> { }
                case KEYWORD -> {
                    if (!t.text().equals("void")) return -1;
                }
                default -> {
                    return -1;
                }
            }
            i++;
        }
    }

    private int skipBalancedAt(int i, TokenType open, TokenType close) {
        int depth = 0;
        do {
            Token t = tokenAt(i);
            if (t.type() == TokenType.END_OF_FILE) return -1;
            if (t.type() == open) depth++;
            else if (t.type() == close) depth--;
            i++;
        } while (depth > 0);
        return i;
    }

    private boolean isTypeFollowedByName(int i) {
        int end = skipType(i);
        return end > 0 && tokenAt(end).type() == TokenType.IDENTIFIER;
    }

    private boolean isTypeFollowedByParameterName(int i) {
        int end = skipType(i);
        if (end < 0) return false;
        Token next = tokenAt(end);
        return next.type() == TokenType.IDENTIFIER || next.isKeyword("this") || next.isKeyword("super");
    }

    private boolean isLocalVariableStart() {
        Token t = peek();
        if (t.isKeyword("var") || t.isKeyword("final")) return true;
        if (t.isIdentifier("late") && (checkNext(TokenType.IDENTIFIER) || tokenAt(current + 1).isKeyword("final"))) {
            return true;
        }
        if (t.isKeyword("const")) {
            int end = skipType(current + 1);
            if (end > 0 && tokenAt(end).type() == TokenType.IDENTIFIER) return true;
            return checkNext(TokenType.IDENTIFIER) && tokenAt(current + 2).type() == TokenType.EQUAL;
        }
        int end = skipType(current);
        if (end < 0 || tokenAt(end).type() != TokenType.IDENTIFIER) return false;
        TokenType after = tokenAt(end + 1).type();
        return after == TokenType.EQUAL || after == TokenType.SEMICOLON || after == TokenType.COMMA;
    }

    private boolean isLocalFunctionStart() {
        int i = current;
        int end = skipType(i);
        if (end > 0 && tokenAt(end).type() == TokenType.IDENTIFIER && tokenAt(end + 1).type() == TokenType.LEFT_PAREN) {
            i = end;
        }
        if (tokenAt(i).type() != TokenType.IDENTIFIER || tokenAt(i + 1).type() != TokenType.LEFT_PAREN) {
            return false;
        }
        int close = skipBalancedAt(i + 1, TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN);
        return close > 0 && startsFunctionBody(tokenAt(close));
    }

    private boolean startsFunctionBody(Token token) {
        return token.type() == TokenType.LEFT_BRACE || token.type() == TokenType.ARROW
                || token.isIdentifier("async") || token.isIdentifier("sync");
    }

    private boolean isFunctionLiteralStart() {
        if (!check(TokenType.LEFT_PAREN)) return false;
        int close = skipBalancedAt(current, TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN);
        return close > 0 && startsFunctionBody(tokenAt(close));
    }

    private boolean isGenericCall() {
        if (!check(TokenType.LESS)) return false;
        int end = skipTypeArguments(current);
        return end > 0 && tokenAt(end).type() == TokenType.LEFT_PAREN;
    }

    // ---------------------------------------------------------------- statements

    private StatementIR functionBody(Set<Modifier> modifiers, boolean requireSemicolon) {
        if (peek().isIdentifier("async")) {
            advance();
            modifiers.add(Modifier.ASYNC);
            if (match(TokenType.STAR)) modifiers.add(Modifier.GENERATOR);
        } else if (peek().isIdentifier("sync") && checkNext(TokenType.STAR)) {
            advance();
            advance();
            modifiers.add(Modifier.GENERATOR);
        }
        if (match(TokenType.ARROW)) {
            ExpressionIR value = expression();
            if (requireSemicolon) consume(TokenType.SEMICOLON, "Expected ';' after expression body.");
            return new ReturnStmt(value);
        }
        if (check(TokenType.LEFT_BRACE)) {
            return block();
        }
        if (requireSemicolon && match(TokenType.SEMICOLON)) {
            return null;
        }
        throw error(peek(), "Expected function body.");
    }

    private BlockStmt block() {
        consume(TokenType.LEFT_BRACE, "Expected '{'.");
        List<StatementIR> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            blockItem(statements);
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' after block.");
        return new BlockStmt(statements);
    }

    private void blockItem(List<StatementIR> out) {
        if (isLocalVariableStart()) {
            out.addAll(localVariables());
            consume(TokenType.SEMICOLON, "Expected ';' after variable declaration.");
        } else {
            out.add(statement());
        }
    }

    private StatementIR statement() {
        enterNesting();
        try {
            return nestedStatement();
        } finally {
            nesting--;
        }
    }

    private StatementIR nestedStatement() {
        Token t = peek();
        if (check(TokenType.LEFT_BRACE)) return block();
        if (t.isKeyword("if")) return ifStatement();
        if (t.isKeyword("for")) return forStatement(false);
        if (t.isIdentifier("await") && tokenAt(current + 1).isKeyword("for")) {
            advance();
            return forStatement(true);
        }
        if (t.isKeyword("while")) return whileStatement();
        if (t.isKeyword("do")) return doStatement();
        if (t.isKeyword("switch")) return switchStatement();
        if (t.isKeyword("try")) return tryStatement();
        if (t.isKeyword("return")) {
            advance();
            ExpressionIR value = check(TokenType.SEMICOLON) ? null : expression();
            consume(TokenType.SEMICOLON, "Expected ';' after return.");
            return new ReturnStmt(value);
        }
        if (t.isKeyword("break") || t.isKeyword("continue")) {
            advance();
            String label = check(TokenType.IDENTIFIER) ? advance().text() : null;
            consume(TokenType.SEMICOLON, "Expected ';' after " + t.text() + ".");
            return t.isKeyword("break") ? new BreakStmt(label) : new ContinueStmt(label);
        }
        if (t.isKeyword("rethrow")) {
            advance();
            consume(TokenType.SEMICOLON, "Expected ';' after rethrow.");
            return new ExpressionStmt(new ThrowExpr(null));
        }
        if (t.isKeyword("assert")) {
            advance();
            consume(TokenType.LEFT_PAREN, "Expected '(' after 'assert'.");
            ExpressionIR condition = expression();
            ExpressionIR message = null;
            if (match(TokenType.COMMA) && !check(TokenType.RIGHT_PAREN)) {
                message = expression();
                match(TokenType.COMMA);
            }
            consume(TokenType.RIGHT_PAREN, "Expected ')' after assertion.");
            consume(TokenType.SEMICOLON, "Expected ';' after assertion.");
            return new AssertStmt(condition, message);
        }
        if (t.isIdentifier("yield") && (checkNext(TokenType.STAR) || !isExpressionContinuation(tokenAt(current + 1)))) {
            advance();
            boolean star = match(TokenType.STAR);
            ExpressionIR value = expression();
            consume(TokenType.SEMICOLON, "Expected ';' after yield.");
            return new YieldStmt(value, star);
        }
        if (t.type() == TokenType.IDENTIFIER && checkNext(TokenType.COLON)) {
            // Labels only matter to break/continue, which keep the label name.
            advance();
            advance();
            return statement();
        }
        if (isLocalFunctionStart()) return localFunction();
        if (isLocalVariableStart()) {
            List<StatementIR> variables = localVariables();
            consume(TokenType.SEMICOLON, "Expected ';' after variable declaration.");
            return variables.size() == 1 ? variables.get(0) : new BlockStmt(variables);
        }
        ExpressionIR expression = expression();
        consume(TokenType.SEMICOLON, "Expected ';' after expression.");
        return new ExpressionStmt(expression);
    }

    private boolean isExpressionContinuation(Token next) {
        TokenType t = next.type();
        return t == TokenType.SEMICOLON || t == TokenType.DOT || t == TokenType.LEFT_PAREN
                || t == TokenType.QUESTION_DOT || ASSIGNMENT_OPERATORS.contains(t);
    }

    private List<StatementIR> localVariables() {
        Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
        while (true) {
            if (peek().isIdentifier("late")) modifiers.add(Modifier.LATE);
            else if (peek().isKeyword("final")) modifiers.add(Modifier.FINAL);
            else if (peek().isKeyword("const")) modifiers.add(Modifier.CONST);
            else if (!peek().isKeyword("var")) break;
            advance();
        }
        TypeRef type = isTypeFollowedByName(current) ? parseType(false) : null;
        List<StatementIR> variables = new ArrayList<>();
        do {
            Token name = consume(TokenType.IDENTIFIER, "Expected variable name.");
            ExpressionIR initializer = match(TokenType.EQUAL) ? expression() : null;
            variables.add(new VariableDeclStmt(name.text(), orDynamic(type), initializer, modifiers));
        } while (match(TokenType.COMMA));
        return variables;
    }

    private StatementIR localFunction() {
        TypeRef returnType = null;
        if (!(check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_PAREN))) {
            returnType = parseType(false);
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected function name.");
        typeParameters();
        List<ParameterDeclaration> parameters = formalParameters();
        Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
        StatementIR body = functionBody(modifiers, true);
        return new LocalFunctionStmt(new FunctionDeclaration(null, name.text(), null, orDynamic(returnType),
                parameters, body, MethodKind.METHOD, modifiers, location(name)));
    }

    private StatementIR ifStatement() {
        advance();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'.");
        ExpressionIR condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after if condition.");
        StatementIR thenBranch = statement();
        StatementIR elseBranch = matchKeyword("else") ? statement() : null;
        return new IfStmt(condition, thenBranch, elseBranch);
    }

    private StatementIR forStatement(boolean awaited) {
        advance();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'for'.");
        int start = forInStart();
        if (start >= 0) {
            current = start;
            boolean typed = !(tokenAt(start).type() == TokenType.IDENTIFIER && tokenAt(start + 1).isKeyword("in"));
            TypeRef type = typed ? parseType(false) : TypeRef.dynamicType();
            String variable = consume(TokenType.IDENTIFIER, "Expected loop variable.").text();
            advance();
            ExpressionIR iterable = expression();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after for-in clause.");
            return new ForEachStmt(variable, type, iterable, statement(), awaited);
        }
        ForClauses clauses = forClauses();
        return new ForStmt(clauses.initializers(), clauses.condition(), clauses.updaters(), statement());
    }

    /** The three parts of a classic for loop. */
    private record ForClauses(List<StatementIR> initializers, ExpressionIR condition, List<ExpressionIR> updaters) {
    }

    /**
     * Looks past {@code final}/{@code var}/{@code const} and an optional type after {@code for (}.
     *
     * @return The index where the loop variable declaration starts if a for-in clause follows, otherwise -1.
     */
    private int forInStart() {
        int p = current;
        while (tokenAt(p).isKeyword("final") || tokenAt(p).isKeyword("var") || tokenAt(p).isKeyword("const")) p++;
        int typedEnd = skipType(p);
        boolean typedForIn = typedEnd > 0 && tokenAt(typedEnd).type() == TokenType.IDENTIFIER
                && tokenAt(typedEnd + 1).isKeyword("in");
        boolean untypedForIn = tokenAt(p).type() == TokenType.IDENTIFIER && tokenAt(p + 1).isKeyword("in");
        return typedForIn || untypedForIn ? p : -1;
    }

    private ForClauses forClauses() {
        List<StatementIR> initializers = new ArrayList<>();
        if (!check(TokenType.SEMICOLON)) {
            if (isLocalVariableStart()) {
                initializers.addAll(localVariables());
            } else {
                do {
                    initializers.add(new ExpressionStmt(expression()));
                } while (match(TokenType.COMMA));
            }
        }
        consume(TokenType.SEMICOLON, "Expected ';' after for initializer.");
        ExpressionIR condition = check(TokenType.SEMICOLON) ? null : expression();
        consume(TokenType.SEMICOLON, "Expected ';' after for condition.");
        List<ExpressionIR> updaters = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                updaters.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after for clauses.");
        return new ForClauses(initializers, condition, updaters);
    }

    private StatementIR whileStatement() {
        advance();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'while'.");
        ExpressionIR condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after while condition.");
        return new WhileStmt(condition, statement());
    }

    private StatementIR doStatement() {
        advance();
        StatementIR body = statement();
        if (!matchKeyword("while")) {
            throw error(peek(), "Expected 'while' after do body.");
        }
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'while'.");
        ExpressionIR condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after condition.");
        consume(TokenType.SEMICOLON, "Expected ';' after do-while.");
        return new DoWhileStmt(body, condition);
    }

    private StatementIR switchStatement() {
        advance();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'switch'.");
        ExpressionIR subject = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after switch subject.");
        consume(TokenType.LEFT_BRACE, "Expected '{' before switch body.");
        List<SwitchCase> cases = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            List<ExpressionIR> labels = new ArrayList<>();
            boolean defaultCase = false;
            while (true) {
                if (matchKeyword("case")) {
                    labels.add(expression());
                    consume(TokenType.COLON, "Expected ':' after case label.");
                } else if (matchKeyword("default")) {
                    consume(TokenType.COLON, "Expected ':' after 'default'.");
                    defaultCase = true;
                } else {
                    break;
                }
            }
            if (labels.isEmpty() && !defaultCase) {
                throw error(peek(), "Expected 'case' or 'default'.");
            }
            List<StatementIR> statements = new ArrayList<>();
            while (!peek().isKeyword("case") && !peek().isKeyword("default")
                    && !check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                blockItem(statements);
            }
            cases.add(new SwitchCase(labels, defaultCase, statements));
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' after switch body.");
        return new SwitchStmt(subject, cases);
    }

    private StatementIR tryStatement() {
        advance();
        BlockStmt body = block();
        List<CatchClause> catches = new ArrayList<>();
        while (peek().isIdentifier("on") || peek().isKeyword("catch")) {
            TypeRef exceptionType = null;
            String exceptionVariable = null;
            String stackTraceVariable = null;
            if (matchIdentifier("on")) {
                exceptionType = parseType(false);
            }
            if (matchKeyword("catch")) {
                consume(TokenType.LEFT_PAREN, "Expected '(' after 'catch'.");
                exceptionVariable = consume(TokenType.IDENTIFIER, "Expected exception variable.").text();
                if (match(TokenType.COMMA)) {
                    stackTraceVariable = consume(TokenType.IDENTIFIER, "Expected stack trace variable.").text();
                }
                consume(TokenType.RIGHT_PAREN, "Expected ')' after catch parameters.");
            }
            catches.add(new CatchClause(exceptionType, exceptionVariable, stackTraceVariable, block()));
        }
        BlockStmt finallyBlock = matchKeyword("finally") ? block() : null;
        if (catches.isEmpty() && finallyBlock == null) {
            throw error(peek(), "Expected 'catch', 'on' or 'finally' after try block.");
        }
        return new TryStmt(body, catches, finallyBlock);
    }

    // ---------------------------------------------------------------- expressions

    /**
     * Parses a full expression including assignments, cascades and {@code throw}.
     * @return The parsed expression.
     */
    public ExpressionIR expression() {
        enterNesting();
        try {
            return nestedExpression();
        } finally {
            nesting--;
        }
    }

    private ExpressionIR nestedExpression() {
        if (matchKeyword("throw")) {
            return new ThrowExpr(expression());
        }
        ExpressionIR target = conditional();
        if (ASSIGNMENT_OPERATORS.contains(peek().type())) {
            String operator = advance().text();
            return new AssignmentExpr(operator, target, expression());
        }
        if (check(TokenType.DOT_DOT) || check(TokenType.QUESTION_DOT_DOT)) {
            return cascade(target);
        }
        return target;
    }

    private ExpressionIR cascade(ExpressionIR target) {
        boolean nullAware = check(TokenType.QUESTION_DOT_DOT);
        List<ExpressionIR> sections = new ArrayList<>();
        while (match(TokenType.DOT_DOT, TokenType.QUESTION_DOT_DOT)) {
            ExpressionIR section;
            if (match(TokenType.LEFT_BRACKET)) {
                ExpressionIR index = expression();
                consume(TokenType.RIGHT_BRACKET, "Expected ']' after index.");
                section = new IndexExpr(null, index, false);
            } else {
                Token name = consume(TokenType.IDENTIFIER, "Expected member name in cascade.");
                if (check(TokenType.LEFT_PAREN) || isGenericCall()) {
                    List<TypeRef> typeArguments = check(TokenType.LESS) ? typeArguments() : List.of();
                    section = new MethodCallExpr(null, name.text(), typeArguments, arguments(), false);
                } else {
                    section = new PropertyAccessExpr(null, name.text(), false);
                }
            }
            section = selectors(section);
            if (ASSIGNMENT_OPERATORS.contains(peek().type())) {
                String operator = advance().text();
                section = new AssignmentExpr(operator, section, conditional());
            }
            sections.add(section);
        }
        return new CascadeExpr(target, sections, nullAware);
    }

    private ExpressionIR conditional() {
        ExpressionIR condition = ifNull();
        if (match(TokenType.QUESTION)) {
            ExpressionIR thenExpression = expression();
            consume(TokenType.COLON, "Expected ':' in conditional expression.");
            ExpressionIR elseExpression = expression();
            return new ConditionalExpr(condition, thenExpression, elseExpression);
        }
        return condition;
    }

    private ExpressionIR ifNull() {
        ExpressionIR expr = logicalOr();
        while (match(TokenType.QUESTION_QUESTION)) {
            expr = new BinaryExpr("??", expr, logicalOr());
        }
        return expr;
    }

    private ExpressionIR logicalOr() {
        ExpressionIR expr = logicalAnd();
        while (match(TokenType.PIPE_PIPE)) {
            expr = new BinaryExpr("||", expr, logicalAnd());
        }
        return expr;
    }

    private ExpressionIR logicalAnd() {
        ExpressionIR expr = equality();
        while (match(TokenType.AMP_AMP)) {
            expr = new BinaryExpr("&&", expr, equality());
        }
        return expr;
    }

    private ExpressionIR equality() {
        ExpressionIR expr = relational();
        if (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            String operator = previous().text();
            expr = new BinaryExpr(operator, expr, relational());
        }
        return expr;
    }

    private ExpressionIR relational() {
        ExpressionIR expr = bitwiseOr();
        if (matchKeyword("is")) {
            boolean negated = match(TokenType.BANG);
            return new TypeTestExpr(expr, parseType(true), negated);
        }
        if (peek().isIdentifier("as")) {
            advance();
            return new CastExpr(expr, parseType(true));
        }
        if (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL)) {
            String operator = previous().text();
            expr = new BinaryExpr(operator, expr, bitwiseOr());
        }
        return expr;
    }

    private ExpressionIR bitwiseOr() {
        ExpressionIR expr = bitwiseXor();
        while (match(TokenType.PIPE)) {
            expr = new BinaryExpr("|", expr, bitwiseXor());
        }
        return expr;
    }

    private ExpressionIR bitwiseXor() {
        ExpressionIR expr = bitwiseAnd();
        while (match(TokenType.CARET)) {
            expr = new BinaryExpr("^", expr, bitwiseAnd());
        }
        return expr;
    }

    private ExpressionIR bitwiseAnd() {
        ExpressionIR expr = shift();
        while (match(TokenType.AMP)) {
            expr = new BinaryExpr("&", expr, shift());
        }
        return expr;
    }

    private ExpressionIR shift() {
        ExpressionIR expr = additive();
        while (true) {
            if (match(TokenType.LESS_LESS)) {
                expr = new BinaryExpr("<<", expr, additive());
            } else if (check(TokenType.GREATER) && checkNext(TokenType.GREATER) && adjacent(current)) {
                advance();
                advance();
                String operator = ">>";
                if (check(TokenType.GREATER) && adjacent(current - 1)) {
                    advance();
                    operator = ">>>";
                }
                expr = new BinaryExpr(operator, expr, additive());
            } else {
                return expr;
            }
        }
    }

    private ExpressionIR additive() {
        ExpressionIR expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            String operator = previous().text();
            expr = new BinaryExpr(operator, expr, multiplicative());
        }
        return expr;
    }

    private ExpressionIR multiplicative() {
        ExpressionIR expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.TILDE_SLASH, TokenType.PERCENT)) {
            String operator = previous().text();
            expr = new BinaryExpr(operator, expr, unary());
        }
        return expr;
    }

    private ExpressionIR unary() {
        if (match(TokenType.MINUS, TokenType.BANG, TokenType.TILDE, TokenType.PLUS_PLUS, TokenType.MINUS_MINUS)) {
            String operator = previous().text();
            enterNesting();
            try {
                return new UnaryExpr(operator, unary(), true);
            } finally {
                nesting--;
            }
        }
        if (peek().isIdentifier("await") && !isExpressionContinuation(tokenAt(current + 1))
                && tokenAt(current + 1).type() != TokenType.RIGHT_PAREN && tokenAt(current + 1).type() != TokenType.COMMA) {
            advance();
            return new AwaitExpr(unary());
        }
        return postfix();
    }

    private ExpressionIR postfix() {
        ExpressionIR expr = selectors(primary());
        if (match(TokenType.PLUS_PLUS, TokenType.MINUS_MINUS)) {
            expr = new UnaryExpr(previous().text(), expr, false);
        }
        return expr;
    }

    private ExpressionIR selectors(ExpressionIR expr) {
        while (true) {
            if (match(TokenType.DOT, TokenType.QUESTION_DOT)) {
                boolean nullAware = previous().type() == TokenType.QUESTION_DOT;
                Token name = consumeName("Expected property name after '.'.");
                expr = new PropertyAccessExpr(expr, name.text(), nullAware);
            } else if (check(TokenType.LEFT_PAREN) || isGenericCall()) {
                List<TypeRef> typeArguments = check(TokenType.LESS) ? typeArguments() : List.of();
                List<Argument> arguments = arguments();
                if (expr instanceof IdentifierExpr id && !id.name().equals("this") && !id.name().equals("super")) {
                    expr = new MethodCallExpr(null, id.name(), typeArguments, arguments, false);
                } else if (expr instanceof PropertyAccessExpr access) {
                    expr = new MethodCallExpr(access.target(), access.propertyName(), typeArguments, arguments,
                            access.nullAware());
                } else {
                    expr = new InvocationExpr(expr, arguments);
                }
            } else if (match(TokenType.LEFT_BRACKET)) {
                ExpressionIR index = expression();
                consume(TokenType.RIGHT_BRACKET, "Expected ']' after index.");
                expr = new IndexExpr(expr, index, false);
            } else if (isNullAwareIndex()) {
                advance();
                advance();
                ExpressionIR index = expression();
                consume(TokenType.RIGHT_BRACKET, "Expected ']' after index.");
                expr = new IndexExpr(expr, index, true);
            } else if (check(TokenType.BANG)) {
                advance();
                expr = new UnaryExpr("!", expr, false);
            } else {
                return expr;
            }
        }
    }

    /**
     * {@code a?[i]} is written without blanks around {@code ?}, which tells it apart from a
     * conditional with a list literal such as {@code c ? [x] : []}.
     */
    private boolean isNullAwareIndex() {
        Token question = peek();
        Token bracket = tokenAt(current + 1);
        return question.type() == TokenType.QUESTION && bracket.type() == TokenType.LEFT_BRACKET
                && adjacent(previous(), question) && adjacent(question, bracket);
    }

    private static boolean adjacent(Token left, Token right) {
        return left.line() == right.line() && left.column() + left.text().length() == right.column();
    }

    private ExpressionIR primary() {
        Token t = peek();
        switch (t.type()) {
            case NUMBER: {
                advance();
                String text = t.text();
                boolean hex = text.startsWith("0x") || text.startsWith("0X");
                boolean dbl = !hex && (text.contains(".") || text.contains("e") || text.contains("E"));
                return new LiteralExpr(dbl ? LiteralExpr.Kind.DOUBLE : LiteralExpr.Kind.INT, text);
            }
            case STRING:
                return stringLiteral();
            case LEFT_BRACKET:
                return listLiteral(null, false);
            case LEFT_BRACE:
                return setOrMapLiteral(List.of(), false);
            case LESS: {
                List<TypeRef> typeArguments = typeArguments();
                return check(TokenType.LEFT_BRACKET)
                        ? listLiteral(typeArguments.isEmpty() ? null : typeArguments.get(0), false)
                        : setOrMapLiteral(typeArguments, false);
            }
            case LEFT_PAREN: {
                if (isFunctionLiteralStart()) return functionLiteral();
                advance();
                ExpressionIR inner = expression();
                consume(TokenType.RIGHT_PAREN, "Expected ')' after expression.");
                return inner;
            }
            case IDENTIFIER:
                advance();
                return new IdentifierExpr(t.text());
            case KEYWORD:
                return keywordPrimary(t);
            default:
                throw error(t, "Expected expression, but got '" + t.text() + "'.");
        }
    }

    private ExpressionIR keywordPrimary(Token t) {
        switch (t.text()) {
            case "true":
            case "false":
                advance();
                return new LiteralExpr(LiteralExpr.Kind.BOOL, t.text());
            case "null":
                advance();
                return LiteralExpr.nullLiteral();
            case "this":
            case "super":
                advance();
                return new IdentifierExpr(t.text());
            case "const":
            case "new": {
                advance();
                boolean constant = t.text().equals("const");
                if (check(TokenType.LEFT_BRACKET)) return listLiteral(null, constant);
                if (check(TokenType.LEFT_BRACE)) return setOrMapLiteral(List.of(), constant);
                if (check(TokenType.LESS)) {
                    List<TypeRef> typeArguments = typeArguments();
                    return check(TokenType.LEFT_BRACKET)
                            ? listLiteral(typeArguments.isEmpty() ? null : typeArguments.get(0), constant)
                            : setOrMapLiteral(typeArguments, constant);
                }
                return instanceCreation(constant);
            }
            default:
                throw error(t, "Unexpected keyword '" + t.text() + "' in expression.");
        }
    }

    private ExpressionIR instanceCreation(boolean constant) {
        Token first = consume(TokenType.IDENTIFIER, "Expected type name after '" + previous().text() + "'.");
        String typeName = first.text();
        String constructorName = null;
        if (check(TokenType.DOT) && checkNext(TokenType.IDENTIFIER)) {
            advance();
            String second = advance().text();
            if (check(TokenType.DOT) && checkNext(TokenType.IDENTIFIER)) {
                advance();
                typeName = typeName + "." + second;
                constructorName = advance().text();
            } else if (Character.isLowerCase(first.text().charAt(0))) {
                typeName = typeName + "." + second;
            } else {
                constructorName = second;
            }
        }
        List<TypeRef> typeArguments = check(TokenType.LESS) ? typeArguments() : List.of();
        if (constructorName == null && check(TokenType.DOT) && checkNext(TokenType.IDENTIFIER)) {
            advance();
            constructorName = advance().text();
        }
        List<Argument> arguments = arguments();
        return new InstanceCreationExpr(new TypeRef(typeName, typeArguments, false), constructorName, arguments, constant);
    }

    private ExpressionIR functionLiteral() {
        List<ParameterDeclaration> parameters = formalParameters();
        Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
        int i = current;
        if (peek().isIdentifier("async") || peek().isIdentifier("sync")) i++;
        if (tokenAt(i).type() == TokenType.STAR) i++;
        boolean arrow = tokenAt(i).type() == TokenType.ARROW;
        StatementIR body = functionBody(modifiers, false);
        return new FunctionExpr(parameters, body, arrow, modifiers.contains(Modifier.ASYNC));
    }

    private List<Argument> arguments() {
        consume(TokenType.LEFT_PAREN, "Expected '(' before arguments.");
        List<Argument> arguments = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN) && !isAtEnd()) {
            String name = null;
            if ((check(TokenType.IDENTIFIER) || check(TokenType.KEYWORD)) && checkNext(TokenType.COLON)) {
                name = advance().text();
                advance();
            }
            arguments.add(new Argument(name, expression()));
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments.");
        return arguments;
    }

    private ExpressionIR listLiteral(TypeRef elementType, boolean constant) {
        consume(TokenType.LEFT_BRACKET, "Expected '['.");
        List<ExpressionIR> elements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACKET) && !isAtEnd()) {
            elements.add(collectionElement());
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.RIGHT_BRACKET, "Expected ']' after list elements.");
        return new ListLiteralExpr(elementType, elements, constant);
    }

    private ExpressionIR setOrMapLiteral(List<TypeRef> typeArguments, boolean constant) {
        consume(TokenType.LEFT_BRACE, "Expected '{'.");
        List<ExpressionIR> elements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            elements.add(collectionElement());
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' after collection elements.");
        boolean map = typeArguments.size() == 2
                || (typeArguments.isEmpty() && (elements.isEmpty() || elements.stream().anyMatch(this::containsMapEntry)));
        if (map) {
            TypeRef keyType = typeArguments.size() == 2 ? typeArguments.get(0) : null;
            TypeRef valueType = typeArguments.size() == 2 ? typeArguments.get(1) : null;
            return new MapLiteralExpr(keyType, valueType, elements, constant);
        }
        return new SetLiteralExpr(typeArguments.isEmpty() ? null : typeArguments.get(0), elements, constant);
    }

    private boolean containsMapEntry(ExpressionIR element) {
        if (element instanceof MapEntryExpr) return true;
        if (element instanceof CollectionIfExpr ci) {
            return containsMapEntry(ci.thenElement()) || (ci.elseElement() != null && containsMapEntry(ci.elseElement()));
        }
        if (element instanceof CollectionForExpr cf) return containsMapEntry(cf.body());
        if (element instanceof CollectionForLoopExpr loop) return containsMapEntry(loop.body());
        return false;
    }

    private ExpressionIR collectionElement() {
        if (match(TokenType.ELLIPSIS, TokenType.ELLIPSIS_QUESTION)) {
            boolean nullAware = previous().type() == TokenType.ELLIPSIS_QUESTION;
            return new SpreadExpr(expression(), nullAware);
        }
        if (matchKeyword("if")) {
            consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'.");
            ExpressionIR condition = expression();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after condition.");
            ExpressionIR thenElement = collectionElement();
            ExpressionIR elseElement = matchKeyword("else") ? collectionElement() : null;
            return new CollectionIfExpr(condition, thenElement, elseElement);
        }
        if (matchKeyword("for")) {
            consume(TokenType.LEFT_PAREN, "Expected '(' after 'for'.");
            int start = forInStart();
            if (start < 0) {
                ForClauses clauses = forClauses();
                return new CollectionForLoopExpr(clauses.initializers(), clauses.condition(), clauses.updaters(),
                        collectionElement());
            }
            current = start;
            if (!(check(TokenType.IDENTIFIER) && tokenAt(current + 1).isKeyword("in"))) {
                parseType(false);
            }
            String variable = consume(TokenType.IDENTIFIER, "Expected loop variable.").text();
            advance();
            ExpressionIR iterable = expression();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after for-in clause.");
            return new CollectionForExpr(variable, iterable, collectionElement());
        }
        ExpressionIR element = expression();
        if (match(TokenType.COLON)) {
            return new MapEntryExpr(element, expression());
        }
        return element;
    }

    private ExpressionIR stringLiteral() {
        List<StringSegment> segments = new ArrayList<>();
        while (check(TokenType.STRING)) {
            @SuppressWarnings("unchecked")
            List<StringSegment> value = (List<StringSegment>) advance().value();
            segments.addAll(value);
        }
        if (segments.stream().noneMatch(StringSegment::isInterpolation)) {
            StringBuilder text = new StringBuilder();
            segments.forEach(s -> text.append(s.text()));
            return LiteralExpr.string(text.toString());
        }
        List<ExpressionIR> parts = new ArrayList<>();
        for (StringSegment segment : segments) {
            if (segment.isInterpolation()) {
                ExpressionIR part = new Parser(segment.tokens(), diagnostics).parseStandaloneExpression();
                if (part == null) {
                    throw new ParseError("Invalid string interpolation.");
                }
                parts.add(part);
            } else if (!segment.text().isEmpty()) {
                parts.add(LiteralExpr.string(segment.text()));
            }
        }
        return new StringTemplateExpr(parts);
    }

    private String stringText(Token token) {
        @SuppressWarnings("unchecked")
        List<StringSegment> segments = (List<StringSegment>) token.value();
        StringBuilder text = new StringBuilder();
        for (StringSegment segment : segments) {
            if (segment.isInterpolation()) {
                throw error(token, "String interpolation is not allowed in a URI.");
            }
            text.append(segment.text());
        }
        return text.toString();
    }

    // ---------------------------------------------------------------- helpers

    private Set<String> annotations() {
        Set<String> names = new HashSet<>();
        while (match(TokenType.AT)) {
            String name = consume(TokenType.IDENTIFIER, "Expected annotation name.").text();
            while (match(TokenType.DOT)) {
                name = consume(TokenType.IDENTIFIER, "Expected name after '.'.").text();
            }
            if (check(TokenType.LESS) && isGenericCall()) typeArguments();
            if (check(TokenType.LEFT_PAREN)) arguments();
            names.add(name);
        }
        return names;
    }

    private TypeRef orDynamic(TypeRef type) {
        return type == null ? TypeRef.dynamicType() : type;
    }

    private SourceLocation location(Token token) {
        return new SourceLocation(token.line(), token.column());
    }

    private boolean adjacent(int index) {
        Token a = tokenAt(index);
        Token b = tokenAt(index + 1);
        return a.line() == b.line() && a.column() + a.text().length() == b.column();
    }

    private Token consumeName(String errorMessage) {
        if (check(TokenType.IDENTIFIER)) return advance();
        throw error(peek(), errorMessage);
    }

    private boolean matchKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchIdentifier(String name) {
        if (peek().isIdentifier(name)) {
            advance();
            return true;
        }
        return false;
    }

    /** Skips to the end of the current top-level declaration. */
    private void synchronize() {
        int depth = 0;
        while (!isAtEnd()) {
            Token t = advance();
            if (t.type() == TokenType.LEFT_BRACE) {
                depth++;
            } else if (t.type() == TokenType.RIGHT_BRACE) {
                depth--;
                if (depth <= 0) return;
            } else if (t.type() == TokenType.SEMICOLON && depth == 0) {
                return;
            }
        }
    }

    /** Skips to the end of the current member, stopping before the closing brace of the class. */
    private void synchronizeMember() {
        int depth = 0;
        while (!isAtEnd()) {
            if (check(TokenType.RIGHT_BRACE) && depth == 0) return;
            Token t = advance();
            if (t.type() == TokenType.LEFT_BRACE) {
                depth++;
            } else if (t.type() == TokenType.RIGHT_BRACE) {
                depth--;
                if (depth == 0) return;
            } else if (t.type() == TokenType.SEMICOLON && depth == 0) {
                return;
            }
        }
    }

    private void enterNesting() {
        if (nesting >= MAX_NESTING) {
            throw error(peek(), "Nesting deeper than " + MAX_NESTING + " levels.");
        }
        nesting++;
    }

    private ParseError error(Token token, String message) {
        diagnostics.reportError(message, token.fileName(), token.line(), token.column());
        return new ParseError(message);
    }

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
        if (type != TokenType.END_OF_FILE && isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    private Token tokenAt(int index) {
        return tokens.get(Math.min(index, tokens.size() - 1));
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }
}
