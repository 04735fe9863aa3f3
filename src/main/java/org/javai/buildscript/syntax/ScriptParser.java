package org.javai.buildscript.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.javai.buildscript.syntax.ScriptToken.TokenType;

/**
 * Recursive-descent parser for build scripts.
 * <p>
 * The parser is independent of the tree it produces: nodes are handed to a
 * {@link SyntaxTreeFactory}, which is how the same grammar yields both the full {@link AstNode}
 * tree and the compact {@link LightTree}.
 * <p>
 * Parsing never fails. Unexpected input becomes {@link SyntaxKind#ERROR_ELEMENT} nodes: tokens
 * that cannot start a statement are swallowed up to the end of that statement, and missing
 * pieces (a closing parenthesis, an expression after {@code =}) become zero-width errors at the
 * position where they were expected.
 * <p>
 * Example usage:
 *
 * <pre>
 * AstNode file = ScriptParser.parseToAst(text);
 * LightTree tree = ScriptParser.parseToLightTree(document, scriptStart);
 * </pre>
 *
 * @param <N> the node handle of the produced tree
 */
public class ScriptParser<N> {

	static final String EXPECTING_ELEMENT = "Expecting an element";
	static final String EXPECTING_EXPRESSION = "Expecting an expression";
	static final String UNEXPECTED_TOKENS = "Unexpected tokens (use ';' to separate expressions on the same line)";

	private static final List<Set<TokenType>> BINARY_PRECEDENCE = List.of(
			EnumSet.of(TokenType.OROR),
			EnumSet.of(TokenType.ANDAND),
			EnumSet.of(TokenType.EQEQ, TokenType.EXCLEQ),
			EnumSet.of(TokenType.LT, TokenType.GT, TokenType.LTEQ, TokenType.GTEQ),
			EnumSet.of(TokenType.PLUS, TokenType.MINUS),
			EnumSet.of(TokenType.MUL, TokenType.DIV, TokenType.PERC)
	);

	private static final Set<TokenType> EXPRESSION_START = EnumSet.of(
			TokenType.IDENTIFIER, TokenType.INTEGER_LITERAL, TokenType.FLOAT_LITERAL, TokenType.STRING_LITERAL,
			TokenType.TRUE, TokenType.FALSE, TokenType.NULL, TokenType.THIS, TokenType.LPAR, TokenType.LBRACE,
			TokenType.IF, TokenType.MINUS, TokenType.PLUS, TokenType.EXCL);

	private final List<ScriptToken> tokens;
	private final SyntaxTreeFactory<N> factory;
	private final int regionStart;
	private final int regionEnd;
	private final Deque<Boolean> newlineModes = new ArrayDeque<>();
	private int pos;
	private int lastEnd;

	/**
	 * @param tokens the tokens of the region, ending with EOF
	 * @param factory receives the recognized nodes
	 * @param regionStart offset where the parsed region starts
	 * @param regionEnd offset where the parsed region ends
	 */
	public ScriptParser(List<ScriptToken> tokens, SyntaxTreeFactory<N> factory, int regionStart, int regionEnd) {
		if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
			throw new IllegalArgumentException("Token list must end with an EOF token");
		}
		if (factory == null) {
			throw new IllegalArgumentException("Syntax tree factory cannot be null");
		}
		this.tokens = tokens;
		this.factory = factory;
		this.regionStart = regionStart;
		this.regionEnd = regionEnd;
		this.lastEnd = regionStart;
		this.newlineModes.push(Boolean.TRUE);
	}

	/**
	 * Parses a whole script into the full concrete syntax tree.
	 */
	public static AstNode parseToAst(String text) {
		String source = text != null ? text : "";
		List<ScriptToken> tokens = new ScriptTokenizer(source).tokenize();
		return new ScriptParser<>(tokens, new AstNodeFactory(source), 0, source.length()).parseFile();
	}

	/**
	 * Parses the script that starts at {@code sourceOffset} in {@code document} and runs to its end
	 * into a light tree. Node offsets stay absolute in {@code document}.
	 */
	public static LightTree parseToLightTree(String document, int sourceOffset) {
		String source = document != null ? document : "";
		List<ScriptToken> tokens = new ScriptTokenizer(source, sourceOffset).tokenize();
		LightTreeFactory factory = new LightTreeFactory();
		int root = new ScriptParser<>(tokens, factory, sourceOffset, source.length()).parseFile();
		return factory.build(root);
	}

	/**
	 * Parses the token list as a script file.
	 */
	public N parseFile() {
		List<N> children = new ArrayList<>();
		skipSeparators();

		if (check(TokenType.PACKAGE)) {
			children.add(parsePackageDirective());
			finishStatement(children, false);
			skipSeparators();
		}

		List<N> imports = new ArrayList<>();
		int importsStart = peek().start();
		while (check(TokenType.IMPORT)) {
			imports.add(parseImportDirective());
			finishStatement(imports, false);
			skipSeparators();
		}
		int importsEnd = imports.isEmpty() ? importsStart : lastEnd;
		children.add(factory.node(SyntaxKind.IMPORT_LIST, importsStart, importsEnd, imports));

		int bodyStart = peek().start();
		List<N> statements = parseStatements(false);
		children.add(factory.node(SyntaxKind.BLOCK, bodyStart, regionEnd, statements));

		return factory.node(SyntaxKind.FILE, regionStart, regionEnd, children);
	}

	// header

	private N parsePackageDirective() {
		int start = advance().start(); // consume 'package'
		List<N> children = new ArrayList<>();
		parseQualifiedName(children, false);
		return factory.node(SyntaxKind.PACKAGE_DIRECTIVE, start, lastEnd, children);
	}

	private N parseImportDirective() {
		int start = advance().start(); // consume 'import'
		List<N> children = new ArrayList<>();
		boolean complete = parseQualifiedName(children, true);

		if (complete && check(TokenType.AS)) {
			int aliasStart = advance().start();
			if (check(TokenType.IDENTIFIER)) {
				ScriptToken alias = advance();
				List<N> aliasChildren = List.of(factory.leaf(SyntaxKind.IDENTIFIER, alias.start(), alias.end()));
				children.add(factory.node(SyntaxKind.IMPORT_ALIAS, aliasStart, lastEnd, aliasChildren));
			} else {
				children.add(factory.error("Expecting an alias name", lastEnd, lastEnd));
			}
		}
		return factory.node(SyntaxKind.IMPORT_DIRECTIVE, start, lastEnd, children);
	}

	/**
	 * Adds the name parts as {@link SyntaxKind#IDENTIFIER} leaves.
	 *
	 * @return {@code false} if the name was cut short by an error
	 */
	private boolean parseQualifiedName(List<N> children, boolean allowStar) {
		if (!check(TokenType.IDENTIFIER)) {
			children.add(factory.error("Expecting a qualified name", lastEnd, lastEnd));
			return false;
		}
		ScriptToken part = advance();
		children.add(factory.leaf(SyntaxKind.IDENTIFIER, part.start(), part.end()));
		while (check(TokenType.DOT)) {
			advance();
			if (check(TokenType.IDENTIFIER)) {
				part = advance();
				children.add(factory.leaf(SyntaxKind.IDENTIFIER, part.start(), part.end()));
			} else if (allowStar && check(TokenType.MUL)) {
				ScriptToken star = advance();
				children.add(factory.leaf(SyntaxKind.IMPORT_STAR, star.start(), star.end()));
				return true;
			} else {
				children.add(factory.error(allowStar ? "Expecting an identifier or '*'" : "Expecting an identifier",
						lastEnd, lastEnd));
				return false;
			}
		}
		return true;
	}

	// statements

	private List<N> parseStatements(boolean nested) {
		List<N> statements = new ArrayList<>();
		while (true) {
			skipSeparators();
			if (check(TokenType.EOF) || (nested && check(TokenType.RBRACE))) {
				return statements;
			}
			statements.add(parseStatement(nested));
			finishStatement(statements, nested);
		}
	}

	private N parseStatement(boolean nested) {
		ScriptToken token = peek();
		if (token.type() == TokenType.VAL || token.type() == TokenType.VAR) {
			return parseProperty();
		}
		if (!canStartExpression(token)) {
			return parseUnexpected(EXPECTING_ELEMENT, nested);
		}

		int start = token.start();
		N expression = parseExpression();
		if (peek().isAssignmentOperator()) {
			ScriptToken operator = advance();
			N operation = factory.leaf(SyntaxKind.OPERATION_REFERENCE, operator.start(), operator.end());
			skipNewlines();
			N value = parseExpressionOrError();
			return factory.node(SyntaxKind.BINARY_EXPRESSION, start, lastEnd, List.of(expression, operation, value));
		}
		return expression;
	}

	private N parseProperty() {
		ScriptToken keyword = advance();
		int start = keyword.start();
		List<N> children = new ArrayList<>();
		SyntaxKind keywordKind = keyword.type() == TokenType.VAL ? SyntaxKind.VAL_KEYWORD : SyntaxKind.VAR_KEYWORD;
		children.add(factory.leaf(keywordKind, keyword.start(), keyword.end()));

		if (!check(TokenType.IDENTIFIER)) {
			children.add(factory.error("Expecting a property name", lastEnd, lastEnd));
			return factory.node(SyntaxKind.PROPERTY, start, lastEnd, children);
		}
		ScriptToken name = advance();
		children.add(factory.leaf(SyntaxKind.IDENTIFIER, name.start(), name.end()));

		if (check(TokenType.COLON)) {
			advance();
			children.add(parseTypeReference());
		}
		if (check(TokenType.EQ)) {
			advance();
			skipNewlines();
			children.add(parseExpressionOrError());
		}
		return factory.node(SyntaxKind.PROPERTY, start, lastEnd, children);
	}

	private N parseTypeReference() {
		if (!check(TokenType.IDENTIFIER)) {
			return factory.error("Expecting a type", lastEnd, lastEnd);
		}
		int start = advance().start();
		while (check(TokenType.DOT) && tokenAfterCurrent().type() == TokenType.IDENTIFIER) {
			advance();
			advance();
		}
		if (check(TokenType.QUEST)) {
			advance();
		}
		return factory.leaf(SyntaxKind.TYPE_REFERENCE, start, lastEnd);
	}

	/**
	 * Requires the statement to be followed by a separator. Anything else on the same line is
	 * wrapped in an error node that becomes a sibling of the statement.
	 */
	private void finishStatement(List<N> siblings, boolean nested) {
		TokenType next = peek().type();
		if (next == TokenType.NEWLINE || next == TokenType.SEMICOLON || next == TokenType.EOF
				|| (nested && next == TokenType.RBRACE)) {
			return;
		}
		siblings.add(parseUnexpected(UNEXPECTED_TOKENS, nested));
	}

	/**
	 * Swallows tokens up to the end of the current statement: a separator or, inside braces, the
	 * closing brace, outside of any nested brackets. Consumes at least one token.
	 */
	private N parseUnexpected(String message, boolean nested) {
		int start = peek().start();
		int depth = 0;
		do {
			TokenType type = tokens.get(pos).type();
			if (type == TokenType.LPAR || type == TokenType.LBRACKET || type == TokenType.LBRACE) {
				depth++;
			} else if ((type == TokenType.RPAR || type == TokenType.RBRACKET || type == TokenType.RBRACE) && depth > 0) {
				depth--;
			}
			consumeRaw();
		} while (!atStatementBoundary(depth, nested));
		return factory.error(message, start, lastEnd);
	}

	private boolean atStatementBoundary(int depth, boolean nested) {
		TokenType type = tokens.get(pos).type();
		if (type == TokenType.EOF) {
			return true;
		}
		if (depth > 0) {
			return false;
		}
		return type == TokenType.NEWLINE || type == TokenType.SEMICOLON || (nested && type == TokenType.RBRACE);
	}

	// expressions

	private N parseExpressionOrError() {
		if (canStartExpression(peek())) {
			return parseExpression();
		}
		return factory.error(EXPECTING_EXPRESSION, lastEnd, lastEnd);
	}

	private N parseExpression() {
		return parseBinary(0);
	}

	private N parseBinary(int level) {
		if (level == BINARY_PRECEDENCE.size()) {
			return parsePrefix();
		}
		int start = peek().start();
		N left = parseBinary(level + 1);
		while (BINARY_PRECEDENCE.get(level).contains(peek().type())) {
			ScriptToken operator = advance();
			N operation = factory.leaf(SyntaxKind.OPERATION_REFERENCE, operator.start(), operator.end());
			skipNewlines();
			N right = canStartExpression(peek()) ? parseBinary(level + 1) : factory.error(EXPECTING_EXPRESSION, lastEnd, lastEnd);
			left = factory.node(SyntaxKind.BINARY_EXPRESSION, start, lastEnd, List.of(left, operation, right));
		}
		return left;
	}

	private N parsePrefix() {
		TokenType type = peek().type();
		if (type == TokenType.MINUS || type == TokenType.PLUS || type == TokenType.EXCL) {
			ScriptToken operator = advance();
			N operation = factory.leaf(SyntaxKind.OPERATION_REFERENCE, operator.start(), operator.end());
			N operand = canStartExpression(peek()) ? parsePrefix() : factory.error(EXPECTING_EXPRESSION, lastEnd, lastEnd);
			return factory.node(SyntaxKind.PREFIX_EXPRESSION, operator.start(), lastEnd, List.of(operation, operand));
		}
		return parsePostfix();
	}

	private N parsePostfix() {
		int start = peek().start();
		N expression = parsePrimary();
		while (true) {
			continueOnNextLineIfQualified();
			TokenType type = peek().type();
			if (type == TokenType.DOT || type == TokenType.SAFE_ACCESS) {
				advance();
				N selector = check(TokenType.IDENTIFIER)
						? parseNameOrCall()
						: factory.error("Expecting a name", lastEnd, lastEnd);
				SyntaxKind kind = type == TokenType.DOT
						? SyntaxKind.DOT_QUALIFIED_EXPRESSION
						: SyntaxKind.SAFE_ACCESS_EXPRESSION;
				expression = factory.node(kind, start, lastEnd, List.of(expression, selector));
			} else if (type == TokenType.LBRACKET) {
				N indices = parseIndices();
				expression = factory.node(SyntaxKind.ARRAY_ACCESS_EXPRESSION, start, lastEnd, List.of(expression, indices));
			} else {
				return expression;
			}
		}
	}

	/**
	 * A line starting with {@code .} or {@code ?.} continues the expression of the previous line.
	 */
	private void continueOnNextLineIfQualified() {
		if (tokens.get(pos).type() != TokenType.NEWLINE) {
			return;
		}
		int ahead = pos;
		while (tokens.get(ahead).type() == TokenType.NEWLINE) {
			ahead++;
		}
		TokenType type = tokens.get(ahead).type();
		if (type == TokenType.DOT || type == TokenType.SAFE_ACCESS) {
			pos = ahead;
		}
	}

	private N parseIndices() {
		int start = advance().start(); // consume '['
		newlineModes.push(Boolean.FALSE);
		List<N> children = new ArrayList<>();
		while (!check(TokenType.RBRACKET) && canStartExpression(peek())) {
			children.add(parseExpression());
			if (!check(TokenType.COMMA)) {
				break;
			}
			advance();
		}
		if (check(TokenType.RBRACKET)) {
			advance();
		} else {
			children.add(factory.error("Expecting ']'", lastEnd, lastEnd));
		}
		newlineModes.pop();
		return factory.node(SyntaxKind.INDICES, start, lastEnd, children);
	}

	private N parsePrimary() {
		ScriptToken token = peek();
		return switch (token.type()) {
			case IDENTIFIER -> parseNameOrCall();
			case INTEGER_LITERAL -> constant(SyntaxKind.INTEGER_CONSTANT);
			case FLOAT_LITERAL -> constant(SyntaxKind.FLOAT_CONSTANT);
			case TRUE, FALSE -> constant(SyntaxKind.BOOLEAN_CONSTANT);
			case NULL -> constant(SyntaxKind.NULL);
			case STRING_LITERAL -> parseString();
			case THIS -> parseThis();
			case LPAR -> parseParenthesized();
			case LBRACE -> parseLambda();
			case IF -> parseIf();
			default -> factory.error(EXPECTING_EXPRESSION, lastEnd, lastEnd);
		};
	}

	private N constant(SyntaxKind kind) {
		ScriptToken token = advance();
		return factory.leaf(kind, token.start(), token.end());
	}

	private N parseString() {
		ScriptToken token = advance();
		if (ScriptTokenizer.isTerminatedString(token.text())) {
			return factory.leaf(SyntaxKind.STRING_TEMPLATE, token.start(), token.end());
		}
		N missingQuote = factory.error("Expecting '\"'", token.end(), token.end());
		return factory.node(SyntaxKind.STRING_TEMPLATE, token.start(), token.end(), List.of(missingQuote));
	}

	private N parseThis() {
		ScriptToken keyword = advance();
		ScriptToken at = tokens.get(pos);
		if (at.type() != TokenType.AT || at.start() != keyword.end()) {
			return factory.leaf(SyntaxKind.THIS_EXPRESSION, keyword.start(), keyword.end());
		}
		advance();
		ScriptToken label = tokens.get(pos);
		N labelNode;
		if (label.type() == TokenType.IDENTIFIER && label.start() == at.end()) {
			advance();
			labelNode = factory.leaf(SyntaxKind.LABEL, at.start(), label.end());
		} else {
			labelNode = factory.error("Expecting a label", lastEnd, lastEnd);
		}
		return factory.node(SyntaxKind.THIS_EXPRESSION, keyword.start(), lastEnd, List.of(labelNode));
	}

	private N parseParenthesized() {
		int start = advance().start(); // consume '('
		newlineModes.push(Boolean.FALSE);
		List<N> children = new ArrayList<>();
		children.add(parseExpressionOrError());
		if (check(TokenType.RPAR)) {
			advance();
		} else {
			children.add(factory.error("Expecting ')'", lastEnd, lastEnd));
		}
		newlineModes.pop();
		return factory.node(SyntaxKind.PARENTHESIZED, start, lastEnd, children);
	}

	private N parseNameOrCall() {
		ScriptToken name = advance();
		N reference = factory.leaf(SyntaxKind.REFERENCE_EXPRESSION, name.start(), name.end());

		List<N> children = new ArrayList<>();
		children.add(reference);
		if (check(TokenType.LPAR)) {
			children.add(parseValueArguments());
		}
		if (check(TokenType.LBRACE)) {
			int lambdaStart = peek().start();
			N lambda = parseLambda();
			children.add(factory.node(SyntaxKind.LAMBDA_ARGUMENT, lambdaStart, lastEnd, List.of(lambda)));
		}
		if (children.size() == 1) {
			return reference;
		}
		return factory.node(SyntaxKind.CALL_EXPRESSION, name.start(), lastEnd, children);
	}

	private N parseValueArguments() {
		int start = advance().start(); // consume '('
		newlineModes.push(Boolean.FALSE);
		List<N> children = new ArrayList<>();
		while (!check(TokenType.RPAR) && !check(TokenType.EOF)) {
			if (canStartExpression(peek())) {
				children.add(parseValueArgument());
			} else {
				children.add(parseArgumentGarbage("Expecting an argument"));
			}
			if (check(TokenType.COMMA)) {
				advance();
			} else if (!check(TokenType.RPAR)) {
				if (!canSkipArgumentGarbage()) {
					break;
				}
				children.add(parseArgumentGarbage("Expecting ',' or ')'"));
				if (!check(TokenType.COMMA)) {
					break;
				}
				advance();
			}
		}
		if (check(TokenType.RPAR)) {
			advance();
		} else {
			children.add(factory.error("Expecting ')'", lastEnd, lastEnd));
		}
		newlineModes.pop();
		return factory.node(SyntaxKind.VALUE_ARGUMENT_LIST, start, lastEnd, children);
	}

	private N parseValueArgument() {
		ScriptToken first = peek();
		if (first.type() == TokenType.IDENTIFIER && tokenAfterCurrent().type() == TokenType.EQ) {
			advance();
			advance(); // consume '='
			N name = factory.leaf(SyntaxKind.VALUE_ARGUMENT_NAME, first.start(), first.end());
			N value = parseExpressionOrError();
			return factory.node(SyntaxKind.VALUE_ARGUMENT, first.start(), lastEnd, List.of(name, value));
		}
		N value = parseExpression();
		return factory.node(SyntaxKind.VALUE_ARGUMENT, first.start(), lastEnd, List.of(value));
	}

	private boolean canSkipArgumentGarbage() {
		TokenType type = peek().type();
		return type != TokenType.EOF && type != TokenType.RBRACE;
	}

	/**
	 * Swallows tokens up to the next {@code ,} or {@code )} of the current argument list. A
	 * closing brace ends the garbage as it most likely belongs to an enclosing block.
	 */
	private N parseArgumentGarbage(String message) {
		int start = peek().start();
		int depth = 0;
		int consumed = 0;
		while (true) {
			TokenType type = peek().type();
			if (type == TokenType.EOF) {
				break;
			}
			if (depth == 0 && (type == TokenType.COMMA || type == TokenType.RPAR || type == TokenType.RBRACE)) {
				break;
			}
			if (type == TokenType.LPAR || type == TokenType.LBRACKET || type == TokenType.LBRACE) {
				depth++;
			} else if (type == TokenType.RPAR || type == TokenType.RBRACKET || type == TokenType.RBRACE) {
				depth--;
			}
			advance();
			consumed++;
		}
		if (consumed == 0) {
			return factory.error(message, lastEnd, lastEnd);
		}
		return factory.error(message, start, lastEnd);
	}

	private N parseLambda() {
		ScriptToken open = advance(); // consume '{'
		newlineModes.push(Boolean.TRUE);
		List<N> children = new ArrayList<>();

		if (hasLambdaParameters()) {
			skipNewlines();
			int parametersStart = peek().start();
			while (!check(TokenType.ARROW)) {
				advance();
			}
			children.add(factory.leaf(SyntaxKind.LAMBDA_PARAMETERS, parametersStart, lastEnd));
			advance(); // consume '->'
		}

		int bodyStart = lastEnd;
		List<N> statements = parseStatements(true);
		if (check(TokenType.RBRACE)) {
			ScriptToken close = peek();
			children.add(factory.node(SyntaxKind.BLOCK, bodyStart, close.start(), statements));
			advance();
		} else {
			children.add(factory.node(SyntaxKind.BLOCK, bodyStart, lastEnd, statements));
			children.add(factory.error("Expecting '}'", lastEnd, lastEnd));
		}
		newlineModes.pop();
		return factory.node(SyntaxKind.LAMBDA_EXPRESSION, open.start(), lastEnd, children);
	}

	/**
	 * Looks for {@code name (, name)* ->} right after an opening brace.
	 */
	private boolean hasLambdaParameters() {
		int ahead = skipNewlinesFrom(pos);
		if (tokens.get(ahead).type() != TokenType.IDENTIFIER) {
			return false;
		}
		ahead++;
		while (tokens.get(ahead).type() == TokenType.COMMA && tokens.get(ahead + 1).type() == TokenType.IDENTIFIER) {
			ahead += 2;
		}
		return tokens.get(ahead).type() == TokenType.ARROW;
	}

	private N parseIf() {
		int start = advance().start(); // consume 'if'
		List<N> children = new ArrayList<>();
		if (check(TokenType.LPAR)) {
			advance();
			newlineModes.push(Boolean.FALSE);
			children.add(parseExpressionOrError());
			if (check(TokenType.RPAR)) {
				advance();
			} else {
				children.add(factory.error("Expecting ')'", lastEnd, lastEnd));
			}
			newlineModes.pop();
		} else {
			children.add(factory.error("Expecting '('", lastEnd, lastEnd));
		}
		skipNewlines();
		children.add(parseControlBody());

		int ahead = skipNewlinesFrom(pos);
		if (tokens.get(ahead).type() == TokenType.ELSE) {
			pos = ahead;
			advance();
			skipNewlines();
			children.add(parseControlBody());
		}
		return factory.node(SyntaxKind.IF_EXPRESSION, start, lastEnd, children);
	}

	private N parseControlBody() {
		if (check(TokenType.LBRACE)) {
			int start = advance().start();
			newlineModes.push(Boolean.TRUE);
			List<N> statements = parseStatements(true);
			if (check(TokenType.RBRACE)) {
				advance();
			} else {
				statements.add(factory.error("Expecting '}'", lastEnd, lastEnd));
			}
			newlineModes.pop();
			return factory.node(SyntaxKind.BLOCK, start, lastEnd, statements);
		}
		if (canStartExpression(peek())) {
			return parseStatement(true);
		}
		return factory.error(EXPECTING_EXPRESSION, lastEnd, lastEnd);
	}

	// token access

	private boolean canStartExpression(ScriptToken token) {
		return EXPRESSION_START.contains(token.type());
	}

	private boolean newlinesSignificant() {
		return newlineModes.peek();
	}

	private ScriptToken peek() {
		if (!newlinesSignificant()) {
			skipNewlines();
		}
		return tokens.get(pos);
	}

	private boolean check(TokenType type) {
		return peek().type() == type;
	}

	private ScriptToken advance() {
		ScriptToken token = peek();
		if (token.type() != TokenType.EOF) {
			pos++;
			lastEnd = token.end();
		}
		return token;
	}

	/**
	 * Consumes the current token, whether or not it is a line break.
	 */
	private void consumeRaw() {
		ScriptToken token = tokens.get(pos);
		if (token.type() != TokenType.EOF) {
			pos++;
			if (token.type() != TokenType.NEWLINE) {
				lastEnd = token.end();
			}
		}
	}

	/**
	 * The token after the current one, ignoring line breaks.
	 */
	private ScriptToken tokenAfterCurrent() {
		peek();
		if (tokens.get(pos).type() == TokenType.EOF) {
			return tokens.get(pos);
		}
		return tokens.get(skipNewlinesFrom(pos + 1));
	}

	private int skipNewlinesFrom(int index) {
		int ahead = index;
		while (tokens.get(ahead).type() == TokenType.NEWLINE) {
			ahead++;
		}
		return ahead;
	}

	private void skipNewlines() {
		pos = skipNewlinesFrom(pos);
	}

	private void skipSeparators() {
		while (tokens.get(pos).type() == TokenType.NEWLINE || tokens.get(pos).type() == TokenType.SEMICOLON) {
			pos++;
		}
	}
}
