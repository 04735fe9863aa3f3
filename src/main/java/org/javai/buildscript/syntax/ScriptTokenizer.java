package org.javai.buildscript.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.buildscript.syntax.ScriptToken.TokenType;

/**
 * Tokenizer for build scripts.
 * <p>
 * Never fails: characters that start no token become {@link TokenType#BAD_CHARACTER} tokens and
 * an unterminated string becomes a {@link TokenType#STRING_LITERAL} without its closing quote.
 * Reporting is left to the parser. Blanks and comments are dropped, line breaks are kept as
 * {@link TokenType#NEWLINE} tokens because they separate statements.
 */
public class ScriptTokenizer {

	private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
			Map.entry("package", TokenType.PACKAGE),
			Map.entry("import", TokenType.IMPORT),
			Map.entry("as", TokenType.AS),
			Map.entry("val", TokenType.VAL),
			Map.entry("var", TokenType.VAR),
			Map.entry("this", TokenType.THIS),
			Map.entry("null", TokenType.NULL),
			Map.entry("true", TokenType.TRUE),
			Map.entry("false", TokenType.FALSE),
			Map.entry("if", TokenType.IF),
			Map.entry("else", TokenType.ELSE)
	);

	private final String input;
	private int pos;

	public ScriptTokenizer(String input) {
		this(input, 0);
	}

	/**
	 * Tokenizes {@code input} from {@code startOffset} to its end. Token offsets stay absolute
	 * in {@code input}.
	 */
	public ScriptTokenizer(String input, int startOffset) {
		this.input = input != null ? input : "";
		if (startOffset < 0 || startOffset > this.input.length()) {
			throw new IllegalArgumentException(
					"Start offset " + startOffset + " is outside of an input of length " + this.input.length());
		}
		this.pos = startOffset;
	}

	/**
	 * Tokenizes the remaining input.
	 *
	 * @return list of tokens, always ending with an EOF token
	 */
	public List<ScriptToken> tokenize() {
		List<ScriptToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipBlanksAndComments();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new ScriptToken(TokenType.EOF, "", pos, pos));
		return tokens;
	}

	private ScriptToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '\n' -> single(TokenType.NEWLINE);
			case '(' -> single(TokenType.LPAR);
			case ')' -> single(TokenType.RPAR);
			case '{' -> single(TokenType.LBRACE);
			case '}' -> single(TokenType.RBRACE);
			case '[' -> single(TokenType.LBRACKET);
			case ']' -> single(TokenType.RBRACKET);
			case ',' -> single(TokenType.COMMA);
			case ';' -> single(TokenType.SEMICOLON);
			case ':' -> single(TokenType.COLON);
			case '.' -> single(TokenType.DOT);
			case '@' -> single(TokenType.AT);
			case '?' -> peekAt(1) == '.' ? pair(TokenType.SAFE_ACCESS) : single(TokenType.QUEST);
			case '=' -> peekAt(1) == '=' ? pair(TokenType.EQEQ) : single(TokenType.EQ);
			case '!' -> peekAt(1) == '=' ? pair(TokenType.EXCLEQ) : single(TokenType.EXCL);
			case '<' -> peekAt(1) == '=' ? pair(TokenType.LTEQ) : single(TokenType.LT);
			case '>' -> peekAt(1) == '=' ? pair(TokenType.GTEQ) : single(TokenType.GT);
			case '+' -> peekAt(1) == '=' ? pair(TokenType.PLUS_EQ) : single(TokenType.PLUS);
			case '*' -> peekAt(1) == '=' ? pair(TokenType.MUL_EQ) : single(TokenType.MUL);
			case '/' -> peekAt(1) == '=' ? pair(TokenType.DIV_EQ) : single(TokenType.DIV);
			case '%' -> peekAt(1) == '=' ? pair(TokenType.PERC_EQ) : single(TokenType.PERC);
			case '-' -> switch (peekAt(1)) {
				case '=' -> pair(TokenType.MINUS_EQ);
				case '>' -> pair(TokenType.ARROW);
				default -> single(TokenType.MINUS);
			};
			case '&' -> peekAt(1) == '&' ? pair(TokenType.ANDAND) : single(TokenType.BAD_CHARACTER);
			case '|' -> peekAt(1) == '|' ? pair(TokenType.OROR) : single(TokenType.BAD_CHARACTER);
			case '"' -> scanString();
			default -> {
				if (isDigit(c)) {
					yield scanNumber();
				} else if (isIdentifierStart(c)) {
					yield scanIdentifier();
				} else {
					yield token(TokenType.BAD_CHARACTER, start, start + Character.charCount(input.codePointAt(start)));
				}
			}
		};
	}

	private ScriptToken single(TokenType type) {
		return token(type, pos, pos + 1);
	}

	private ScriptToken pair(TokenType type) {
		return token(type, pos, pos + 2);
	}

	private ScriptToken token(TokenType type, int start, int end) {
		pos = end;
		return new ScriptToken(type, input.substring(start, end), start, end);
	}

	private ScriptToken scanString() {
		int start = pos;
		if (input.startsWith("\"\"\"", pos)) {
			int close = input.indexOf("\"\"\"", pos + 3);
			int end = close < 0 ? input.length() : close + 3;
			// a raw string may end with extra quotes that belong to its content
			while (close >= 0 && end < input.length() && input.charAt(end) == '"') {
				end++;
			}
			return token(TokenType.STRING_LITERAL, start, end);
		}

		advance(); // consume opening "
		int templateDepth = 0;
		while (!isAtEnd() && peek() != '\n') {
			char c = advance();
			if (templateDepth > 0) {
				if (c == '{') {
					templateDepth++;
				} else if (c == '}') {
					templateDepth--;
				}
			} else if (c == '\\' && !isAtEnd() && peek() != '\n') {
				advance();
			} else if (c == '$' && !isAtEnd() && peek() == '{') {
				advance();
				templateDepth = 1;
			} else if (c == '"') {
				break;
			}
		}
		return token(TokenType.STRING_LITERAL, start, pos);
	}

	/**
	 * Whether a {@link TokenType#STRING_LITERAL} token text ends with its closing quote.
	 */
	static boolean isTerminatedString(String text) {
		if (text.startsWith("\"\"\"")) {
			return text.length() >= 6 && text.endsWith("\"\"\"");
		}
		int templateDepth = 0;
		for (int i = 1; i < text.length(); i++) {
			char c = text.charAt(i);
			if (templateDepth > 0) {
				if (c == '{') {
					templateDepth++;
				} else if (c == '}') {
					templateDepth--;
				}
			} else if (c == '\\') {
				i++;
			} else if (c == '$' && i + 1 < text.length() && text.charAt(i + 1) == '{') {
				i++;
				templateDepth = 1;
			} else if (c == '"') {
				return i == text.length() - 1;
			}
		}
		return false;
	}

	private ScriptToken scanNumber() {
		int start = pos;

		if (peek() == '0' && (peekAt(1) == 'x' || peekAt(1) == 'X')) {
			advance();
			advance();
			while (!isAtEnd() && (isHexDigit(peek()) || peek() == '_')) {
				advance();
			}
			return integerSuffix(start);
		}
		if (peek() == '0' && (peekAt(1) == 'b' || peekAt(1) == 'B')) {
			advance();
			advance();
			while (!isAtEnd() && (peek() == '0' || peek() == '1' || peek() == '_')) {
				advance();
			}
			return integerSuffix(start);
		}

		scanDigits();
		boolean floating = false;

		// Check for decimal part
		if (peek() == '.' && isDigit(peekAt(1))) {
			advance(); // consume '.'
			scanDigits();
			floating = true;
		}
		if ((peek() == 'e' || peek() == 'E')
				&& (isDigit(peekAt(1)) || ((peekAt(1) == '+' || peekAt(1) == '-') && isDigit(peekAt(2))))) {
			advance();
			if (peek() == '+' || peek() == '-') {
				advance();
			}
			scanDigits();
			floating = true;
		}
		if (peek() == 'f' || peek() == 'F') {
			advance();
			floating = true;
		}
		if (floating) {
			return token(TokenType.FLOAT_LITERAL, start, pos);
		}
		return integerSuffix(start);
	}

	private ScriptToken integerSuffix(int start) {
		if (peek() == 'L') {
			advance();
		}
		return token(TokenType.INTEGER_LITERAL, start, pos);
	}

	private void scanDigits() {
		while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
			advance();
		}
	}

	private ScriptToken scanIdentifier() {
		int start = pos;

		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		return new ScriptToken(KEYWORDS.getOrDefault(value, TokenType.IDENTIFIER), value, start, pos);
	}

	private void skipBlanksAndComments() {
		while (!isAtEnd()) {
			char c = peek();
			if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
				advance();
			} else if (c == '/' && peekAt(1) == '/') {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			} else if (c == '/' && peekAt(1) == '*') {
				int close = input.indexOf("*/", pos + 2);
				pos = close < 0 ? input.length() : close + 2;
			} else {
				return;
			}
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekAt(int ahead) {
		int index = pos + ahead;
		return index < input.length() ? input.charAt(index) : '\0';
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isHexDigit(char c) {
		return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
	}

	private boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	private boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c);
	}
}
