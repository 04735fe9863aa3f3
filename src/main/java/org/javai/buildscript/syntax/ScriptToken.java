package org.javai.buildscript.syntax;

/**
 * A token of a build script.
 *
 * @param type the token type
 * @param text the exact source text of the token
 * @param start the offset of the first character in the tokenized text
 * @param end the offset after the last character
 */
public record ScriptToken(TokenType type, String text, int start, int end) {

	public enum TokenType {
		IDENTIFIER,
		INTEGER_LITERAL,   // 42, 0x2A, 1_000, 7L
		FLOAT_LITERAL,     // 1.5, 2e10, 3f
		STRING_LITERAL,    // "...", """...""", quotes included, possibly unterminated
		// keywords
		PACKAGE,
		IMPORT,
		AS,
		VAL,
		VAR,
		THIS,
		NULL,
		TRUE,
		FALSE,
		IF,
		ELSE,
		// punctuation
		LPAR,
		RPAR,
		LBRACE,
		RBRACE,
		LBRACKET,
		RBRACKET,
		COMMA,
		SEMICOLON,
		COLON,
		DOT,
		SAFE_ACCESS,       // ?.
		QUEST,
		AT,
		ARROW,             // ->
		// operators
		EQ,
		PLUS_EQ,
		MINUS_EQ,
		MUL_EQ,
		DIV_EQ,
		PERC_EQ,
		EQEQ,
		EXCLEQ,
		LT,
		GT,
		LTEQ,
		GTEQ,
		ANDAND,
		OROR,
		EXCL,
		PLUS,
		MINUS,
		MUL,
		DIV,
		PERC,
		NEWLINE,
		BAD_CHARACTER,
		EOF
	}

	@Override
	public String toString() {
		return switch (type) {
			case IDENTIFIER, INTEGER_LITERAL, FLOAT_LITERAL, STRING_LITERAL, BAD_CHARACTER ->
					type + "(" + text + ")@" + start;
			default -> type + "@" + start;
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isAssignmentOperator() {
		return switch (type) {
			case EQ, PLUS_EQ, MINUS_EQ, MUL_EQ, DIV_EQ, PERC_EQ -> true;
			default -> false;
		};
	}
}
