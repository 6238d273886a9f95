package org.javai.cfgpp;

/**
 * Represents a token of CFG++ source text.
 *
 * @param type the token type
 * @param value the token text; for strings the unescaped content, for environment
 *        references the raw {@code ${...}} text
 * @param line the 1-based line of the first character
 * @param column the 1-based column of the first character
 * @param offset the 0-based UTF-8 byte offset of the first character
 */
public record CfgToken(TokenType type, String value, int line, int column, int offset) {

	public enum TokenType {
		STRING,
		INTEGER,
		DOUBLE,
		BOOLEAN,
		NULL,
		IDENTIFIER,

		ENUM,          // enum
		INCLUDE,       // @include
		IMPORT,        // @import

		LBRACE,
		RBRACE,
		LBRACKET,
		RBRACKET,
		LPAREN,
		RPAREN,
		EQUALS,
		SEMICOLON,
		COMMA,
		DOT,
		COLON,

		PLUS,
		MINUS,
		STAR,
		SLASH,

		ENV_VAR,       // ${NAME} or ${NAME:-default}
		NAMESPACE,     // ::
		COMMENT,
		WHITESPACE,
		EOF
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + value + "\") at " + line + ":" + column;
			case EOF -> "EOF at " + line + ":" + column;
			default -> type + "(" + value + ") at " + line + ":" + column;
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	/**
	 * True for both directive keywords, {@code @include} and {@code @import}.
	 */
	public boolean isIncludeDirective() {
		return type == TokenType.INCLUDE || type == TokenType.IMPORT;
	}
}
