package org.javai.cfgpp;

import java.util.ArrayList;
import java.util.List;
import org.javai.cfgpp.CfgToken.TokenType;

/**
 * Tokenizer for CFG++ source text.
 * Converts input text into a stream of position-tracked tokens.
 */
public class CfgTokenizer {

	private final String input;
	private int pos = 0;
	private int line = 1;
	private int column = 1;
	private int offset = 0;

	public CfgTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input, dropping comments.
	 *
	 * @return list of tokens (includes a single EOF token at the end)
	 * @throws CfgSyntaxException if invalid syntax is encountered
	 */
	public List<CfgToken> tokenize() {
		return scan(false);
	}

	/**
	 * Tokenizes the entire input, keeping {@link TokenType#COMMENT} tokens in the stream.
	 * The parser does not accept comment tokens; this is for tools that need to see them.
	 */
	public List<CfgToken> tokenizeWithComments() {
		return scan(true);
	}

	private List<CfgToken> scan(boolean keepComments) {
		pos = 0;
		line = 1;
		column = 1;
		offset = 0;

		List<CfgToken> tokens = new ArrayList<>();
		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			CfgToken token = nextToken();
			if (token.type() == TokenType.COMMENT && !keepComments) {
				continue;
			}
			tokens.add(token);
		}

		tokens.add(new CfgToken(TokenType.EOF, "", line, column, offset));
		return tokens;
	}

	private CfgToken nextToken() {
		int startLine = line;
		int startColumn = column;
		int startOffset = offset;
		char c = advance();

		TokenType single = switch (c) {
			case '{' -> TokenType.LBRACE;
			case '}' -> TokenType.RBRACE;
			case '[' -> TokenType.LBRACKET;
			case ']' -> TokenType.RBRACKET;
			case '(' -> TokenType.LPAREN;
			case ')' -> TokenType.RPAREN;
			case '=' -> TokenType.EQUALS;
			case ';' -> TokenType.SEMICOLON;
			case ',' -> TokenType.COMMA;
			case '.' -> TokenType.DOT;
			case '+' -> TokenType.PLUS;
			case '-' -> TokenType.MINUS;
			case '*' -> TokenType.STAR;
			default -> null;
		};
		if (single != null) {
			return new CfgToken(single, String.valueOf(c), startLine, startColumn, startOffset);
		}

		switch (c) {
			case '/':
				if (peek() == '/') {
					advance();
					return scanLineComment(startLine, startColumn, startOffset);
				}
				return new CfgToken(TokenType.SLASH, "/", startLine, startColumn, startOffset);
			case ':':
				if (peek() == ':') {
					advance();
					return new CfgToken(TokenType.NAMESPACE, "::", startLine, startColumn, startOffset);
				}
				return new CfgToken(TokenType.COLON, ":", startLine, startColumn, startOffset);
			case '"':
				return scanString(startLine, startColumn, startOffset);
			case '$':
				if (peek() == '{') {
					return scanEnvVar(startLine, startColumn, startOffset);
				}
				throw new CfgSyntaxException("Unexpected character '$'", startLine, startColumn);
			case '@':
				return scanDirective(startLine, startColumn, startOffset);
			default:
				if (isDigit(c)) {
					return scanNumber(c, startLine, startColumn, startOffset);
				}
				if (isIdentifierStart(c)) {
					return scanIdentifier(c, startLine, startColumn, startOffset);
				}
				throw new CfgSyntaxException("Unexpected character '" + c + "'", startLine, startColumn);
		}
	}

	private CfgToken scanString(int startLine, int startColumn, int startOffset) {
		StringBuilder sb = new StringBuilder();
		while (!isAtEnd()) {
			char c = advance();
			if (c == '"') {
				return new CfgToken(TokenType.STRING, sb.toString(), startLine, startColumn, startOffset);
			}
			if (c == '\\' && !isAtEnd()) {
				char next = advance();
				switch (next) {
					case 'n' -> sb.append('\n');
					case 'r' -> sb.append('\r');
					case 't' -> sb.append('\t');
					case '\\' -> sb.append('\\');
					case '"' -> sb.append('"');
					// unknown escapes stay as written
					default -> sb.append('\\').append(next);
				}
			} else {
				sb.append(c);
			}
		}
		throw new CfgSyntaxException("Unterminated string", startLine, startColumn);
	}

	private CfgToken scanEnvVar(int startLine, int startColumn, int startOffset) {
		advance(); // consume '{'
		StringBuilder sb = new StringBuilder("${");
		int depth = 1;
		while (!isAtEnd()) {
			char c = advance();
			sb.append(c);
			if (c == '{') {
				depth++;
			} else if (c == '}') {
				depth--;
				if (depth == 0) {
					return new CfgToken(TokenType.ENV_VAR, sb.toString(), startLine, startColumn, startOffset);
				}
			}
		}
		throw new CfgSyntaxException("Unterminated environment variable", startLine, startColumn);
	}

	private CfgToken scanDirective(int startLine, int startColumn, int startOffset) {
		StringBuilder sb = new StringBuilder("@");
		while (!isAtEnd() && isIdentifierChar(peek())) {
			sb.append(advance());
		}
		String directive = sb.toString();
		return switch (directive) {
			case "@include" -> new CfgToken(TokenType.INCLUDE, directive, startLine, startColumn, startOffset);
			case "@import" -> new CfgToken(TokenType.IMPORT, directive, startLine, startColumn, startOffset);
			default -> throw new CfgSyntaxException("Unknown directive '" + directive + "'", startLine, startColumn);
		};
	}

	private CfgToken scanNumber(char first, int startLine, int startColumn, int startOffset) {
		StringBuilder sb = new StringBuilder().append(first);
		boolean isFloat = false;
		boolean hasExponent = false;

		while (!isAtEnd()) {
			char c = peek();
			if (isDigit(c)) {
				sb.append(advance());
			} else if (c == '.') {
				if (isFloat) {
					break; // a second dot belongs to the next token
				}
				isFloat = true;
				sb.append(advance());
			} else if ((c == 'e' || c == 'E') && !hasExponent) {
				isFloat = true;
				hasExponent = true;
				sb.append(advance());
				if (peek() == '+' || peek() == '-') {
					sb.append(advance());
				}
			} else {
				break;
			}
		}

		TokenType type = isFloat ? TokenType.DOUBLE : TokenType.INTEGER;
		return new CfgToken(type, sb.toString(), startLine, startColumn, startOffset);
	}

	private CfgToken scanIdentifier(char first, int startLine, int startColumn, int startOffset) {
		StringBuilder sb = new StringBuilder().append(first);
		while (!isAtEnd() && isIdentifierChar(peek())) {
			sb.append(advance());
		}
		String text = sb.toString();
		TokenType type = switch (text) {
			case "true", "false" -> TokenType.BOOLEAN;
			case "null" -> TokenType.NULL;
			case "enum" -> TokenType.ENUM;
			default -> TokenType.IDENTIFIER;
		};
		return new CfgToken(type, text, startLine, startColumn, startOffset);
	}

	private CfgToken scanLineComment(int startLine, int startColumn, int startOffset) {
		StringBuilder sb = new StringBuilder("//");
		while (!isAtEnd() && peek() != '\n') {
			sb.append(advance());
		}
		return new CfgToken(TokenType.COMMENT, sb.toString(), startLine, startColumn, startOffset);
	}

	private void skipWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		char c = input.charAt(pos++);
		if (c == '\n') {
			line++;
			column = 1;
		} else if (!Character.isLowSurrogate(c)) {
			column++;
		}
		offset += utf8Length(c);
		return c;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private static int utf8Length(char c) {
		if (c < 0x80) return 1;
		if (c < 0x800) return 2;
		if (Character.isHighSurrogate(c)) return 4;
		if (Character.isLowSurrogate(c)) return 0;
		return 3;
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c);
	}
}
