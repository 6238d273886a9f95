package org.javai.cfgpp;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.cfgpp.CfgToken.TokenType;
import org.javai.cfgpp.value.CfgValue;
import org.javai.cfgpp.value.CfgValue.ArrayValue;
import org.javai.cfgpp.value.CfgValue.ObjectValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser that turns CFG++ text directly into a {@link CfgValue} tree.
 * <p>
 * Environment references and include directives are resolved while parsing; there is
 * no intermediate syntax tree. Parsing is fail-fast: the first violation throws and no
 * partial tree is returned.
 * <p>
 * Grammar:
 * <pre>
 * document   := fields | value ';'?
 * value      := string | integer | double | boolean | null | object | array
 *             | identifier object?  | include | env-var | '-' number
 * object     := '{' fields '}'
 * fields     := ( identifier '=' value ';'?
 *               | identifier object ';'?
 *               | include ';'? )*
 * array      := '[' ( value ','? )* ']'
 * include    := ( '@include' | '@import' ) string
 * </pre>
 * A bare identifier not followed by {@code '{'} is an enum literal.
 * <p>
 * Example usage:
 *
 * <pre>
 * CfgParser parser = new CfgParser();
 * CfgValue config = parser.parse("database { host = \"localhost\"; port = 5432; }");
 * config.getPath("database.port"); // Optional[5432]
 * </pre>
 *
 * A parser keeps the token buffer, cursor and include state of the parse in progress,
 * so an instance must not be used by several threads at once. Separate instances are
 * independent.
 */
public class CfgParser {

	private static final Logger logger = LoggerFactory.getLogger(CfgParser.class);

	private final ParserOptions options;
	private final EnvironmentLookup environment;

	private List<CfgToken> tokens = List.of();
	private int current = 0;
	private Path currentFile;
	private boolean syntaxOnly;
	private int includeDepth = 0;
	private final Deque<Path> includeStack = new ArrayDeque<>();

	/**
	 * Creates a parser with default options reading the process environment.
	 */
	public CfgParser() {
		this(ParserOptions.defaults());
	}

	public CfgParser(ParserOptions options) {
		this(options, EnvironmentLookup.system());
	}

	/**
	 * @param options parser settings
	 * @param environment source of values for {@code ${NAME}} references
	 */
	public CfgParser(ParserOptions options, EnvironmentLookup environment) {
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
		this.syntaxOnly = options.syntaxOnly();
	}

	public ParserOptions options() {
		return options;
	}

	/**
	 * Parses CFG++ text. Relative includes are searched in the configured include paths.
	 *
	 * @return the value tree, or the null value in syntax-only mode
	 * @throws CfgSyntaxException on the first lexical or grammar violation
	 * @throws CfgIncludeException if an included file cannot be found or nests too deeply
	 * @throws CfgEnvVarException if a referenced variable is unset and has no default
	 */
	public CfgValue parse(String input) {
		Objects.requireNonNull(input, "input must not be null");
		return parseSource(input, null);
	}

	/**
	 * Parses CFG++ text read fully from a reader.
	 */
	public CfgValue parse(Reader reader) {
		Objects.requireNonNull(reader, "reader must not be null");
		StringWriter buffer = new StringWriter();
		try {
			reader.transferTo(buffer);
		} catch (IOException e) {
			throw new CfgIoException("Failed to read configuration: " + e.getMessage(), e);
		}
		return parseSource(buffer.toString(), null);
	}

	/**
	 * Parses a UTF-8 file. Includes that are not found in the configured include
	 * paths are also looked up next to the including file.
	 */
	public CfgValue parseFile(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		return parseFileContent(path);
	}

	/**
	 * Parses several files and merges their top-level objects into one object.
	 * Keys of later files replace those of earlier ones. A file whose top level
	 * is not an object contributes nothing.
	 */
	public ObjectValue parseFiles(List<Path> paths) {
		Objects.requireNonNull(paths, "paths must not be null");
		ObjectValue result = CfgValue.object();
		for (Path path : paths) {
			CfgValue value = parseFile(path);
			if (value instanceof ObjectValue object) {
				result.putAll(object);
			} else if (!syntaxOnly) {
				logger.warn("Skipping {}: top-level value is {} rather than an object", path, value.typeName());
			}
		}
		return result;
	}

	/**
	 * Checks the text against the grammar without building a value tree.
	 * Includes and environment references are still resolved.
	 *
	 * @throws CfgParseException for the first problem found
	 */
	public void validateSyntax(String input) {
		Objects.requireNonNull(input, "input must not be null");
		boolean previous = syntaxOnly;
		syntaxOnly = true;
		try {
			parseSource(input, null);
		} finally {
			syntaxOnly = previous;
		}
	}

	private CfgValue parseFileContent(Path path) {
		String content;
		try {
			content = Files.readString(path, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new CfgIoException("Failed to read file " + path + ": " + e.getMessage(), e);
		}
		includeStack.push(path.toAbsolutePath().normalize());
		try {
			return parseSource(content, path);
		} finally {
			includeStack.pop();
		}
	}

	private CfgValue parseSource(String input, Path sourceFile) {
		List<CfgToken> savedTokens = tokens;
		int savedCurrent = current;
		Path savedFile = currentFile;
		try {
			tokens = new CfgTokenizer(input).tokenize();
			current = 0;
			currentFile = sourceFile;
			return parseDocument();
		} finally {
			tokens = savedTokens;
			current = savedCurrent;
			currentFile = savedFile;
		}
	}

	private CfgValue parseDocument() {
		if (isFieldListStart()) {
			ObjectValue document = syntaxOnly ? null : CfgValue.object();
			parseFields(document);
			if (!isAtEnd()) {
				throw unexpected(peek());
			}
			return syntaxOnly ? CfgValue.nullValue() : document;
		}

		CfgValue value = parseValue();
		match(TokenType.SEMICOLON);
		if (!isAtEnd()) {
			CfgToken token = peek();
			throw new CfgSyntaxException("Unexpected " + describe(token) + " after top-level value",
					token.line(), token.column());
		}
		return syntaxOnly ? CfgValue.nullValue() : value;
	}

	/**
	 * True when the document is a bare list of fields rather than a single value:
	 * {@code name = ...}, {@code name { ... }}, or an include followed by more content.
	 */
	private boolean isFieldListStart() {
		CfgToken first = peek();
		if (first.type() == TokenType.IDENTIFIER) {
			TokenType next = peekAt(1).type();
			return next == TokenType.EQUALS || next == TokenType.LBRACE;
		}
		if (first.isIncludeDirective() && peekAt(1).type() == TokenType.STRING) {
			CfgToken after = peekAt(2);
			if (after.type() == TokenType.SEMICOLON) {
				after = peekAt(3);
			}
			return after.type() != TokenType.EOF;
		}
		return false;
	}

	private CfgValue parseValue() {
		CfgToken token = peek();
		return switch (token.type()) {
			case STRING -> {
				advance();
				yield CfgValue.of(token.value());
			}
			case INTEGER -> {
				advance();
				yield parseInteger(token, false);
			}
			case DOUBLE -> {
				advance();
				yield parseDouble(token, false);
			}
			case BOOLEAN -> {
				advance();
				yield CfgValue.of("true".equals(token.value()));
			}
			case NULL -> {
				advance();
				yield CfgValue.nullValue();
			}
			case LBRACE -> parseObject();
			case LBRACKET -> parseArray();
			case IDENTIFIER -> parseIdentifierForm();
			case INCLUDE, IMPORT -> parseInclude();
			case ENV_VAR -> parseEnvVar();
			case MINUS -> parseNegativeNumber();
			case EOF -> throw new CfgSyntaxException("Unexpected end of input, expected a value",
					token.line(), token.column());
			default -> throw unexpected(token);
		};
	}

	private CfgValue parseObject() {
		expect(TokenType.LBRACE, "'{'");
		ObjectValue object = syntaxOnly ? null : CfgValue.object();
		parseFields(object);
		expect(TokenType.RBRACE, "'}'");
		return syntaxOnly ? CfgValue.nullValue() : object;
	}

	/**
	 * Parses fields up to, but not including, the closing brace or end of input.
	 *
	 * @param target receives the fields; null in syntax-only mode
	 */
	private void parseFields(ObjectValue target) {
		while (!check(TokenType.RBRACE) && !isAtEnd()) {
			if (peek().isIncludeDirective()) {
				mergeInclude(target);
				match(TokenType.SEMICOLON);
				continue;
			}

			CfgToken key = expect(TokenType.IDENTIFIER, "field name");
			CfgValue value;
			if (check(TokenType.LBRACE)) {
				value = parseObject();
			} else {
				expect(TokenType.EQUALS, "'=' after field '" + key.value() + "'");
				value = parseValue();
			}
			if (target != null) {
				target.set(key.value(), value);
			}
			match(TokenType.SEMICOLON);
		}
	}

	private void mergeInclude(ObjectValue target) {
		String includePath = peekAt(1).value();
		CfgValue included = parseInclude();
		if (target == null) {
			return;
		}
		if (!(included instanceof ObjectValue object)) {
			throw new CfgIncludeException(includePath,
					"Included file must define an object to be merged into fields, found " + included.typeName());
		}
		target.putAll(object);
	}

	private CfgValue parseArray() {
		expect(TokenType.LBRACKET, "'['");
		ArrayValue array = syntaxOnly ? null : CfgValue.array();
		while (!check(TokenType.RBRACKET) && !isAtEnd()) {
			CfgValue element = parseValue();
			if (array != null) {
				array.push(element);
			}
			match(TokenType.COMMA);
		}
		expect(TokenType.RBRACKET, "']'");
		return syntaxOnly ? CfgValue.nullValue() : array;
	}

	private CfgValue parseIdentifierForm() {
		CfgToken identifier = advance();
		if (check(TokenType.LBRACE)) {
			return parseObject();
		}
		return CfgValue.enumValue(identifier.value());
	}

	private CfgValue parseNegativeNumber() {
		CfgToken minus = advance();
		CfgToken number = peek();
		if (number.type() == TokenType.INTEGER) {
			advance();
			return parseInteger(number, true);
		}
		if (number.type() == TokenType.DOUBLE) {
			advance();
			return parseDouble(number, true);
		}
		throw unexpected(minus);
	}

	private CfgValue parseInteger(CfgToken token, boolean negative) {
		String text = negative ? "-" + token.value() : token.value();
		try {
			return CfgValue.of(Long.parseLong(text));
		} catch (NumberFormatException e) {
			throw new CfgSyntaxException("Invalid integer: " + text, token.line(), token.column());
		}
	}

	private CfgValue parseDouble(CfgToken token, boolean negative) {
		try {
			double value = Double.parseDouble(token.value());
			return CfgValue.of(negative ? -value : value);
		} catch (NumberFormatException e) {
			throw new CfgSyntaxException("Invalid double: " + token.value(), token.line(), token.column());
		}
	}

	private CfgValue parseEnvVar() {
		CfgToken token = advance();
		String raw = token.value();
		if (!options.expandEnvVars()) {
			return CfgValue.of(raw);
		}

		String content = raw.substring(2, raw.length() - 1);
		int separator = content.indexOf(":-");
		String name = separator >= 0 ? content.substring(0, separator) : content;
		String defaultValue = separator >= 0 ? content.substring(separator + 2) : null;

		Optional<String> value = environment.lookup(name);
		if (value.isPresent()) {
			return CfgValue.of(value.get());
		}
		if (defaultValue != null) {
			return CfgValue.of(defaultValue);
		}
		throw new CfgEnvVarException(name, "Environment variable not found");
	}

	private CfgValue parseInclude() {
		CfgToken directive = advance();
		if (!options.processIncludes()) {
			throw new CfgSyntaxException("Include directives are disabled", directive.line(), directive.column());
		}
		CfgToken pathToken = expect(TokenType.STRING, "include path string after " + directive.value());
		String requested = pathToken.value();

		if (includeDepth >= options.maxIncludeDepth()) {
			throw new CfgIncludeException(requested,
					"Maximum include depth (" + options.maxIncludeDepth() + ") exceeded");
		}

		Path resolved = resolveInclude(requested)
				.orElseThrow(() -> new CfgIncludeException(requested, "File not found in include paths"));
		if (options.detectIncludeCycles() && includeStack.contains(resolved.toAbsolutePath().normalize())) {
			throw new CfgIncludeException(requested, "Circular include detected");
		}

		logger.debug("Including '{}' from {} (depth {})", requested, resolved, includeDepth + 1);
		includeDepth++;
		try {
			return parseFileContent(resolved);
		} finally {
			includeDepth--;
		}
	}

	private Optional<Path> resolveInclude(String requested) {
		for (Path root : options.includePaths()) {
			Path candidate = root.resolve(requested);
			if (Files.isRegularFile(candidate)) {
				return Optional.of(candidate);
			}
		}
		if (currentFile != null) {
			Path parent = currentFile.toAbsolutePath().getParent();
			if (parent != null) {
				Path candidate = parent.resolve(requested);
				if (Files.isRegularFile(candidate)) {
					return Optional.of(candidate);
				}
			}
		}
		return Optional.empty();
	}

	// ---- cursor --------------------------------------------------------

	private CfgToken peek() {
		return tokens.get(current);
	}

	private CfgToken peekAt(int distance) {
		int index = Math.min(current + distance, tokens.size() - 1);
		return tokens.get(index);
	}

	private CfgToken advance() {
		CfgToken token = tokens.get(current);
		if (!isAtEnd()) {
			current++;
		}
		return token;
	}

	private boolean check(TokenType type) {
		if (isAtEnd()) return false;
		return peek().type() == type;
	}

	private boolean match(TokenType type) {
		if (check(type)) {
			advance();
			return true;
		}
		return false;
	}

	private boolean isAtEnd() {
		return peek().type() == TokenType.EOF;
	}

	private CfgToken expect(TokenType type, String what) {
		if (check(type)) {
			return advance();
		}
		CfgToken found = peek();
		throw new CfgSyntaxException("Expected " + what + ", found " + describe(found), found.line(), found.column());
	}

	private static CfgSyntaxException unexpected(CfgToken token) {
		return new CfgSyntaxException("Unexpected " + describe(token), token.line(), token.column());
	}

	private static String describe(CfgToken token) {
		return switch (token.type()) {
			case EOF -> "end of input";
			case STRING -> "string \"" + token.value() + "\"";
			default -> "token '" + token.value() + "'";
		};
	}
}
