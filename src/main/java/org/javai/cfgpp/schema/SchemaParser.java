package org.javai.cfgpp.schema;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.javai.cfgpp.CfgIoException;
import org.javai.cfgpp.CfgParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for schema text.
 * <p>
 * Schema text is line oriented. Blank lines and lines starting with {@code //} or
 * {@code #} are skipped. Two kinds of declaration are recognized:
 *
 * <pre>
 * enum Level { debug, info, warn }
 *
 * Server {
 *     host: string;
 *     port: integer;
 *     tags: array&lt;string&gt;;
 *     level: optional&lt;Level&gt;;
 *     id: union&lt;string|integer&gt;;
 * }
 * </pre>
 *
 * Enum values may also be spread over several lines. Every parsed field is
 * required and carries no default or constraints; use {@link Schema#builder()} for
 * those. A type name that is not a primitive keyword becomes an
 * {@link TypeDefinition.ObjectRef}, which the validator resolves to an enum when
 * no object schema has that name. Anything else is rejected with a
 * {@link CfgParseException} naming the offending line.
 */
public class SchemaParser {

	private static final Logger logger = LoggerFactory.getLogger(SchemaParser.class);

	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	/**
	 * Parse a UTF-8 schema file.
	 */
	public Schema parse(Path path) {
		try {
			return parseString(Files.readString(path, StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new CfgIoException("Failed to read schema file " + path, e);
		}
	}

	/**
	 * Parse UTF-8 schema text from an input stream.
	 */
	public Schema parse(InputStream inputStream) {
		try {
			return parseString(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new CfgIoException("Failed to read schema from input stream", e);
		}
	}

	/**
	 * Parse schema text from a reader.
	 */
	public Schema parse(Reader reader) {
		try {
			StringWriter writer = new StringWriter();
			reader.transferTo(writer);
			return parseString(writer.toString());
		} catch (IOException e) {
			throw new CfgIoException("Failed to read schema from reader", e);
		}
	}

	/**
	 * Parse schema text from a string. The resulting schema has no root type.
	 */
	public Schema parseString(String schemaText) {
		if (schemaText == null) {
			throw new CfgParseException("Schema text cannot be null");
		}
		Schema.Builder builder = Schema.builder();
		String[] lines = schemaText.split("\\R", -1);
		int enumCount = 0;
		int objectCount = 0;
		int index = 0;
		while (index < lines.length) {
			String line = lines[index].trim();
			if (isSkippable(line)) {
				index++;
			} else if (line.startsWith("enum ") || line.startsWith("enum\t")) {
				index = parseEnum(lines, index, builder);
				enumCount++;
			} else if (line.contains("{")) {
				index = parseObject(lines, index, builder);
				objectCount++;
			} else {
				throw error(index, "Unexpected content '" + line + "'");
			}
		}
		Schema schema = builder.build();
		logger.debug("Parsed schema with {} enum declaration(s) and {} object declaration(s)", enumCount, objectCount);
		return schema;
	}

	private int parseEnum(String[] lines, int start, Schema.Builder builder) {
		String declaration = lines[start].trim().substring("enum".length());
		int brace = declaration.indexOf('{');
		if (brace < 0) {
			throw error(start, "Expected '{' after enum name");
		}
		String name = declaration.substring(0, brace).trim();
		requireIdentifier(name, start, "enum name");

		List<String> values = new ArrayList<>();
		String rest = declaration.substring(brace + 1);
		int close = rest.indexOf('}');
		if (close >= 0) {
			addEnumValues(rest.substring(0, close), start, values);
			requireNothingAfter(rest.substring(close + 1), start);
			builder.enumType(name, values);
			return start + 1;
		}
		addEnumValues(rest, start, values);

		for (int index = start + 1; index < lines.length; index++) {
			String line = lines[index].trim();
			if (isSkippable(line)) {
				continue;
			}
			close = line.indexOf('}');
			if (close >= 0) {
				addEnumValues(line.substring(0, close), index, values);
				requireNothingAfter(line.substring(close + 1), index);
				builder.enumType(name, values);
				return index + 1;
			}
			addEnumValues(line, index, values);
		}
		throw error(start, "Unterminated enum '" + name + "'");
	}

	private void addEnumValues(String text, int lineIndex, List<String> values) {
		for (String part : text.split(",")) {
			String value = part.trim();
			if (!value.isEmpty()) {
				requireIdentifier(value, lineIndex, "enum value");
				values.add(value);
			}
		}
	}

	private int parseObject(String[] lines, int start, Schema.Builder builder) {
		String declaration = lines[start].trim();
		int brace = declaration.indexOf('{');
		String name = declaration.substring(0, brace).trim();
		requireIdentifier(name, start, "object schema name");
		builder.objectType(name, Map.of());

		String rest = declaration.substring(brace + 1);
		int close = rest.indexOf('}');
		if (close >= 0) {
			addFields(name, rest.substring(0, close), start, builder);
			requireNothingAfter(rest.substring(close + 1), start);
			return start + 1;
		}
		addFields(name, rest, start, builder);

		for (int index = start + 1; index < lines.length; index++) {
			String line = lines[index].trim();
			if (isSkippable(line)) {
				continue;
			}
			close = line.indexOf('}');
			if (close >= 0) {
				addFields(name, line.substring(0, close), index, builder);
				requireNothingAfter(line.substring(close + 1), index);
				return index + 1;
			}
			addFields(name, line, index, builder);
		}
		throw error(start, "Unterminated object schema '" + name + "'");
	}

	private void addFields(String objectName, String text, int lineIndex, Schema.Builder builder) {
		for (String part : text.split(";")) {
			String declaration = part.trim();
			if (declaration.isEmpty()) {
				continue;
			}
			int colon = declaration.indexOf(':');
			if (colon < 0) {
				throw error(lineIndex, "Expected 'name: type' but found '" + declaration + "'");
			}
			String fieldName = declaration.substring(0, colon).trim();
			requireIdentifier(fieldName, lineIndex, "field name");
			TypeDefinition type = parseType(declaration.substring(colon + 1).trim(), lineIndex);
			builder.field(objectName, fieldName, FieldDefinition.required(type));
		}
	}

	private TypeDefinition parseType(String text, int lineIndex) {
		switch (text) {
			case "null":
				return TypeDefinition.nullType();
			case "boolean":
				return TypeDefinition.booleanType();
			case "integer":
				return TypeDefinition.integerType();
			case "double":
				return TypeDefinition.doubleType();
			case "string":
				return TypeDefinition.stringType();
			default:
				break;
		}
		String inner = genericArgument(text, "array");
		if (inner != null) {
			return TypeDefinition.arrayOf(parseType(inner, lineIndex));
		}
		inner = genericArgument(text, "optional");
		if (inner != null) {
			return TypeDefinition.optional(parseType(inner, lineIndex));
		}
		inner = genericArgument(text, "union");
		if (inner != null) {
			List<TypeDefinition> members = new ArrayList<>();
			for (String member : splitUnionMembers(inner, lineIndex)) {
				members.add(parseType(member, lineIndex));
			}
			return new TypeDefinition.UnionType(members);
		}
		if (IDENTIFIER.matcher(text).matches()) {
			return TypeDefinition.objectRef(text);
		}
		throw error(lineIndex, "Invalid type '" + text + "'");
	}

	/**
	 * The text between the angle brackets of {@code keyword<...>}, or null when the
	 * type is not of that form.
	 */
	private static String genericArgument(String text, String keyword) {
		String prefix = keyword + "<";
		if (text.startsWith(prefix) && text.endsWith(">")) {
			return text.substring(prefix.length(), text.length() - 1).trim();
		}
		return null;
	}

	/**
	 * Splits on {@code |} outside nested angle brackets.
	 */
	private List<String> splitUnionMembers(String text, int lineIndex) {
		List<String> members = new ArrayList<>();
		int depth = 0;
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '<') {
				depth++;
			} else if (c == '>') {
				depth--;
			} else if (c == '|' && depth == 0) {
				members.add(text.substring(start, i).trim());
				start = i + 1;
			}
		}
		members.add(text.substring(start).trim());
		if (members.stream().anyMatch(String::isEmpty)) {
			throw error(lineIndex, "Empty member in union<" + text + ">");
		}
		return members;
	}

	private static boolean isSkippable(String line) {
		return line.isEmpty() || line.startsWith("//") || line.startsWith("#");
	}

	private static void requireIdentifier(String text, int lineIndex, String what) {
		if (!IDENTIFIER.matcher(text).matches()) {
			throw error(lineIndex, "Invalid " + what + " '" + text + "'");
		}
	}

	private static void requireNothingAfter(String text, int lineIndex) {
		String trailing = text.trim();
		if (!trailing.isEmpty() && !trailing.equals(";") && !isSkippable(trailing)) {
			throw error(lineIndex, "Unexpected content '" + trailing + "' after '}'");
		}
	}

	private static CfgParseException error(int lineIndex, String message) {
		return new CfgParseException("Schema error at line " + (lineIndex + 1) + ": " + message);
	}
}
