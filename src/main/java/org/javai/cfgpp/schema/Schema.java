package org.javai.cfgpp.schema;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.cfgpp.value.CfgValue;

/**
 * Named enum and object types plus an optional root type, used to validate value trees.
 * <p>
 * A schema is built once, either from schema text via {@link SchemaParser} or through
 * {@link #builder()}, and is read-only afterwards. It holds no state that changes during
 * validation, so one instance can serve any number of concurrent validations.
 *
 * <pre>
 * Schema schema = Schema.builder()
 *     .enumType("Level", "debug", "info")
 *     .field("Logging", "level", FieldDefinition.required(TypeDefinition.enumRef("Level")))
 *     .root(TypeDefinition.objectRef("Logging"))
 *     .build();
 * List&lt;ValidationError&gt; errors = schema.validate(config);
 * </pre>
 */
public final class Schema {

	private final Map<String, List<String>> enums;
	private final Map<String, Map<String, FieldDefinition>> objects;
	private final TypeDefinition root;

	private Schema(Map<String, List<String>> enums, Map<String, Map<String, FieldDefinition>> objects,
			TypeDefinition root) {
		Map<String, List<String>> enumCopy = new LinkedHashMap<>();
		enums.forEach((name, values) -> enumCopy.put(name, List.copyOf(values)));
		Map<String, Map<String, FieldDefinition>> objectCopy = new LinkedHashMap<>();
		objects.forEach((name, fields) ->
				objectCopy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
		this.enums = Collections.unmodifiableMap(enumCopy);
		this.objects = Collections.unmodifiableMap(objectCopy);
		this.root = root;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Parses schema text.
	 *
	 * @see SchemaParser
	 */
	public static Schema parse(String schemaText) {
		return new SchemaParser().parseString(schemaText);
	}

	/**
	 * Parses a UTF-8 schema file.
	 *
	 * @see SchemaParser
	 */
	public static Schema parseFile(Path path) {
		return new SchemaParser().parse(path);
	}

	public Optional<TypeDefinition> root() {
		return Optional.ofNullable(root);
	}

	/**
	 * A copy of this schema whose root type is {@code rootType}.
	 */
	public Schema withRoot(TypeDefinition rootType) {
		return new Schema(enums, objects, rootType);
	}

	public Map<String, List<String>> enums() {
		return enums;
	}

	public Map<String, Map<String, FieldDefinition>> objects() {
		return objects;
	}

	public Optional<List<String>> enumValues(String name) {
		return Optional.ofNullable(enums.get(name));
	}

	public Optional<Map<String, FieldDefinition>> objectFields(String name) {
		return Optional.ofNullable(objects.get(name));
	}

	public boolean hasEnum(String name) {
		return enums.containsKey(name);
	}

	public boolean hasObject(String name) {
		return objects.containsKey(name);
	}

	/**
	 * Validates a value against the root type, or only walks its structure when there
	 * is no root type. Custom constraints pass.
	 *
	 * @return every error found; empty when the value is valid
	 */
	public List<ValidationError> validate(CfgValue value) {
		return new SchemaValidator(this).validate(value);
	}

	/**
	 * @throws SchemaValidationException listing every error when the value is invalid
	 */
	public void validateOrThrow(CfgValue value) {
		new SchemaValidator(this).validateOrThrow(value);
	}

	/**
	 * Copy of {@code value} with declared defaults filled in for absent fields.
	 *
	 * @see SchemaValidator#applyDefaults(CfgValue)
	 */
	public CfgValue applyDefaults(CfgValue value) {
		return new SchemaValidator(this).applyDefaults(value);
	}

	@Override
	public String toString() {
		return "Schema[enums=" + enums.keySet() + ", objects=" + objects.keySet()
				+ ", root=" + (root != null ? root.describe() : "none") + "]";
	}

	public static final class Builder {
		private final Map<String, List<String>> enums = new LinkedHashMap<>();
		private final Map<String, Map<String, FieldDefinition>> objects = new LinkedHashMap<>();
		private TypeDefinition root;

		private Builder() {
		}

		/**
		 * Declares an enum; a later declaration with the same name replaces it.
		 */
		public Builder enumType(String name, List<String> values) {
			Objects.requireNonNull(name, "name must not be null");
			enums.put(name, new ArrayList<>(values));
			return this;
		}

		public Builder enumType(String name, String... values) {
			return enumType(name, Arrays.asList(values));
		}

		/**
		 * Declares an object schema; a later declaration with the same name replaces it.
		 */
		public Builder objectType(String name, Map<String, FieldDefinition> fields) {
			Objects.requireNonNull(name, "name must not be null");
			objects.put(name, new LinkedHashMap<>(fields));
			return this;
		}

		/**
		 * Adds one field to an object schema, declaring the object if needed.
		 */
		public Builder field(String objectName, String fieldName, FieldDefinition definition) {
			Objects.requireNonNull(objectName, "objectName must not be null");
			Objects.requireNonNull(fieldName, "fieldName must not be null");
			Objects.requireNonNull(definition, "definition must not be null");
			objects.computeIfAbsent(objectName, k -> new LinkedHashMap<>()).put(fieldName, definition);
			return this;
		}

		public Builder root(TypeDefinition root) {
			this.root = root;
			return this;
		}

		public Schema build() {
			return new Schema(enums, objects, root);
		}
	}
}
