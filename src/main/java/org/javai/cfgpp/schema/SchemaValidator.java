package org.javai.cfgpp.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.cfgpp.schema.TypeDefinition.ArrayType;
import org.javai.cfgpp.schema.TypeDefinition.EnumRef;
import org.javai.cfgpp.schema.TypeDefinition.ObjectRef;
import org.javai.cfgpp.schema.TypeDefinition.OptionalType;
import org.javai.cfgpp.schema.TypeDefinition.Primitive;
import org.javai.cfgpp.schema.TypeDefinition.UnionType;
import org.javai.cfgpp.value.CfgValue;
import org.javai.cfgpp.value.CfgValue.ArrayValue;
import org.javai.cfgpp.value.CfgValue.DoubleValue;
import org.javai.cfgpp.value.CfgValue.EnumValue;
import org.javai.cfgpp.value.CfgValue.IntegerValue;
import org.javai.cfgpp.value.CfgValue.ObjectValue;
import org.javai.cfgpp.value.ValueKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks value trees against a {@link Schema}.
 * <p>
 * Validation never stops at the first problem: every mismatch in the tree is
 * collected and returned, and an empty list means the value is valid. Object
 * schemas are closed, so keys that a schema does not declare are reported.
 * Constraints are only checked on values whose type already matched.
 * <p>
 * This class is stateless apart from its schema and registry; one instance may be
 * used by several threads.
 */
public class SchemaValidator {

	private static final Logger logger = LoggerFactory.getLogger(SchemaValidator.class);

	private final Schema schema;
	private final CustomConstraintRegistry registry;

	public SchemaValidator(Schema schema) {
		this(schema, CustomConstraintRegistry.NONE);
	}

	/**
	 * @param schema the schema to validate against
	 * @param registry handlers for {@link Constraint.Custom} constraints
	 */
	public SchemaValidator(Schema schema, CustomConstraintRegistry registry) {
		if (schema == null) {
			throw new IllegalArgumentException("Schema cannot be null");
		}
		if (registry == null) {
			throw new IllegalArgumentException("CustomConstraintRegistry cannot be null");
		}
		this.schema = schema;
		this.registry = registry;
	}

	/**
	 * Validates against the schema's root type. Without a root type only the
	 * structure is walked and every leaf passes.
	 *
	 * @return every error found, in tree order; empty when the value is valid
	 */
	public List<ValidationError> validate(CfgValue value) {
		Objects.requireNonNull(value, "value must not be null");
		List<ValidationError> errors = new ArrayList<>();
		Optional<TypeDefinition> root = schema.root();
		if (root.isPresent()) {
			validateType(value, root.get(), "", errors);
		} else {
			walkStructure(value, "", errors);
		}
		logger.debug("Validated {} against {}: {} error(s)", value.typeName(),
				root.map(TypeDefinition::describe).orElse("structure only"), errors.size());
		return errors;
	}

	/**
	 * Validates one value against one field definition: type first, then constraints.
	 *
	 * @param path locator used in the reported errors
	 */
	public List<ValidationError> validateField(CfgValue value, FieldDefinition field, String path) {
		Objects.requireNonNull(value, "value must not be null");
		Objects.requireNonNull(field, "field must not be null");
		List<ValidationError> errors = new ArrayList<>();
		validateFieldValue(value, field, path != null ? path : "", errors);
		return errors;
	}

	/**
	 * @throws SchemaValidationException with every error when the value is invalid
	 */
	public void validateOrThrow(CfgValue value) {
		List<ValidationError> errors = validate(value);
		if (!errors.isEmpty()) {
			throw new SchemaValidationException(errors);
		}
	}

	/**
	 * Returns a deep copy of {@code value} in which every absent field that declares
	 * a default holds a copy of that default. Defaults are applied along the root type
	 * through objects, arrays and optionals; union members are not entered. The
	 * argument is left untouched.
	 */
	public CfgValue applyDefaults(CfgValue value) {
		Objects.requireNonNull(value, "value must not be null");
		CfgValue copy = value.copy();
		schema.root().ifPresent(root -> fillDefaults(copy, root));
		return copy;
	}

	private void validateType(CfgValue value, TypeDefinition type, String path, List<ValidationError> errors) {
		if (type instanceof Primitive primitive) {
			if (!matches(value, primitive)) {
				errors.add(mismatch(value, type, path));
			}
		} else if (type instanceof ArrayType arrayType) {
			validateArray(value, arrayType, path, errors);
		} else if (type instanceof ObjectRef ref) {
			validateNamed(value, ref, path, errors);
		} else if (type instanceof EnumRef ref) {
			validateEnum(value, ref.name(), path, errors);
		} else if (type instanceof UnionType union) {
			validateUnion(value, union, path, errors);
		} else if (type instanceof OptionalType optional) {
			if (!value.isNull()) {
				validateType(value, optional.inner(), path, errors);
			}
		}
	}

	private static boolean matches(CfgValue value, Primitive primitive) {
		return switch (primitive) {
			case NULL -> value.is(ValueKind.NULL);
			case BOOLEAN -> value.is(ValueKind.BOOLEAN);
			case INTEGER -> value.is(ValueKind.INTEGER);
			case DOUBLE -> value.is(ValueKind.DOUBLE);
			case STRING -> value.is(ValueKind.STRING);
		};
	}

	private void validateArray(CfgValue value, ArrayType type, String path, List<ValidationError> errors) {
		if (!(value instanceof ArrayValue array)) {
			errors.add(mismatch(value, type, path));
			return;
		}
		List<CfgValue> elements = array.elements();
		for (int i = 0; i < elements.size(); i++) {
			validateType(elements.get(i), type.element(), path + "[" + i + "]", errors);
		}
	}

	/**
	 * Schema text cannot tell object and enum names apart, so a reference resolves to
	 * the object schema of that name if there is one, and otherwise to the enum.
	 */
	private void validateNamed(CfgValue value, ObjectRef ref, String path, List<ValidationError> errors) {
		Optional<Map<String, FieldDefinition>> fields = schema.objectFields(ref.name());
		if (fields.isPresent()) {
			validateObject(value, ref, fields.get(), path, errors);
		} else if (schema.hasEnum(ref.name())) {
			validateEnum(value, ref.name(), path, errors);
		} else {
			errors.add(new ValidationError(path, "Unknown object schema '" + ref.name() + "'",
					ref.describe(), value.typeName()));
		}
	}

	private void validateObject(CfgValue value, ObjectRef ref, Map<String, FieldDefinition> fields, String path,
			List<ValidationError> errors) {
		if (!(value instanceof ObjectValue object)) {
			errors.add(mismatch(value, ref, path));
			return;
		}

		for (Map.Entry<String, FieldDefinition> entry : fields.entrySet()) {
			String fieldName = entry.getKey();
			FieldDefinition field = entry.getValue();
			String fieldPath = childPath(path, fieldName);
			Optional<CfgValue> fieldValue = object.get(fieldName);
			if (fieldValue.isPresent()) {
				validateFieldValue(fieldValue.get(), field, fieldPath, errors);
			} else if (field.required()) {
				errors.add(new ValidationError(fieldPath, "Required field '" + fieldName + "' is missing",
						field.type().describe(), null));
			}
		}

		for (Map.Entry<String, CfgValue> entry : object.entries().entrySet()) {
			if (!fields.containsKey(entry.getKey())) {
				errors.add(new ValidationError(childPath(path, entry.getKey()),
						"Unexpected field '" + entry.getKey() + "'", null, entry.getValue().typeName()));
			}
		}
	}

	private void validateEnum(CfgValue value, String enumName, String path, List<ValidationError> errors) {
		Optional<List<String>> allowed = schema.enumValues(enumName);
		if (allowed.isEmpty()) {
			errors.add(new ValidationError(path, "Unknown enum type '" + enumName + "'", enumName, value.typeName()));
			return;
		}
		if (!(value instanceof EnumValue enumValue)) {
			errors.add(new ValidationError(path,
					"Type mismatch: expected enum " + enumName + ", found " + value.typeName(),
					enumName, value.typeName()));
			return;
		}
		if (!allowed.get().contains(enumValue.value())) {
			errors.add(new ValidationError(path,
					"Invalid enum value '" + enumValue.value() + "', expected one of: " + String.join(", ", allowed.get()),
					enumName, value.typeName()));
		}
	}

	private void validateUnion(CfgValue value, UnionType union, String path, List<ValidationError> errors) {
		for (TypeDefinition member : union.members()) {
			List<ValidationError> memberErrors = new ArrayList<>();
			validateType(value, member, path, memberErrors);
			if (memberErrors.isEmpty()) {
				return;
			}
		}
		errors.add(new ValidationError(path,
				"Value of type " + value.typeName() + " does not match any type in " + union.describe(),
				union.describe(), value.typeName()));
	}

	private void validateFieldValue(CfgValue value, FieldDefinition field, String path,
			List<ValidationError> errors) {
		int before = errors.size();
		validateType(value, field.type(), path, errors);
		if (errors.size() != before) {
			return;
		}
		for (Constraint constraint : field.constraints()) {
			checkConstraint(value, constraint, path, errors);
		}
	}

	private void checkConstraint(CfgValue value, Constraint constraint, String path, List<ValidationError> errors) {
		if (constraint instanceof Constraint.MinLength min) {
			value.asString().ifPresent(text -> {
				int length = text.codePointCount(0, text.length());
				if (length < min.length()) {
					errors.add(ValidationError.of(path,
							"String length " + length + " is less than minimum " + min.length()));
				}
			});
		} else if (constraint instanceof Constraint.MaxLength max) {
			value.asString().ifPresent(text -> {
				int length = text.codePointCount(0, text.length());
				if (length > max.length()) {
					errors.add(ValidationError.of(path,
							"String length " + length + " exceeds maximum " + max.length()));
				}
			});
		} else if (constraint instanceof Constraint.MinValue min) {
			numeric(value).ifPresent(number -> {
				if (number < min.value()) {
					errors.add(ValidationError.of(path,
							"Value " + value + " is less than minimum " + formatBound(min.value())));
				}
			});
		} else if (constraint instanceof Constraint.MaxValue max) {
			numeric(value).ifPresent(number -> {
				if (number > max.value()) {
					errors.add(ValidationError.of(path,
							"Value " + value + " exceeds maximum " + formatBound(max.value())));
				}
			});
		} else if (constraint instanceof Constraint.PatternMatch match) {
			value.asString().ifPresent(text -> {
				if (!match.pattern().matcher(text).matches()) {
					errors.add(ValidationError.of(path,
							"String '" + text + "' does not match pattern " + match.pattern().pattern()));
				}
			});
		} else if (constraint instanceof Constraint.Custom custom) {
			CustomConstraintHandler handler = registry.getHandler(custom.name());
			if (handler != null) {
				handler.check(value).ifPresent(message -> errors.add(ValidationError.of(path,
						"Custom constraint '" + custom.name() + "' failed: " + message)));
			}
		}
	}

	private void fillDefaults(CfgValue value, TypeDefinition type) {
		if (type instanceof OptionalType optional) {
			if (!value.isNull()) {
				fillDefaults(value, optional.inner());
			}
		} else if (type instanceof ArrayType arrayType && value instanceof ArrayValue array) {
			array.elements().forEach(element -> fillDefaults(element, arrayType.element()));
		} else if (type instanceof ObjectRef ref && value instanceof ObjectValue object) {
			schema.objectFields(ref.name()).ifPresent(fields -> fields.forEach((name, field) -> {
				if (object.get(name).isEmpty() && field.defaultValue() != null) {
					object.set(name, field.defaultValue().copy());
				}
				object.get(name).ifPresent(child -> fillDefaults(child, field.type()));
			}));
		}
	}

	private static Optional<Double> numeric(CfgValue value) {
		if (value instanceof IntegerValue integer) {
			return Optional.of((double) integer.value());
		}
		if (value instanceof DoubleValue number) {
			return Optional.of(number.value());
		}
		return Optional.empty();
	}

	private static String formatBound(double bound) {
		if (bound == Math.rint(bound) && !Double.isInfinite(bound) && Math.abs(bound) < 1e15) {
			return Long.toString((long) bound);
		}
		return Double.toString(bound);
	}

	private static ValidationError mismatch(CfgValue value, TypeDefinition expected, String path) {
		return new ValidationError(path,
				"Type mismatch: expected " + expected.describe() + ", found " + value.typeName(),
				expected.describe(), value.typeName());
	}

	private static String childPath(String parent, String name) {
		return parent.isEmpty() ? name : parent + "." + name;
	}

	/**
	 * Without a root type there is nothing to check: containers are visited and
	 * every leaf passes.
	 */
	private static void walkStructure(CfgValue value, String path, List<ValidationError> errors) {
		if (value instanceof ObjectValue object) {
			object.entries().forEach((key, child) -> walkStructure(child, childPath(path, key), errors));
		} else if (value instanceof ArrayValue array) {
			List<CfgValue> elements = array.elements();
			for (int i = 0; i < elements.size(); i++) {
				walkStructure(elements.get(i), path + "[" + i + "]", errors);
			}
		}
	}
}
