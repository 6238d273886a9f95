package org.javai.cfgpp.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.cfgpp.value.CfgValue;

/**
 * Declaration of one field of an object schema.
 *
 * @param type the expected type of the field value
 * @param required whether leaving the field out is an error
 * @param defaultValue value filled in by {@link Schema#applyDefaults(CfgValue)}; may be null
 * @param constraints checks applied once the type matches
 */
public record FieldDefinition(
		TypeDefinition type,
		boolean required,
		CfgValue defaultValue,
		List<Constraint> constraints
) {

	public FieldDefinition {
		Objects.requireNonNull(type, "type must not be null");
		constraints = constraints != null ? List.copyOf(constraints) : List.of();
	}

	public static FieldDefinition required(TypeDefinition type) {
		return new FieldDefinition(type, true, null, List.of());
	}

	public static FieldDefinition optional(TypeDefinition type) {
		return new FieldDefinition(type, false, null, List.of());
	}

	public FieldDefinition withConstraint(Constraint constraint) {
		List<Constraint> extended = new ArrayList<>(constraints);
		extended.add(Objects.requireNonNull(constraint, "constraint must not be null"));
		return new FieldDefinition(type, required, defaultValue, extended);
	}

	public FieldDefinition withDefault(CfgValue value) {
		return new FieldDefinition(type, required, value, constraints);
	}

	public Optional<CfgValue> defaultValueIfAny() {
		return Optional.ofNullable(defaultValue);
	}
}
