package org.javai.cfgpp.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.cfgpp.value.CfgValue;
import org.junit.jupiter.api.Test;

class TypeDefinitionTest {

	@Test
	void describeUsesSchemaSpelling() {
		TypeDefinition type = TypeDefinition.optional(TypeDefinition.arrayOf(
				TypeDefinition.union(TypeDefinition.objectRef("Server"), TypeDefinition.stringType())));

		assertThat(type.describe()).isEqualTo("optional<array<union<Server|string>>>");
		assertThat(TypeDefinition.nullType().describe()).isEqualTo("null");
		assertThat(TypeDefinition.enumRef("Level").describe()).isEqualTo("Level");
	}

	@Test
	void unionNeedsMembers() {
		assertThatThrownBy(() -> new TypeDefinition.UnionType(List.of()))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void fieldDefinitionIsImmutable() {
		FieldDefinition base = FieldDefinition.optional(TypeDefinition.integerType());
		FieldDefinition constrained = base.withConstraint(new Constraint.MinValue(0))
				.withDefault(CfgValue.of(1L));

		assertThat(base.constraints()).isEmpty();
		assertThat(base.defaultValueIfAny()).isEmpty();
		assertThat(constrained.constraints()).containsExactly(new Constraint.MinValue(0));
		assertThat(constrained.defaultValueIfAny()).contains(CfgValue.of(1L));
		assertThat(constrained.required()).isFalse();
	}

	@Test
	void validationErrorToString() {
		ValidationError error = ValidationError.of("servers[0].port", "Value 0 is less than minimum 1");

		assertThat(error).hasToString("Validation error at 'servers[0].port': Value 0 is less than minimum 1");
		assertThat(error.expected()).isEmpty();
	}
}
