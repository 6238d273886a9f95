package org.javai.cfgpp.schema;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The type a schema expects at some position of a value tree.
 * Sealed to ensure all type forms are known to the validator.
 * <p>
 * {@link #describe()} yields the schema-text spelling of the type
 * ({@code array<string>}, {@code optional<Port>}, {@code union<string|integer>}),
 * which is also what validation errors report as the expected type.
 */
public sealed interface TypeDefinition {

	String describe();

	static TypeDefinition nullType() {
		return Primitive.NULL;
	}

	static TypeDefinition booleanType() {
		return Primitive.BOOLEAN;
	}

	static TypeDefinition integerType() {
		return Primitive.INTEGER;
	}

	static TypeDefinition doubleType() {
		return Primitive.DOUBLE;
	}

	static TypeDefinition stringType() {
		return Primitive.STRING;
	}

	static TypeDefinition arrayOf(TypeDefinition element) {
		return new ArrayType(element);
	}

	static TypeDefinition objectRef(String name) {
		return new ObjectRef(name);
	}

	static TypeDefinition enumRef(String name) {
		return new EnumRef(name);
	}

	static TypeDefinition union(TypeDefinition... members) {
		return new UnionType(List.of(members));
	}

	static TypeDefinition optional(TypeDefinition inner) {
		return new OptionalType(inner);
	}

	/**
	 * Null, boolean, integer, double and string. Matching is exact: an integer
	 * value never satisfies {@link #DOUBLE} and vice versa.
	 */
	enum Primitive implements TypeDefinition {
		NULL("null"),
		BOOLEAN("boolean"),
		INTEGER("integer"),
		DOUBLE("double"),
		STRING("string");

		private final String keyword;

		Primitive(String keyword) {
			this.keyword = keyword;
		}

		@Override
		public String describe() {
			return keyword;
		}
	}

	/**
	 * Every element must match {@code element}.
	 */
	record ArrayType(TypeDefinition element) implements TypeDefinition {
		public ArrayType {
			Objects.requireNonNull(element, "element type must not be null");
		}

		@Override
		public String describe() {
			return "array<" + element.describe() + ">";
		}
	}

	/**
	 * Reference to a named object schema. Schema text also produces this for
	 * enum names; the validator resolves such references to the enum.
	 */
	record ObjectRef(String name) implements TypeDefinition {
		public ObjectRef {
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public String describe() {
			return name;
		}
	}

	record EnumRef(String name) implements TypeDefinition {
		public EnumRef {
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public String describe() {
			return name;
		}
	}

	/**
	 * Satisfied by the first member, in order, that the value matches.
	 */
	record UnionType(List<TypeDefinition> members) implements TypeDefinition {
		public UnionType {
			members = List.copyOf(members);
			if (members.isEmpty()) {
				throw new IllegalArgumentException("A union needs at least one member type");
			}
		}

		@Override
		public String describe() {
			return members.stream().map(TypeDefinition::describe).collect(Collectors.joining("|", "union<", ">"));
		}
	}

	/**
	 * Null, or a value of {@code inner}.
	 */
	record OptionalType(TypeDefinition inner) implements TypeDefinition {
		public OptionalType {
			Objects.requireNonNull(inner, "inner type must not be null");
		}

		@Override
		public String describe() {
			return "optional<" + inner.describe() + ">";
		}
	}
}
