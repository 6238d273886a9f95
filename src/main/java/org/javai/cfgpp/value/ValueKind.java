package org.javai.cfgpp.value;

/**
 * The variants a {@link CfgValue} can take.
 */
public enum ValueKind {
	NULL("null"),
	BOOLEAN("boolean"),
	INTEGER("integer"),
	DOUBLE("double"),
	STRING("string"),
	ENUM("enum"),
	ARRAY("array"),
	OBJECT("object");

	private final String typeName;

	ValueKind(String typeName) {
		this.typeName = typeName;
	}

	/**
	 * Lower-case name used in diagnostics, e.g. {@code "integer"}.
	 */
	public String typeName() {
		return typeName;
	}
}
