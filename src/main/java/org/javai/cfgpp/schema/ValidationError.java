package org.javai.cfgpp.schema;

import java.util.Optional;

/**
 * One mismatch found while validating a value tree.
 *
 * @param path locator of the offending value, e.g. {@code servers[1].port}; empty for the root
 * @param message what is wrong
 * @param expectedType the type the schema asked for, or null
 * @param actualType the kind of value found, or null
 */
public record ValidationError(String path, String message, String expectedType, String actualType) {

	public static ValidationError of(String path, String message) {
		return new ValidationError(path, message, null, null);
	}

	public Optional<String> expected() {
		return Optional.ofNullable(expectedType);
	}

	public Optional<String> actual() {
		return Optional.ofNullable(actualType);
	}

	@Override
	public String toString() {
		return "Validation error at '" + path + "': " + message;
	}
}
