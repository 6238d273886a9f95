package org.javai.cfgpp;

import java.util.Map;
import java.util.Optional;

/**
 * Source of values for {@code ${NAME}} references.
 * <p>
 * The parser never reads the process environment directly; it asks the lookup it
 * was given, so tests can substitute a fixed map.
 */
@FunctionalInterface
public interface EnvironmentLookup {

	/**
	 * @param name the variable name, without {@code ${}} and without any default part
	 * @return the variable's value, or empty when it is not set
	 */
	Optional<String> lookup(String name);

	/**
	 * Reads the environment of the running process.
	 */
	static EnvironmentLookup system() {
		return name -> Optional.ofNullable(System.getenv(name));
	}

	/**
	 * Serves variables from a fixed map.
	 */
	static EnvironmentLookup of(Map<String, String> variables) {
		Map<String, String> copy = Map.copyOf(variables);
		return name -> Optional.ofNullable(copy.get(name));
	}
}
