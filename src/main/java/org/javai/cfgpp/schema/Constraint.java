package org.javai.cfgpp.schema;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A restriction on a field value that already has the right type.
 */
public sealed interface Constraint {

	/**
	 * Minimum number of characters (code points) of a string or enum text.
	 */
	record MinLength(int length) implements Constraint {
	}

	/**
	 * Maximum number of characters (code points) of a string or enum text.
	 */
	record MaxLength(int length) implements Constraint {
	}

	/**
	 * Lower bound for integer and double values, compared as doubles.
	 */
	record MinValue(double value) implements Constraint {
	}

	/**
	 * Upper bound for integer and double values, compared as doubles.
	 */
	record MaxValue(double value) implements Constraint {
	}

	/**
	 * The whole text must match the regular expression.
	 */
	record PatternMatch(Pattern pattern) implements Constraint {
		public PatternMatch {
			Objects.requireNonNull(pattern, "pattern must not be null");
		}

		public static PatternMatch of(String regex) {
			return new PatternMatch(Pattern.compile(regex));
		}
	}

	/**
	 * A named hook evaluated by a {@link CustomConstraintHandler} registered under
	 * the same name. Without a handler the constraint always passes.
	 */
	record Custom(String name) implements Constraint {
		public Custom {
			Objects.requireNonNull(name, "name must not be null");
		}
	}
}
