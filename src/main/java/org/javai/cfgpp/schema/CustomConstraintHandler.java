package org.javai.cfgpp.schema;

import java.util.Optional;
import org.javai.cfgpp.value.CfgValue;

/**
 * Host-supplied check behind a {@link Constraint.Custom} constraint.
 */
@FunctionalInterface
public interface CustomConstraintHandler {

	/**
	 * @param value the field value, already known to match the field type
	 * @return a message describing the violation, or empty when the value is acceptable
	 */
	Optional<String> check(CfgValue value);
}
