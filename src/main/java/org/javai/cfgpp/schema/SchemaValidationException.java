package org.javai.cfgpp.schema;

import java.util.List;
import java.util.stream.Collectors;
import org.javai.cfgpp.CfgException;

/**
 * Carries every error of a failed validation, for callers that prefer an exception
 * to inspecting the returned list.
 */
public class SchemaValidationException extends CfgException {

	private final List<ValidationError> errors;

	public SchemaValidationException(List<ValidationError> errors) {
		super(summarize(errors));
		this.errors = List.copyOf(errors);
	}

	public List<ValidationError> errors() {
		return errors;
	}

	private static String summarize(List<ValidationError> errors) {
		return errors.size() + " schema validation error(s): "
				+ errors.stream().map(ValidationError::toString).collect(Collectors.joining("; "));
	}
}
