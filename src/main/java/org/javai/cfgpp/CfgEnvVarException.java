package org.javai.cfgpp;

/**
 * A {@code ${NAME}} reference named a variable that is not set and carries no default.
 */
public class CfgEnvVarException extends CfgParseException {

	private final String variable;

	public CfgEnvVarException(String variable, String message) {
		super("Environment variable error: " + variable + " - " + message);
		this.variable = variable;
	}

	public String variable() {
		return variable;
	}
}
