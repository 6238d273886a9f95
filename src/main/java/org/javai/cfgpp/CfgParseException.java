package org.javai.cfgpp;

/**
 * Exception thrown when CFG++ or schema text cannot be turned into a value.
 */
public class CfgParseException extends CfgException {

	public CfgParseException(String message) {
		super(message);
	}

	public CfgParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
