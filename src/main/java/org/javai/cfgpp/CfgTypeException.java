package org.javai.cfgpp;

/**
 * A value was used as a kind of container it is not.
 */
public class CfgTypeException extends CfgException {

	private final String expected;
	private final String actual;

	public CfgTypeException(String expected, String actual) {
		super("Type error: expected " + expected + ", found " + actual);
		this.expected = expected;
		this.actual = actual;
	}

	public String expected() {
		return expected;
	}

	public String actual() {
		return actual;
	}
}
