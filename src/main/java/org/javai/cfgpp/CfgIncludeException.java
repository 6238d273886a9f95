package org.javai.cfgpp;

/**
 * An {@code @include} or {@code @import} directive could not be honoured.
 */
public class CfgIncludeException extends CfgParseException {

	private final String path;

	public CfgIncludeException(String path, String message) {
		super("Include error: " + path + " - " + message);
		this.path = path;
	}

	public CfgIncludeException(String path, String message, Throwable cause) {
		super("Include error: " + path + " - " + message, cause);
		this.path = path;
	}

	public String path() {
		return path;
	}
}
