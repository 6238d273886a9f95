package org.javai.cfgpp;

/**
 * Reading configuration or schema content from the file system failed.
 */
public class CfgIoException extends CfgException {

	public CfgIoException(String message, Throwable cause) {
		super("I/O error: " + message, cause);
	}
}
