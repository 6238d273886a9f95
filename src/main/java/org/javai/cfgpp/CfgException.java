package org.javai.cfgpp;

/**
 * Root of all failures raised while reading or navigating CFG++ configuration.
 */
public class CfgException extends RuntimeException {

	public CfgException(String message) {
		super(message);
	}

	public CfgException(String message, Throwable cause) {
		super(message, cause);
	}
}
