package org.javai.cfgpp;

public class CfgKeyNotFoundException extends CfgException {

	private final String key;

	public CfgKeyNotFoundException(String key) {
		super("Key not found: " + key);
		this.key = key;
	}

	public String key() {
		return key;
	}
}
