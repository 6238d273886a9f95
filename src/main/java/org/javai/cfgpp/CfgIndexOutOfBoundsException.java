package org.javai.cfgpp;

public class CfgIndexOutOfBoundsException extends CfgException {

	private final int index;

	public CfgIndexOutOfBoundsException(int index) {
		super("Index out of bounds: " + index);
		this.index = index;
	}

	public int index() {
		return index;
	}
}
