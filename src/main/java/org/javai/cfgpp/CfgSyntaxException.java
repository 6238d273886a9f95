package org.javai.cfgpp;

/**
 * A lexical or grammar violation at a known source position.
 */
public class CfgSyntaxException extends CfgParseException {

	private final String detail;
	private final int line;
	private final int column;

	public CfgSyntaxException(String detail, int line, int column) {
		super("Syntax error at line " + line + ", column " + column + ": " + detail);
		this.detail = detail;
		this.line = line;
		this.column = column;
	}

	/**
	 * The message without the position prefix.
	 */
	public String detail() {
		return detail;
	}

	public int line() {
		return line;
	}

	public int column() {
		return column;
	}
}
