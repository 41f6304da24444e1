package com.panorama.converter.parser.exception;

/**
 * Raised when a configuration document cannot be read or is not well-formed.
 * Always fatal for the run that triggered it.
 */
public class ParseException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String source;
	private final int line;
	private final int column;

	public ParseException(String source, String message, Throwable cause) {
		this(source, -1, -1, message, cause);
	}

	public ParseException(String source, int line, int column, String message, Throwable cause) {
		super(format(source, line, column, message), cause);
		this.source = source;
		this.line = line;
		this.column = column;
	}

	public String getSource() {
		return source;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	private static String format(String source, int line, int column, String message) {
		StringBuilder sb = new StringBuilder("Failed to parse ").append(source);
		if (line > 0) {
			sb.append(" at line ").append(line);
			if (column > 0) {
				sb.append(", column ").append(column);
			}
		}
		return sb.append(": ").append(message).toString();
	}
}
