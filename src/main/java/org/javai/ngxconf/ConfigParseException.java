package org.javai.ngxconf;

/**
 * Exception thrown when a configuration document cannot be parsed.
 * Parsing is fail-fast: the first error aborts the whole parse.
 */
public class ConfigParseException extends RuntimeException {

	/**
	 * Which stage rejected the input.
	 */
	public enum ErrorKind {
		/** Malformed characters, e.g. an unterminated quoted string. */
		LEXICAL,
		/** A token where the grammar allows none of parameter, {@code ;} or <code>{</code>. */
		SYNTAX,
		/** A well-formed directive that breaks a typed node's shape rule. */
		SEMANTIC,
		/** The source could not be read. */
		IO
	}

	private final ErrorKind kind;
	private final String detail;
	private final String sourceName;
	private final int line;
	private final int column;

	public ConfigParseException(ErrorKind kind, String detail, String sourceName, int line, int column,
			Throwable cause) {
		super(format(detail, sourceName, line, column), cause);
		this.kind = kind;
		this.detail = detail;
		this.sourceName = sourceName;
		this.line = line;
		this.column = column;
	}

	public static ConfigParseException lexical(String detail, String sourceName, int line, int column) {
		return new ConfigParseException(ErrorKind.LEXICAL, detail, sourceName, line, column, null);
	}

	public static ConfigParseException syntax(String detail, String sourceName, int line, int column) {
		return new ConfigParseException(ErrorKind.SYNTAX, detail, sourceName, line, column, null);
	}

	/**
	 * Semantic error for a directive; the position is taken from the directive when it has one.
	 */
	public static ConfigParseException semantic(String detail, DirectiveNode directive) {
		SourcePosition position = directive.getPosition().orElse(null);
		return new ConfigParseException(ErrorKind.SEMANTIC, detail, null,
				position != null ? position.line() : 0, position != null ? position.column() : 0, null);
	}

	public static ConfigParseException io(String detail, String sourceName, Throwable cause) {
		return new ConfigParseException(ErrorKind.IO, detail, sourceName, 0, 0, cause);
	}

	/**
	 * Returns a copy naming the given source, or this exception if it already names one.
	 */
	public ConfigParseException withSourceName(String name) {
		if (sourceName != null || name == null) {
			return this;
		}
		return new ConfigParseException(kind, detail, name, line, column, getCause());
	}

	public ErrorKind getKind() {
		return kind;
	}

	/**
	 * The message without position information.
	 */
	public String getDetail() {
		return detail;
	}

	public String getSourceName() {
		return sourceName;
	}

	/**
	 * 1-based line of the offending input, or 0 when unknown.
	 */
	public int getLine() {
		return line;
	}

	/**
	 * 1-based column of the offending input, or 0 when unknown.
	 */
	public int getColumn() {
		return column;
	}

	private static String format(String detail, String sourceName, int line, int column) {
		StringBuilder sb = new StringBuilder(detail);
		if (line > 0) {
			sb.append(" at line ").append(line).append(", column ").append(column);
		}
		if (sourceName != null) {
			sb.append(" in ").append(sourceName);
		}
		return sb.toString();
	}
}
