package org.javai.ngxconf;

/**
 * The delimiter a parameter was written with.
 */
public enum Quote {
	NONE('\0'),
	DOUBLE('"'),
	SINGLE('\''),
	BACKTICK('`');

	private final char delimiter;

	Quote(char delimiter) {
		this.delimiter = delimiter;
	}

	public char delimiter() {
		return delimiter;
	}

	/**
	 * Returns the quote style for a delimiter character.
	 *
	 * @throws IllegalArgumentException if the character is not a quote delimiter
	 */
	public static Quote of(char delimiter) {
		return switch (delimiter) {
			case '"' -> DOUBLE;
			case '\'' -> SINGLE;
			case '`' -> BACKTICK;
			default -> throw new IllegalArgumentException("Not a quote delimiter: '" + delimiter + "'");
		};
	}

	public static boolean isDelimiter(int c) {
		return c == '"' || c == '\'' || c == '`';
	}
}
