package org.javai.ngxconf;

import java.util.Objects;

/**
 * One directive parameter: its decoded value and the delimiter it was written with.
 *
 * @param value the decoded value (never null)
 * @param quote the original delimiter, {@link Quote#NONE} for bare words and variables
 */
public record Parameter(String value, Quote quote) {

	public Parameter {
		Objects.requireNonNull(value, "value must not be null");
		Objects.requireNonNull(quote, "quote must not be null");
	}

	/**
	 * Creates a bare parameter, quoting it with double quotes when the bare form
	 * would not read back as a single parameter.
	 */
	public static Parameter of(String value) {
		Objects.requireNonNull(value, "value must not be null");
		return new Parameter(value, needsQuoting(value) ? Quote.DOUBLE : Quote.NONE);
	}

	public static Parameter quoted(String value, Quote quote) {
		return new Parameter(value, quote);
	}

	public boolean isQuoted() {
		return quote != Quote.NONE;
	}

	private static boolean needsQuoting(String value) {
		if (value.isEmpty()) {
			return true;
		}
		char first = value.charAt(0);
		if (Quote.isDelimiter(first) || first == '#' || first == '}') {
			return true;
		}
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == ';' || c == '{') {
				return true;
			}
		}
		return false;
	}

	@Override
	public String toString() {
		return isQuoted() ? quote.delimiter() + value + quote.delimiter() : value;
	}
}
