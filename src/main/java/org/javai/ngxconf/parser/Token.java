package org.javai.ngxconf.parser;

import org.javai.ngxconf.Parameter;
import org.javai.ngxconf.Quote;
import org.javai.ngxconf.SourcePosition;

/**
 * A token read from a configuration source.
 *
 * @param kind the token kind
 * @param literal the token text; for quoted strings the decoded content without delimiters
 * @param quote the delimiter of a quoted string, {@link Quote#NONE} for every other kind
 * @param line the 1-based line the token starts on
 * @param column the 1-based column the token starts at
 */
public record Token(TokenKind kind, String literal, Quote quote, int line, int column) {

	public Token(TokenKind kind, String literal, int line, int column) {
		this(kind, literal, Quote.NONE, line, column);
	}

	public boolean isKind(TokenKind expected) {
		return kind == expected;
	}

	public SourcePosition position() {
		return new SourcePosition(line, column);
	}

	public Parameter toParameter() {
		return new Parameter(literal, quote);
	}

	@Override
	public String toString() {
		return switch (kind) {
			case QUOTED_STRING -> "QUOTED_STRING(" + quote.delimiter() + literal + quote.delimiter() + ")";
			case END_OF_INPUT -> "END_OF_INPUT";
			default -> kind + "(" + literal + ")";
		};
	}
}
