package org.javai.ngxconf.parser;

/**
 * The kinds of token the {@link ConfigTokenizer} emits.
 */
public enum TokenKind {
	END_OF_INPUT,
	KEYWORD,
	SEMICOLON,
	BLOCK_START,
	BLOCK_END,
	COMMENT,
	VARIABLE,
	QUOTED_STRING;

	/**
	 * Whether a token of this kind can be a directive parameter.
	 */
	public boolean isParameterEligible() {
		return this == KEYWORD || this == VARIABLE || this == QUOTED_STRING;
	}
}
