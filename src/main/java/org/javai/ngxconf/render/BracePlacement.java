package org.javai.ngxconf.render;

/**
 * Where the opening brace of a block goes.
 */
public enum BracePlacement {
	/** {@code name params {} */
	SAME_LINE,
	/** The brace on its own line, aligned with the directive name. */
	NEXT_LINE
}
