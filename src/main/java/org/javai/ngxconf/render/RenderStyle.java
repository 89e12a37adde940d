package org.javai.ngxconf.render;

import java.util.Objects;

/**
 * Formatting options for {@link ConfigRenderer}.
 *
 * @param indent spaces added per nesting level
 * @param startIndent spaces in front of top-level nodes
 * @param bracePlacement where opening braces go (ignored in compact output)
 * @param compact render everything on one line, separated by single spaces
 */
public record RenderStyle(int indent, int startIndent, BracePlacement bracePlacement, boolean compact) {

	/** Four spaces per level, brace on the directive's line. */
	public static final RenderStyle INDENTED = new RenderStyle(4, 0, BracePlacement.SAME_LINE, false);

	/** Two spaces per level, brace on the directive's line. */
	public static final RenderStyle TWO_SPACE = new RenderStyle(2, 0, BracePlacement.SAME_LINE, false);

	/** One node per line without indentation. */
	public static final RenderStyle NO_INDENT = new RenderStyle(0, 0, BracePlacement.SAME_LINE, false);

	/** Four spaces per level, opening brace on its own line. */
	public static final RenderStyle ALLMAN = new RenderStyle(4, 0, BracePlacement.NEXT_LINE, false);

	/** Everything on a single line. */
	public static final RenderStyle COMPACT = new RenderStyle(0, 0, BracePlacement.SAME_LINE, true);

	public RenderStyle {
		if (indent < 0) {
			throw new IllegalArgumentException("indent must not be negative: " + indent);
		}
		if (startIndent < 0) {
			throw new IllegalArgumentException("startIndent must not be negative: " + startIndent);
		}
		Objects.requireNonNull(bracePlacement, "bracePlacement must not be null");
	}

	public RenderStyle withIndent(int indent) {
		return new RenderStyle(indent, startIndent, bracePlacement, compact);
	}

	public RenderStyle withStartIndent(int startIndent) {
		return new RenderStyle(indent, startIndent, bracePlacement, compact);
	}

	public RenderStyle withBracePlacement(BracePlacement bracePlacement) {
		return new RenderStyle(indent, startIndent, bracePlacement, compact);
	}
}
