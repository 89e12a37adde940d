package org.javai.ngxconf.parser;

/**
 * Options for a parse.
 *
 * @param strict when true, a token between statements that cannot start one
 *               (a stray {@code ;}, quoted string, variable or <code>{</code>) is a syntax
 *               error; when false it is skipped with a warning
 * @param preserveComments whether comments become {@link org.javai.ngxconf.Comment} nodes
 * @param maxDepth how many blocks may be nested inside each other; deeper input is a syntax error
 */
public record ParserSettings(boolean strict, boolean preserveComments, int maxDepth) {

	public static final int DEFAULT_MAX_DEPTH = 512;

	/** Lenient, keeps comments. */
	public static final ParserSettings DEFAULTS = new ParserSettings(false, true, DEFAULT_MAX_DEPTH);

	/** Strict, keeps comments. */
	public static final ParserSettings STRICT = new ParserSettings(true, true, DEFAULT_MAX_DEPTH);

	public ParserSettings {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
		}
	}

	public ParserSettings withStrict(boolean strict) {
		return new ParserSettings(strict, preserveComments, maxDepth);
	}

	public ParserSettings withPreserveComments(boolean preserveComments) {
		return new ParserSettings(strict, preserveComments, maxDepth);
	}

	public ParserSettings withMaxDepth(int maxDepth) {
		return new ParserSettings(strict, preserveComments, maxDepth);
	}
}
