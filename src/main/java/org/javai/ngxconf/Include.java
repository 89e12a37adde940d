package org.javai.ngxconf;

/**
 * An {@code include path;} directive. Only the reference is modelled; nothing is read.
 */
public final class Include extends TypedDirective {

	private Include(Directive directive) {
		super(directive);
	}

	/**
	 * Wraps a directive, checking it has exactly one parameter and no block.
	 *
	 * @throws ConfigParseException (semantic) for any other shape
	 */
	public static Include of(Directive directive) {
		int count = directive.getRawParameters().size();
		if (count == 0) {
			throw ConfigParseException.semantic("include directive requires a path", directive);
		}
		if (count > 1) {
			throw ConfigParseException.semantic("include directive can not have multiple parameters", directive);
		}
		if (directive.hasBlock()) {
			throw ConfigParseException.semantic(
					"include can not have a block, or missing semicolon at the end of include statement", directive);
		}
		return new Include(directive);
	}

	public String getPath() {
		return getParameters().get(0);
	}
}
