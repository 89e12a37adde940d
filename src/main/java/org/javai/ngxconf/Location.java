package org.javai.ngxconf;

/**
 * A {@code location [modifier] match { ... }} block.
 * With one parameter the modifier is empty and the parameter is the match pattern;
 * with two, the first is the modifier and the second the match pattern.
 */
public final class Location extends TypedDirective {

	private Location(Directive directive) {
		super(directive);
	}

	/**
	 * Wraps a directive, checking it has one or two parameters.
	 *
	 * @throws ConfigParseException (semantic) for zero or more than two parameters
	 */
	public static Location of(Directive directive) {
		int count = directive.getRawParameters().size();
		if (count == 0) {
			throw ConfigParseException.semantic("not enough parameters for location", directive);
		}
		if (count > 2) {
			throw ConfigParseException.semantic("too many parameters for location directive (" + count + ")", directive);
		}
		return new Location(directive);
	}

	public String getModifier() {
		return getParameters().size() == 2 ? getParameters().get(0) : "";
	}

	public String getMatch() {
		return getParameters().get(getParameters().size() - 1);
	}
}
