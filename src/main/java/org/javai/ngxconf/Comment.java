package org.javai.ngxconf;

import java.util.Objects;
import java.util.Optional;

/**
 * A {@code #} comment kept in its sequence position among sibling directives.
 *
 * @param text the comment text without the leading {@code #} and surrounding blanks
 * @param position where the comment started, or null when built in code
 */
public record Comment(String text, SourcePosition position) implements ConfigNode {

	public Comment {
		Objects.requireNonNull(text, "text must not be null");
	}

	public Comment(String text) {
		this(text, null);
	}

	/**
	 * Creates a comment from the raw token literal, which still carries its {@code #}.
	 */
	public static Comment fromLiteral(String literal, SourcePosition position) {
		String text = literal.startsWith("#") ? literal.substring(1) : literal;
		return new Comment(text.strip(), position);
	}

	@Override
	public Optional<SourcePosition> getPosition() {
		return Optional.ofNullable(position);
	}

	@Override
	public <R> R accept(ConfigNodeVisitor<R> visitor) {
		return visitor.visitComment(this);
	}
}
