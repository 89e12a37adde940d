package org.javai.ngxconf;

import java.util.Optional;

/**
 * Anything a {@link Block} can hold: a directive-like node or a comment.
 */
public interface ConfigNode {

	/**
	 * Where the node started in its source, if it was parsed rather than built in code.
	 */
	Optional<SourcePosition> getPosition();

	/**
	 * Accepts a visitor and dispatches to the matching visitor method.
	 *
	 * @param <R> the return type of the visitor
	 * @param visitor the visitor to accept
	 * @return the result of the visitor operation
	 */
	<R> R accept(ConfigNodeVisitor<R> visitor);
}
