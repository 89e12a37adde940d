package org.javai.ngxconf;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for typed nodes that refine a generic {@link Directive}.
 * <p>
 * Name, parameters and block are always read from the wrapped directive, and the
 * typed accessors of subclasses are computed from it on demand, so the typed and
 * generic views cannot drift apart.
 */
public abstract class TypedDirective implements DirectiveNode {

	private final Directive directive;

	protected TypedDirective(Directive directive) {
		this.directive = Objects.requireNonNull(directive, "directive must not be null");
	}

	/**
	 * The generic directive this node refines.
	 */
	public Directive getDirective() {
		return directive;
	}

	@Override
	public String getName() {
		return directive.getName();
	}

	@Override
	public List<Parameter> getRawParameters() {
		return directive.getRawParameters();
	}

	@Override
	public Block getBlock() {
		return directive.getBlock();
	}

	@Override
	public Optional<SourcePosition> getPosition() {
		return directive.getPosition();
	}

	/**
	 * Children of this node's block that are of the given variant, in order.
	 */
	protected <T extends ConfigNode> List<T> childrenOf(Class<T> type) {
		Block block = getBlock();
		if (block == null) {
			return List.of();
		}
		return block.getNodes().stream()
				.filter(type::isInstance)
				.map(type::cast)
				.toList();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[" + getName() + " " + getRawParameters() + "]";
	}
}
