package org.javai.ngxconf;

import java.util.List;

/**
 * The "directive-like" capability shared by the generic {@link Directive} and
 * every typed variant. The renderer only ever reads nodes through this view.
 */
public interface DirectiveNode extends ConfigNode {

	String getName();

	/**
	 * The parameters with their original quoting, in source order.
	 */
	List<Parameter> getRawParameters();

	/**
	 * The decoded parameter values, in source order.
	 */
	default List<String> getParameters() {
		return getRawParameters().stream().map(Parameter::value).toList();
	}

	/**
	 * The nested block, or null for a simple {@code name params;} directive.
	 */
	Block getBlock();

	default boolean hasBlock() {
		return getBlock() != null;
	}

	@Override
	default <R> R accept(ConfigNodeVisitor<R> visitor) {
		return visitor.visitDirective(this);
	}
}
