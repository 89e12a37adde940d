package org.javai.ngxconf;

/**
 * Utility class for walking configuration trees with visitors.
 */
public final class ConfigNodeWalker {

	private ConfigNodeWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits a node and then, if it carries a block, every node beneath it (pre-order).
	 *
	 * @param <R> the return type of the visitor
	 * @param node the node to start from
	 * @param visitor the visitor to apply to each node
	 * @return the result of visiting the starting node
	 */
	public static <R> R walkPreOrder(ConfigNode node, ConfigNodeVisitor<R> visitor) {
		if (node == null) {
			return null;
		}

		R result = node.accept(visitor);

		if (node instanceof DirectiveNode directive && directive.hasBlock()) {
			walkAll(directive.getBlock(), visitor);
		}

		return result;
	}

	/**
	 * Walks every node of a block and everything nested beneath it, in source order.
	 */
	public static <R> void walkAll(Block block, ConfigNodeVisitor<R> visitor) {
		if (block == null) {
			return;
		}

		for (ConfigNode node : block.getNodes()) {
			walkPreOrder(node, visitor);
		}
	}
}
