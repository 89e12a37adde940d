package org.javai.ngxconf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * An ordered, brace-delimited sequence of nodes. Insertion order is source order
 * and is only changed through the mutation methods here.
 */
public final class Block {

	private final List<ConfigNode> nodes = new ArrayList<>();

	public Block() {
	}

	public Block(List<? extends ConfigNode> nodes) {
		Objects.requireNonNull(nodes, "nodes must not be null");
		nodes.forEach(this::add);
	}

	/**
	 * All nodes in order, comments included.
	 */
	public List<ConfigNode> getNodes() {
		return Collections.unmodifiableList(nodes);
	}

	/**
	 * The directive-like nodes of this block only, in order.
	 */
	public List<DirectiveNode> getDirectives() {
		List<DirectiveNode> directives = new ArrayList<>();
		for (ConfigNode node : nodes) {
			if (node instanceof DirectiveNode directive) {
				directives.add(directive);
			}
		}
		return directives;
	}

	public Block add(ConfigNode node) {
		nodes.add(Objects.requireNonNull(node, "node must not be null"));
		return this;
	}

	/**
	 * Inserts a node at the given index, shifting later nodes one place back.
	 *
	 * @throws IndexOutOfBoundsException if the index is outside {@code [0, size()]}
	 */
	public Block insert(int index, ConfigNode node) {
		nodes.add(index, Objects.requireNonNull(node, "node must not be null"));
		return this;
	}

	/**
	 * Removes the given node (matched by identity).
	 *
	 * @return true if the node was a direct child of this block
	 */
	public boolean remove(ConfigNode node) {
		for (int i = 0; i < nodes.size(); i++) {
			if (nodes.get(i) == node) {
				nodes.remove(i);
				return true;
			}
		}
		return false;
	}

	public int size() {
		return nodes.size();
	}

	public boolean isEmpty() {
		return nodes.isEmpty();
	}

	/**
	 * Finds every directive-like node with the given name at any depth, in source order.
	 */
	public List<DirectiveNode> findDirectives(String name) {
		Objects.requireNonNull(name, "name must not be null");
		List<DirectiveNode> found = new ArrayList<>();
		ConfigNodeWalker.walkAll(this, new CollectingVisitor<>(DirectiveNode.class,
				directive -> name.equals(directive.getName()), found));
		return found;
	}

	/**
	 * Finds every node of the given variant at any depth, in source order.
	 */
	public <T extends ConfigNode> List<T> findAll(Class<T> type) {
		Objects.requireNonNull(type, "type must not be null");
		List<T> found = new ArrayList<>();
		ConfigNodeWalker.walkAll(this, new CollectingVisitor<>(type, node -> true, found));
		return found;
	}

	private record CollectingVisitor<T extends ConfigNode>(Class<T> type, Predicate<T> filter,
			List<T> found) implements ConfigNodeVisitor<Void> {

		@Override
		public Void visitDirective(DirectiveNode directive) {
			collect(directive);
			return null;
		}

		@Override
		public Void visitComment(Comment comment) {
			collect(comment);
			return null;
		}

		private void collect(ConfigNode node) {
			if (type.isInstance(node)) {
				T candidate = type.cast(node);
				if (filter.test(candidate)) {
					found.add(candidate);
				}
			}
		}
	}
}
