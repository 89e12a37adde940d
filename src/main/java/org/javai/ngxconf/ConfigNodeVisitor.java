package org.javai.ngxconf;

/**
 * Visitor interface for traversing configuration trees.
 *
 * @param <R> the return type of the visitor operations
 */
public interface ConfigNodeVisitor<R> {

	/**
	 * Visits a directive-like node, generic or typed. Typed nodes arrive here too;
	 * use {@code instanceof} to pick out a particular variant.
	 *
	 * @param directive the directive
	 * @return the result of visiting this node
	 */
	R visitDirective(DirectiveNode directive);

	/**
	 * Visits a comment.
	 *
	 * @param comment the comment
	 * @return the result of visiting this node
	 */
	R visitComment(Comment comment);
}
