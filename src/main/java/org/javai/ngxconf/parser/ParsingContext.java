package org.javai.ngxconf.parser;

import org.javai.ngxconf.Block;
import org.javai.ngxconf.ConfigParseException;

/**
 * The parser state a {@link StatementParser} works against: the two-token window
 * and the ability to parse a nested block with the regular grammar.
 */
public interface ParsingContext {

	/**
	 * The token under the cursor.
	 */
	Token current();

	/**
	 * The token after the current one.
	 */
	Token following();

	/**
	 * Moves the window one token forward.
	 *
	 * @return the new current token
	 */
	Token advance();

	/**
	 * Parses a nested block. The current token must be <code>{</code>; on return the
	 * current token is the matching <code>}</code>.
	 *
	 * @param enclosingName name of the directive that owns the block, used to pick
	 *                      context-specific wrappers for its children
	 * @throws ConfigParseException if the block is not closed before end of input
	 */
	Block parseNestedBlock(String enclosingName);

	/**
	 * Creates a syntax error located at the given token.
	 */
	ConfigParseException syntaxError(String detail, Token at);

	/**
	 * The name of the source being parsed; may be null.
	 */
	String getSourceName();
}
