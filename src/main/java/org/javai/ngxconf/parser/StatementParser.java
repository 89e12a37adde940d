package org.javai.ngxconf.parser;

import org.javai.ngxconf.DirectiveNode;

/**
 * Takes over parsing of one statement whose name it was registered for.
 * <p>
 * It is called with the directive name as the current token and must return with
 * the statement's last token ({@code ;} or the closing <code>}</code>) as the current token.
 */
@FunctionalInterface
public interface StatementParser {

	DirectiveNode parse(ParsingContext context);
}
