package org.javai.ngxconf.parser;

import org.javai.ngxconf.Directive;
import org.javai.ngxconf.DirectiveNode;

/**
 * Upgrades a generically parsed directive to a typed node.
 * May throw a semantic {@link org.javai.ngxconf.ConfigParseException} when the
 * directive does not have the shape the typed node needs.
 */
@FunctionalInterface
public interface DirectiveWrapper {

	DirectiveNode wrap(Directive directive);
}
