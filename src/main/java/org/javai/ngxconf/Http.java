package org.javai.ngxconf;

import java.util.List;

/**
 * The {@code http { ... }} context.
 */
public final class Http extends TypedDirective {

	public Http(Directive directive) {
		super(directive);
	}

	/**
	 * Virtual servers declared directly in this context.
	 */
	public List<Server> getServers() {
		return childrenOf(Server.class);
	}
}
