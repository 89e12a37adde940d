package org.javai.ngxconf;

import java.util.List;

/**
 * A {@code server { ... }} block, i.e. a virtual server.
 */
public final class Server extends TypedDirective {

	public Server(Directive directive) {
		super(directive);
	}

	public List<Location> getLocations() {
		return childrenOf(Location.class);
	}
}
