package org.javai.ngxconf;

import java.util.List;
import java.util.Objects;

/**
 * An {@code upstream name { ... }} pool of backend servers.
 * <p>
 * The pool's block is the single source of truth: {@link #getServers()} reads the
 * {@link UpstreamServer} entries from it and {@link #addServer(UpstreamServer)} writes
 * into it, so what the renderer emits always matches the typed view.
 */
public final class Upstream extends TypedDirective {

	public Upstream(Directive directive) {
		super(directive);
		if (!directive.hasBlock()) {
			throw new IllegalArgumentException("upstream directive must have a block");
		}
	}

	/**
	 * The pool name, or an empty string if the directive has no parameter.
	 */
	public String getUpstreamName() {
		List<String> parameters = getParameters();
		return parameters.isEmpty() ? "" : parameters.get(0);
	}

	/**
	 * The {@link UpstreamServer} entries of the pool, in block order. A generic
	 * {@link Directive} named {@code server} placed into the block with
	 * {@link Block#add(ConfigNode)} is rendered but is not an entry; use
	 * {@link #addServer(UpstreamServer)} or {@link UpstreamServer#fromDirective(Directive)}.
	 */
	public List<UpstreamServer> getServers() {
		return childrenOf(UpstreamServer.class);
	}

	/**
	 * Appends a server after the pool's existing entries.
	 */
	public Upstream addServer(UpstreamServer server) {
		getBlock().add(Objects.requireNonNull(server, "server must not be null"));
		return this;
	}

	/**
	 * Removes a server entry (matched by identity); the remaining entries keep their order.
	 *
	 * @return true if the server belonged to this pool
	 */
	public boolean removeServer(UpstreamServer server) {
		return getBlock().remove(server);
	}
}
