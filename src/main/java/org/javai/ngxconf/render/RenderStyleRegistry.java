package org.javai.ngxconf.render;

import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of named render styles.
 * <p>
 * {@link #withBuiltIns()} holds the documented set ({@code indented}, {@code two-space},
 * {@code no-indent}, {@code allman}, {@code compact}); applications can add their own
 * from code or YAML. Registrations are idempotent per name: the first style
 * registered under a name wins.
 */
public final class RenderStyleRegistry {

	private static final Logger logger = LoggerFactory.getLogger(RenderStyleRegistry.class);

	private final Map<String, RenderStyle> styles = new LinkedHashMap<>();
	private final RenderStyleParser parser;

	private RenderStyleRegistry(RenderStyleParser parser) {
		this.parser = parser;
	}

	/**
	 * Create an empty registry backed by a fresh parser.
	 */
	public static RenderStyleRegistry create() {
		return new RenderStyleRegistry(new RenderStyleParser());
	}

	/**
	 * Create a registry holding the built-in styles.
	 */
	public static RenderStyleRegistry withBuiltIns() {
		RenderStyleRegistry registry = create();
		registry.register("indented", RenderStyle.INDENTED);
		registry.register("two-space", RenderStyle.TWO_SPACE);
		registry.register("no-indent", RenderStyle.NO_INDENT);
		registry.register("allman", RenderStyle.ALLMAN);
		registry.register("compact", RenderStyle.COMPACT);
		return registry;
	}

	/**
	 * Register a style under a name. If the name is taken, the existing style is kept and returned.
	 */
	public RenderStyle register(String name, RenderStyle style) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Style name cannot be null or blank");
		}
		Objects.requireNonNull(style, "style must not be null");
		RenderStyle existing = styles.get(name);
		if (existing != null) {
			logger.debug("Render style '{}' already registered; skipping", name);
			return existing;
		}
		styles.put(name, style);
		return style;
	}

	/**
	 * Register every style defined in a YAML document.
	 */
	public RenderStyleRegistry registerYaml(String yamlContent) {
		parser.parseString(yamlContent).forEach(this::register);
		return this;
	}

	/**
	 * Load a YAML style file from a classpath resource using this class' loader.
	 */
	public RenderStyleRegistry registerResource(String resourcePath) {
		return registerResource(resourcePath, RenderStyleRegistry.class.getClassLoader());
	}

	/**
	 * Load and register styles from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found or parsed
	 * @throws IllegalStateException if reading fails
	 */
	public RenderStyleRegistry registerResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			Map<String, RenderStyle> loaded = parser.parse(is);
			loaded.forEach(this::register);
			logger.debug("Loaded {} render styles from {}", loaded.size(), resourcePath);
			return this;
		}
		catch (IllegalArgumentException e) {
			throw e;
		}
		catch (Exception e) {
			throw new IllegalStateException("Failed to load render styles from " + resourcePath, e);
		}
	}

	public Optional<RenderStyle> get(String name) {
		return Optional.ofNullable(styles.get(name));
	}

	/**
	 * Look up a style that must exist.
	 *
	 * @throws IllegalArgumentException naming the known styles if it does not
	 */
	public RenderStyle require(String name) {
		RenderStyle style = styles.get(name);
		if (style == null) {
			throw new IllegalArgumentException("Unknown render style '" + name + "'; known styles: " + styles.keySet());
		}
		return style;
	}

	public Set<String> names() {
		return Collections.unmodifiableSet(styles.keySet());
	}
}
