package org.javai.ngxconf.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.javai.ngxconf.Block;
import org.javai.ngxconf.Comment;
import org.javai.ngxconf.Config;
import org.javai.ngxconf.Directive;
import org.javai.ngxconf.Parameter;
import org.javai.ngxconf.Quote;
import org.javai.ngxconf.Upstream;
import org.javai.ngxconf.UpstreamServer;
import org.javai.ngxconf.parser.ConfigParser;
import org.javai.ngxconf.testsupport.TreeShape;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class ConfigRendererTest {

	private static final String NESTED = "http { server { listen 80; } }";

	static Stream<RenderStyle> styles() {
		return Stream.of(RenderStyle.INDENTED, RenderStyle.TWO_SPACE, RenderStyle.NO_INDENT,
				RenderStyle.ALLMAN, RenderStyle.COMPACT, RenderStyle.INDENTED.withStartIndent(3));
	}

	@Nested
	class Styles {

		@Test
		void indented() {
			String rendered = ConfigRenderer.render(ConfigParser.parse(NESTED), RenderStyle.INDENTED);

			assertThat(rendered).isEqualTo("""
					http {
					    server {
					        listen 80;
					    }
					}""");
		}

		@Test
		void twoSpace() {
			String rendered = ConfigRenderer.render(ConfigParser.parse(NESTED), RenderStyle.TWO_SPACE);

			assertThat(rendered).isEqualTo("http {\n  server {\n    listen 80;\n  }\n}");
		}

		@Test
		void compact() {
			String rendered = ConfigRenderer.render(ConfigParser.parse(NESTED), RenderStyle.COMPACT);

			assertThat(rendered).isEqualTo("http { server { listen 80; } }");
		}

		@Test
		void allman() {
			String rendered = ConfigRenderer.render(ConfigParser.parse(NESTED), RenderStyle.ALLMAN);

			assertThat(rendered).isEqualTo("http\n{\n    server\n    {\n        listen 80;\n    }\n}");
		}

		@Test
		void startIndentShiftsEveryLine() {
			String rendered = ConfigRenderer.render(ConfigParser.parse("events { worker_connections 1024; }"),
					RenderStyle.INDENTED.withStartIndent(2));

			assertThat(rendered).isEqualTo("  events {\n      worker_connections 1024;\n  }");
		}

		@Test
		void emptyBlock() {
			Config config = ConfigParser.parse("events {}");

			assertThat(ConfigRenderer.render(config, RenderStyle.INDENTED)).isEqualTo("events {\n}");
			assertThat(ConfigRenderer.render(config, RenderStyle.COMPACT)).isEqualTo("events { }");
		}

		@Test
		void topLevelDirectivesAreSeparatedByLineBreaks() {
			String rendered = ConfigRenderer.render(ConfigParser.parse("user www;worker_processes 5;"),
					RenderStyle.NO_INDENT);

			assertThat(rendered).isEqualTo("user www;\nworker_processes 5;");
		}
	}

	@Nested
	class Parameters {

		@Test
		void originalDelimiterIsKept() {
			Config config = ConfigParser.parse("add_header X-Test \"a b\" 'c' `d`;");

			assertThat(ConfigRenderer.render(config, RenderStyle.INDENTED))
					.isEqualTo("add_header X-Test \"a b\" 'c' `d`;");
		}

		@Test
		void specialCharactersAreEscaped() {
			Parameter parameter = Parameter.quoted("it's \"x\"\n\tback\\slash", Quote.SINGLE);

			assertThat(ConfigRenderer.formatParameter(parameter))
					.isEqualTo("'it\\'s \"x\"\\n\\tback\\\\slash'");
		}

		@Test
		void escapedValueReadsBackUnchanged() {
			String value = "line one\nsay \"hi\"\\";
			Block block = new Block().add(new Directive("echo",
					List.of(Parameter.quoted(value, Quote.DOUBLE)), null, null));

			Config reparsed = ConfigParser.parse(ConfigRenderer.render(block, RenderStyle.INDENTED));

			assertThat(reparsed.getBlock().getDirectives().get(0).getParameters()).containsExactly(value);
		}

		@Test
		void valuesBuiltInCodeAreQuotedWhenNeeded() {
			Block block = new Block().add(Directive.simple("return", "200", "ok then"));

			assertThat(ConfigRenderer.render(block, RenderStyle.INDENTED)).isEqualTo("return 200 \"ok then\";");
		}
	}

	@Nested
	class Comments {

		private static final String SOURCE = "# top\nlisten 80; # trailing";

		@Test
		void commentsKeepTheirPlace() {
			String rendered = ConfigRenderer.render(ConfigParser.parse(SOURCE), RenderStyle.INDENTED);

			assertThat(rendered).isEqualTo("# top\nlisten 80;\n# trailing");
		}

		@Test
		void compactOutputEndsTheLineAfterAComment() {
			String rendered = ConfigRenderer.render(ConfigParser.parse(SOURCE), RenderStyle.COMPACT);

			assertThat(rendered).isEqualTo("# top\nlisten 80; # trailing\n");
			assertThat(TreeShape.of(ConfigParser.parse(rendered))).isEqualTo(TreeShape.of(ConfigParser.parse(SOURCE)));
		}

		@Test
		void emptyComment() {
			Block block = new Block().add(new Comment(""));

			assertThat(ConfigRenderer.render(block, RenderStyle.INDENTED)).isEqualTo("#");
		}
	}

	@Nested
	class RoundTrip {

		@ParameterizedTest
		@MethodSource("org.javai.ngxconf.render.ConfigRendererTest#styles")
		void fullExampleReparsesToTheSameTree(RenderStyle style) throws IOException {
			Config original = loadFullExample();

			Config reparsed = ConfigParser.parse(ConfigRenderer.render(original, style));

			assertThat(TreeShape.of(reparsed)).isEqualTo(TreeShape.of(original));
		}

		@Test
		void renderingIsStable() throws IOException {
			String once = ConfigRenderer.render(loadFullExample(), RenderStyle.INDENTED);
			String twice = ConfigRenderer.render(ConfigParser.parse(once), RenderStyle.INDENTED);

			assertThat(twice).isEqualTo(once);
		}

		private Config loadFullExample() throws IOException {
			try (InputStream in = getClass().getClassLoader().getResourceAsStream("conf/full-example.conf");
					Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
				return ConfigParser.parse(reader, "conf/full-example.conf");
			}
		}
	}

	@Test
	void addedServerIsRendered() {
		Config config = ConfigParser.parse(
				"http{ upstream my_backend{ server 127.0.0.1:443; server 127.0.0.2:443 backup; } }");
		Upstream upstream = config.findUpstreams().get(0);

		upstream.addServer(new UpstreamServer("127.0.0.1:443", Map.of("weight", "5"), List.of("down")));

		assertThat(ConfigRenderer.render(config, RenderStyle.INDENTED)).isEqualTo("""
				http {
				    upstream my_backend {
				        server 127.0.0.1:443;
				        server 127.0.0.2:443 backup;
				        server 127.0.0.1:443 weight=5 down;
				    }
				}""");
	}

	@Test
	void renderSingleNode() {
		Config config = ConfigParser.parse(NESTED);

		String rendered = ConfigRenderer.render(config.getBlock().getNodes().get(0), RenderStyle.COMPACT);

		assertThat(rendered).isEqualTo(NESTED);
	}

	@Test
	void writeAppendsTrailingLineBreak() throws IOException {
		StringWriter writer = new StringWriter();

		ConfigRenderer.write(ConfigParser.parse("listen 80;"), RenderStyle.INDENTED, writer);

		assertThat(writer.toString()).isEqualTo("listen 80;\n");
	}
}
