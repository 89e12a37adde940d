package org.javai.ngxconf;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ParameterTest {

	@Test
	void plainWordsStayBare() {
		assertThat(Parameter.of("127.0.0.1:8080").quote()).isEqualTo(Quote.NONE);
		assertThat(Parameter.of("$host").isQuoted()).isFalse();
		assertThat(Parameter.of("weight=5").toString()).isEqualTo("weight=5");
	}

	@Test
	void valuesThatWouldNotReadBackAreQuoted() {
		assertThat(Parameter.of("").quote()).isEqualTo(Quote.DOUBLE);
		assertThat(Parameter.of("a b").quote()).isEqualTo(Quote.DOUBLE);
		assertThat(Parameter.of("a;b").quote()).isEqualTo(Quote.DOUBLE);
		assertThat(Parameter.of("{x").quote()).isEqualTo(Quote.DOUBLE);
		assertThat(Parameter.of("#not-a-comment").quote()).isEqualTo(Quote.DOUBLE);
		assertThat(Parameter.of("'x").quote()).isEqualTo(Quote.DOUBLE);
		assertThat(Parameter.of("}").quote()).isEqualTo(Quote.DOUBLE);
	}

	@Test
	void explicitQuoteIsKept() {
		Parameter parameter = Parameter.quoted("text/html", Quote.SINGLE);

		assertThat(parameter.isQuoted()).isTrue();
		assertThat(parameter.toString()).isEqualTo("'text/html'");
	}
}
