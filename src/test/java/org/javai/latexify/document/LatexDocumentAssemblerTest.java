package org.javai.latexify.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.latexify.parse.ExpressionParseException;
import org.javai.latexify.render.LatexNodeVisitor;
import org.javai.latexify.render.LatexRenderException;
import org.javai.latexify.symbol.SymbolTable;
import org.javai.latexify.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;

class LatexDocumentAssemblerTest {

	private final LatexDocumentAssembler assembler = new LatexDocumentAssembler();

	@Test
	void latexifyWrapsInDisplayMath() {
		assertThat(assembler.latexify("alpha_1 + 2")).isEqualTo("$$\\alpha{}_{1} + 2$$");
	}

	@Test
	void latexifyRendersSpecialForms() {
		assertThat(assembler.latexify("integral(x**2, 0, 1, dx)"))
				.isEqualTo("$$\\int^{1}_{0}{x^{2}\\;{}dx}$$");
		assertThat(assembler.latexify("sqrt(x) / 2"))
				.isEqualTo("$$\\dfrac{\\sqrt[]{x}}{2}$$");
	}

	@Test
	void latexifyPropagatesFailures() {
		assertThatThrownBy(() -> assembler.latexify("f(x"))
				.isInstanceOf(ExpressionParseException.class);
		assertThatThrownBy(() -> assembler.latexify("root(x)"))
				.isInstanceOf(LatexRenderException.class)
				.hasMessageContaining("'root'");
	}

	@Test
	void renderCapturesFailureInOutcome() {
		RenderOutcome outcome = assembler.render("~(a + b)");

		assertThat(outcome.isSuccess()).isFalse();
		assertThat(outcome.source()).isEqualTo("~(a + b)");
		assertThat(outcome.error()).contains("Bitwise inversion");
		assertThat(outcome.latex()).isNull();
	}

	@Test
	void renderLogsSkippedExpression() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(LatexDocumentAssembler.class, Level.WARN)) {
			assembler.render("1 +");

			assertThat(appender.messages())
					.anyMatch(msg -> msg.startsWith("Skipping expression '1 +'"));
		}
	}

	@Test
	void oneFailureDoesNotAffectTheOthers() {
		List<RenderOutcome> outcomes = assembler.renderAll(List.of("x", "f(", "y"));

		assertThat(outcomes).extracting(RenderOutcome::isSuccess).containsExactly(true, false, true);
		assertThat(assembler.assemble(outcomes)).isEqualTo("$$x$$\n$$y$$\n");
	}

	@Test
	void deeplyNestedExpressionFailsAlone() {
		String nested = "(".repeat(20000) + "x" + ")".repeat(20000);
		String chain = String.join(" + ", Collections.nCopies(60000, "x"));

		List<RenderOutcome> outcomes = assembler.renderAll(List.of("a + b", nested, chain, "c"));

		assertThat(outcomes).extracting(RenderOutcome::isSuccess).containsExactly(true, false, false, true);
		assertThat(outcomes.get(1).error()).startsWith("Expression is nested too deeply");
		assertThat(outcomes.get(2).error()).startsWith("Expression is nested too deeply");
		assertThat(assembler.assemble(outcomes)).isEqualTo("$$a + b$$\n$$c$$\n");
	}

	@Test
	void renderAllWithNothingToRender() {
		assertThat(assembler.renderAll(null)).isEmpty();
		assertThat(assembler.renderAll(List.of())).isEmpty();
		assertThat(assembler.assemble(List.of())).isEmpty();
	}

	@Test
	void renderAllKeepsOrderAndDuplicates() {
		List<RenderOutcome> outcomes = assembler.renderAll(Arrays.asList("b", "a", "b"));

		assertThat(outcomes).extracting(RenderOutcome::source).containsExactly("b", "a", "b");
	}

	@Test
	void customSymbolTable() {
		LatexDocumentAssembler custom = new LatexDocumentAssembler(
				new LatexNodeVisitor(SymbolTable.of(Map.of("hbar", "\\hbar{}"))));

		assertThat(custom.latexify("hbar * alpha")).isEqualTo("$$\\hbar{}\\cdot{}alpha$$");
	}

	@Test
	void visitorIsRequired() {
		assertThatThrownBy(() -> new LatexDocumentAssembler(null))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
