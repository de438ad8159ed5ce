package org.javai.latexify.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.javai.latexify.compile.CompileResult;
import org.javai.latexify.compile.LatexCompiler;
import org.javai.latexify.config.LatexifyConfigLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LatexifyMainTest {

	private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:30:45Z"), ZoneOffset.UTC);

	@Mock
	LatexCompiler compiler;

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();
	private LatexifyMain main;

	@BeforeEach
	void setUp() {
		main = new LatexifyMain(new LatexifyConfigLoader(), settings -> compiler, CLOCK,
				new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	private String out() {
		return out.toString(StandardCharsets.UTF_8);
	}

	private String err() {
		return err.toString(StandardCharsets.UTF_8);
	}

	@Nested
	class Usage {

		@Test
		void noExpressions() {
			assertThat(main.run(new String[0])).isEqualTo(LatexifyMain.EXIT_USAGE);
			assertThat(err()).contains("No expressions given").contains("Usage: latexify");
		}

		@Test
		void unknownOption() {
			assertThat(main.run(new String[] {"--png", "x"})).isEqualTo(LatexifyMain.EXIT_USAGE);
			assertThat(err()).contains("Unknown option --png");
		}

		@Test
		void missingOptionValue() {
			assertThat(main.run(new String[] {"x", "--output"})).isEqualTo(LatexifyMain.EXIT_USAGE);
			assertThat(err()).contains("Missing value for --output");
		}

		@Test
		void texAndJsonAreExclusive() {
			assertThat(main.run(new String[] {"--tex", "--json", "x"})).isEqualTo(LatexifyMain.EXIT_USAGE);
		}

		@Test
		void invalidConfiguration(@TempDir Path dir) throws Exception {
			Path file = dir.resolve("bad.yml");
			Files.writeString(file, "compiler: pdflatex\n");

			assertThat(main.run(new String[] {"--config", file.toString(), "x"})).isEqualTo(LatexifyMain.EXIT_USAGE);
			assertThat(err()).contains("Invalid configuration: Section 'compiler' must be a mapping");
		}
	}

	@Test
	void texPrintsDocumentWithoutCompiling() {
		int code = main.run(new String[] {"--tex", "alpha + 1", "f("});

		assertThat(code).isEqualTo(LatexifyMain.EXIT_OK);
		assertThat(out()).contains("\\begin{document}\n$$\\alpha{} + 1$$\n\\end{document}\n");
		assertThat(err()).contains("Skipped 'f('");
		verify(compiler, never()).compile(anyString(), any());
	}

	@Test
	void doubleDashEndsOptions() {
		assertThat(main.run(new String[] {"--tex", "--", "-x"})).isEqualTo(LatexifyMain.EXIT_OK);
		assertThat(out()).contains("$$-x$$");
	}

	@Test
	void jsonReportsEveryExpression() throws Exception {
		int code = main.run(new String[] {"--json", "x ** 2", "~(a + b)"});

		assertThat(code).isEqualTo(LatexifyMain.EXIT_OK);
		JsonNode report = new ObjectMapper().readTree(out());
		assertThat(report).hasSize(2);
		assertThat(report.get(0).get("latex").asText()).isEqualTo("$$x^{2}$$");
		assertThat(report.get(1).get("error").asText()).startsWith("Bitwise inversion");
		assertThat(report.get(1).has("latex")).isFalse();
	}

	@Test
	void jsonFailsWhenNothingRenders() {
		assertThat(main.run(new String[] {"--json", "(", "~(a + b)"})).isEqualTo(LatexifyMain.EXIT_FAILED);
	}

	@Test
	void compilesToTimestampedFile() {
		Path expected = Path.of("latexify-20260301123045.png");
		when(compiler.compile(anyString(), eq(expected))).thenReturn(CompileResult.success(expected));

		int code = main.run(new String[] {"x", "y"});

		assertThat(code).isEqualTo(LatexifyMain.EXIT_OK);
		assertThat(out()).contains("latexify-20260301123045.png");
		verify(compiler).compile(contains("$$x$$\n$$y$$\n"), eq(expected));
	}

	@Test
	void compilesToRequestedOutput() {
		Path target = Path.of("sum.png");
		when(compiler.compile(anyString(), eq(target))).thenReturn(CompileResult.success(target));

		assertThat(main.run(new String[] {"--output", "sum.png", "sum(k, 1, n)"})).isEqualTo(LatexifyMain.EXIT_OK);
		assertThat(out()).contains("sum.png");
	}

	@Test
	void compilerFailure() {
		when(compiler.compile(anyString(), any())).thenReturn(CompileResult.failure("No image was produced (exit code 1)"));

		assertThat(main.run(new String[] {"x"})).isEqualTo(LatexifyMain.EXIT_FAILED);
		assertThat(err()).contains("Compilation failed: No image was produced (exit code 1)");
	}

	@Test
	void nothingToCompile() {
		assertThat(main.run(new String[] {"1 +"})).isEqualTo(LatexifyMain.EXIT_FAILED);
		verify(compiler, never()).compile(anyString(), any());
	}
}
