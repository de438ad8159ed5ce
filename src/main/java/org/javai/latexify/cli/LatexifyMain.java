package org.javai.latexify.cli;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.javai.latexify.compile.CompileResult;
import org.javai.latexify.compile.LatexCompiler;
import org.javai.latexify.compile.PdfLatexCompiler;
import org.javai.latexify.config.LatexifyConfig;
import org.javai.latexify.config.LatexifyConfigException;
import org.javai.latexify.config.LatexifyConfigLoader;
import org.javai.latexify.document.DocumentTemplate;
import org.javai.latexify.document.LatexDocumentAssembler;
import org.javai.latexify.document.RenderOutcome;
import org.javai.latexify.document.RenderReportJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <pre>
 * latexify [--config FILE] [--output FILE] [--tex | --json] EXPRESSION...
 * </pre>
 *
 * All expressions go into one image, named {@code latexify-<timestamp>.png} unless
 * {@code --output} is given. {@code --tex} prints the document instead of compiling it and
 * {@code --json} prints the per-expression markup and errors.
 */
public final class LatexifyMain {

	static final int EXIT_OK = 0;
	static final int EXIT_FAILED = 1;
	static final int EXIT_USAGE = 2;

	private static final String USAGE = "Usage: latexify [--config FILE] [--output FILE] [--tex | --json] EXPRESSION...";

	private static final Logger logger = LoggerFactory.getLogger(LatexifyMain.class);

	private final LatexifyConfigLoader configLoader;
	private final Function<LatexifyConfig.CompilerSettings, LatexCompiler> compilerFactory;
	private final Clock clock;
	private final PrintStream out;
	private final PrintStream err;

	LatexifyMain(LatexifyConfigLoader configLoader,
			Function<LatexifyConfig.CompilerSettings, LatexCompiler> compilerFactory,
			Clock clock, PrintStream out, PrintStream err) {
		this.configLoader = configLoader;
		this.compilerFactory = compilerFactory;
		this.clock = clock;
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		LatexifyMain main = new LatexifyMain(new LatexifyConfigLoader(), PdfLatexCompiler::new,
				Clock.systemDefaultZone(), System.out, System.err);
		System.exit(main.run(args));
	}

	int run(String[] args) {
		Path configPath = null;
		Path output = null;
		boolean texOnly = false;
		boolean json = false;
		List<String> expressions = new ArrayList<>();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			switch (arg) {
				case "--config", "--output" -> {
					if (i + 1 >= args.length) {
						return usage("Missing value for " + arg);
					}
					Path value = Path.of(args[++i]);
					if (arg.equals("--config")) {
						configPath = value;
					} else {
						output = value;
					}
				}
				case "--tex" -> texOnly = true;
				case "--json" -> json = true;
				case "--" -> {
					for (i++; i < args.length; i++) {
						expressions.add(args[i]);
					}
				}
				default -> {
					if (arg.startsWith("--")) {
						return usage("Unknown option " + arg);
					}
					expressions.add(arg);
				}
			}
		}

		if (expressions.isEmpty()) {
			return usage("No expressions given");
		}
		if (texOnly && json) {
			return usage("--tex and --json cannot be combined");
		}

		LatexifyConfig config;
		try {
			config = configPath != null ? configLoader.load(configPath) : configLoader.loadDefaults();
		} catch (LatexifyConfigException e) {
			err.println("Invalid configuration: " + e.getMessage());
			return EXIT_USAGE;
		}

		LatexDocumentAssembler assembler = new LatexDocumentAssembler();
		List<RenderOutcome> outcomes = assembler.renderAll(expressions);
		for (RenderOutcome outcome : outcomes) {
			if (!outcome.isSuccess()) {
				err.println("Skipped '" + outcome.source() + "': " + outcome.error());
			}
		}

		if (json) {
			out.println(RenderReportJsonMapper.toJsonArray(outcomes).toPrettyString());
			return allFailed(outcomes) ? EXIT_FAILED : EXIT_OK;
		}
		if (allFailed(outcomes)) {
			return EXIT_FAILED;
		}

		String document = DocumentTemplate.from(config).wrap(assembler.assemble(outcomes));
		if (texOnly) {
			out.print(document);
			return EXIT_OK;
		}

		Path target = output != null ? output : defaultOutput(config);
		CompileResult result = compilerFactory.apply(config.compiler()).compile(document, target);
		if (!result.success()) {
			err.println("Compilation failed: " + result.message());
			return EXIT_FAILED;
		}
		out.println(result.output());
		return EXIT_OK;
	}

	private Path defaultOutput(LatexifyConfig config) {
		LatexifyConfig.OutputSettings settings = config.output();
		String timestamp = LocalDateTime.now(clock).format(DateTimeFormatter.ofPattern(settings.timestampPattern()));
		return Path.of(settings.filePrefix() + timestamp + "." + config.compiler().imageExtension());
	}

	private boolean allFailed(List<RenderOutcome> outcomes) {
		boolean failed = outcomes.stream().noneMatch(RenderOutcome::isSuccess);
		if (failed) {
			logger.warn("None of the {} expressions could be rendered", outcomes.size());
		}
		return failed;
	}

	private int usage(String problem) {
		err.println(problem);
		err.println(USAGE);
		return EXIT_USAGE;
	}
}
