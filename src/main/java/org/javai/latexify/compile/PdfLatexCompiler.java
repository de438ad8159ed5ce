package org.javai.latexify.compile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import org.javai.latexify.config.LatexifyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles documents with pdflatex and the {@code standalone} class's image conversion.
 *
 * The document is fed on standard input and compiled twice, so references the engine
 * records in its auxiliary file on the first pass are resolved on the second. Each
 * invocation uses its own job name, which keeps concurrent compilations in the same
 * working directory apart. The intermediate artifacts of the job are removed whether
 * or not an image came out.
 */
public class PdfLatexCompiler implements LatexCompiler {

	static final int PASSES = 2;

	private static final Logger logger = LoggerFactory.getLogger(PdfLatexCompiler.class);

	private final LatexifyConfig.CompilerSettings settings;
	private final ProcessRunner runner;
	private final Supplier<String> jobIds;

	public PdfLatexCompiler(LatexifyConfig.CompilerSettings settings) {
		this(settings, new DefaultProcessRunner());
	}

	public PdfLatexCompiler(LatexifyConfig.CompilerSettings settings, ProcessRunner runner) {
		this(settings, runner, () -> UUID.randomUUID().toString());
	}

	PdfLatexCompiler(LatexifyConfig.CompilerSettings settings, ProcessRunner runner, Supplier<String> jobIds) {
		if (settings == null) {
			throw new IllegalArgumentException("Compiler settings cannot be null");
		}
		if (runner == null) {
			throw new IllegalArgumentException("Process runner cannot be null");
		}
		this.settings = settings;
		this.runner = runner;
		this.jobIds = jobIds;
	}

	@Override
	public CompileResult compile(String document, Path output) {
		String job = settings.jobPrefix() + jobIds.get();
		Path directory = settings.workingDirectory();
		List<String> command = new ArrayList<>(settings.command());
		command.add("-jobname=" + job);

		int exitCode = 0;
		try {
			for (int pass = 1; pass <= PASSES; pass++) {
				exitCode = runner.run(command, directory, document);
				logger.debug("Pass {} of {} for job {} exited with {}", pass, PASSES, job, exitCode);
			}
		} catch (IOException e) {
			logger.warn("Could not run {} for job {}: {}", command.get(0), job, e.getMessage());
			return CompileResult.failure("Could not run " + command.get(0) + ": " + e.getMessage());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Interrupted while compiling job {}", job);
			return CompileResult.failure("Interrupted while compiling");
		} finally {
			removeIntermediates(directory, job);
		}

		Path image = directory.resolve(job + "." + settings.imageExtension());
		if (!Files.exists(image)) {
			logger.warn("Job {} produced no image (last exit code {})", job, exitCode);
			return CompileResult.failure("No image was produced (exit code " + exitCode + ")");
		}

		try {
			Files.move(image, output, StandardCopyOption.REPLACE_EXISTING);
		} catch (IOException e) {
			logger.warn("Could not move {} to {}: {}", image, output, e.getMessage());
			deleteQuietly(image);
			return CompileResult.failure("Could not move image to " + output + ": " + e.getMessage());
		}
		logger.info("Wrote {}", output);
		return CompileResult.success(output);
	}

	private void removeIntermediates(Path directory, String job) {
		for (String extension : settings.intermediateExtensions()) {
			deleteQuietly(directory.resolve(job + "." + extension));
		}
	}

	private void deleteQuietly(Path path) {
		try {
			Files.deleteIfExists(path);
		} catch (IOException e) {
			logger.warn("Could not remove {}: {}", path, e.getMessage());
		}
	}
}
