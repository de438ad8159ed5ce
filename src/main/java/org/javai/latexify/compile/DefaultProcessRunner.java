package org.javai.latexify.compile;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}.
 *
 * The console output of the process is discarded, so a chatty process can never block
 * on a full pipe while its input is still being written. pdflatex keeps its own
 * transcript in the job's {@code .log} file. A process still running after the timeout
 * is killed.
 */
public class DefaultProcessRunner implements ProcessRunner {

	public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(1);

	private static final Logger logger = LoggerFactory.getLogger(DefaultProcessRunner.class);

	private final Duration timeout;

	public DefaultProcessRunner() {
		this(DEFAULT_TIMEOUT);
	}

	public DefaultProcessRunner(Duration timeout) {
		if (timeout == null || timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("Timeout must be positive");
		}
		this.timeout = timeout;
	}

	@Override
	public int run(List<String> command, Path workingDirectory, String input) throws IOException, InterruptedException {
		ProcessBuilder builder = new ProcessBuilder(command)
				.directory(workingDirectory.toFile())
				.redirectOutput(ProcessBuilder.Redirect.DISCARD)
				.redirectErrorStream(true);
		Process process = builder.start();

		try {
			try (OutputStream stdin = process.getOutputStream()) {
				stdin.write(input.getBytes(StandardCharsets.UTF_8));
			}
			if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
				throw new IOException(command.get(0) + " timed out after " + timeout.toMillis() + " ms");
			}
		} finally {
			if (process.isAlive()) {
				process.destroyForcibly();
			}
		}

		int exitCode = process.exitValue();
		logger.debug("{} exited with {}", command.get(0), exitCode);
		return exitCode;
	}
}
