package org.javai.latexify.compile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs an external command to completion.
 */
public interface ProcessRunner {

	/**
	 * @param command executable followed by its arguments
	 * @param workingDirectory directory the process runs in
	 * @param input text written to the process's standard input, which is then closed
	 * @return the process exit code
	 * @throws IOException if the process cannot be started or its streams fail
	 * @throws InterruptedException if interrupted while waiting for the process
	 */
	int run(List<String> command, Path workingDirectory, String input) throws IOException, InterruptedException;
}
