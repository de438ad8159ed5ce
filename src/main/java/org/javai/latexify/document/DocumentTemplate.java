package org.javai.latexify.document;

import org.javai.latexify.config.LatexifyConfig;

/**
 * Minimal {@code standalone} document that the compiler turns straight into an image.
 */
public class DocumentTemplate {

	private final LatexifyConfig.DocumentSettings settings;
	private final String imageExtension;

	public DocumentTemplate(LatexifyConfig.DocumentSettings settings, String imageExtension) {
		if (settings == null) {
			throw new IllegalArgumentException("Document settings cannot be null");
		}
		if (imageExtension == null || imageExtension.isBlank()) {
			throw new IllegalArgumentException("Image extension cannot be empty");
		}
		this.settings = settings;
		this.imageExtension = imageExtension;
	}

	public static DocumentTemplate from(LatexifyConfig config) {
		return new DocumentTemplate(config.document(), config.compiler().imageExtension());
	}

	/**
	 * Wraps an assembled body in the preamble and document environment.
	 */
	public String wrap(String body) {
		StringBuilder sb = new StringBuilder();
		sb.append("\\documentclass[");
		if (!settings.classOptions().isBlank()) {
			sb.append(settings.classOptions()).append(", ");
		}
		sb.append("convert={outext=.").append(imageExtension).append("}]{standalone}\n");
		for (String pkg : settings.packages()) {
			sb.append("\\usepackage{").append(pkg).append("}\n");
		}
		sb.append("\\begin{document}\n");
		sb.append(body != null ? body : "");
		sb.append("\\end{document}\n");
		return sb.toString();
	}
}
