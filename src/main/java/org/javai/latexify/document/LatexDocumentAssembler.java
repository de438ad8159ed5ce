package org.javai.latexify.document;

import java.util.ArrayList;
import java.util.List;
import org.javai.latexify.expr.Expression;
import org.javai.latexify.parse.ExpressionParseException;
import org.javai.latexify.parse.ExpressionParser;
import org.javai.latexify.render.LatexNodeVisitor;
import org.javai.latexify.render.LatexRenderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns source expressions into display-math fragments and joins them into a document body.
 *
 * Each expression is parsed and rendered on its own. A parse or render failure is
 * reported in that expression's {@link RenderOutcome} and never affects the others.
 */
public class LatexDocumentAssembler {

	/** Display math delimiter placed on both sides of every fragment. */
	public static final String MATH_DELIMITER = "$$";

	private static final Logger logger = LoggerFactory.getLogger(LatexDocumentAssembler.class);

	private final LatexNodeVisitor visitor;

	public LatexDocumentAssembler() {
		this(new LatexNodeVisitor());
	}

	public LatexDocumentAssembler(LatexNodeVisitor visitor) {
		if (visitor == null) {
			throw new IllegalArgumentException("Visitor cannot be null");
		}
		this.visitor = visitor;
	}

	/**
	 * Parses and renders one expression, wrapped in math delimiters.
	 *
	 * @throws ExpressionParseException if the source does not parse
	 * @throws LatexRenderException if the tree cannot be typeset
	 */
	public String latexify(String source) {
		Expression expression = ExpressionParser.parse(source);
		return MATH_DELIMITER + visitor.render(expression) + MATH_DELIMITER;
	}

	/**
	 * Renders one expression, capturing any failure in the outcome.
	 */
	public RenderOutcome render(String source) {
		try {
			return RenderOutcome.success(source, latexify(source));
		} catch (ExpressionParseException | LatexRenderException e) {
			logger.warn("Skipping expression '{}': {}", source, e.getMessage());
			return RenderOutcome.failure(source, e.getMessage());
		}
	}

	/**
	 * Renders every expression, in order, one outcome per source.
	 */
	public List<RenderOutcome> renderAll(List<String> sources) {
		List<RenderOutcome> outcomes = new ArrayList<>();
		if (sources == null) {
			return outcomes;
		}
		for (String source : sources) {
			outcomes.add(render(source));
		}
		long failures = outcomes.stream().filter(o -> !o.isSuccess()).count();
		logger.debug("Rendered {} expressions, {} failed", outcomes.size(), failures);
		return outcomes;
	}

	/**
	 * Joins the successful fragments into a document body, one fragment per line.
	 */
	public String assemble(List<RenderOutcome> outcomes) {
		StringBuilder body = new StringBuilder();
		for (RenderOutcome outcome : outcomes) {
			if (outcome.isSuccess()) {
				body.append(outcome.latex()).append('\n');
			}
		}
		return body.toString();
	}
}
