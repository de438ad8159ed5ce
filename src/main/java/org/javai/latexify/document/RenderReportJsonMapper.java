package org.javai.latexify.document;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Utility to convert {@link RenderOutcome}s into JSON for scripting and diagnostics.
 */
public final class RenderReportJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper();

	private RenderReportJsonMapper() {
	}

	public static ObjectNode toJson(RenderOutcome outcome) {
		ObjectNode node = mapper.createObjectNode();
		node.put("source", outcome.source());
		if (outcome.isSuccess()) {
			node.put("latex", outcome.latex());
		} else {
			node.put("error", outcome.error());
		}
		return node;
	}

	public static ArrayNode toJsonArray(List<RenderOutcome> outcomes) {
		ArrayNode array = mapper.createArrayNode();
		for (RenderOutcome outcome : outcomes) {
			array.add(toJson(outcome));
		}
		return array;
	}
}
