package org.springaicommunity.github.teamhealth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Turns raw model text into a schema-validated value.
 *
 * <p>
 * Models sometimes wrap JSON in markdown code fences or add prose around it; the outermost
 * JSON object is extracted before parsing.
 */
public class StructuredOutputParser {

	private final ObjectMapper objectMapper;

	public StructuredOutputParser(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public <T> T parse(String text, ResponseSchema<T> schema) throws ResponseValidationException {
		String json = extractJsonObject(text);
		JsonNode tree;
		try {
			tree = objectMapper.readTree(json);
		}
		catch (JsonProcessingException e) {
			throw new ResponseValidationException("Reply is not valid JSON: " + e.getOriginalMessage(), e);
		}
		if (tree == null || !tree.isObject()) {
			throw new ResponseValidationException("Reply is not a JSON object");
		}
		return schema.parse(tree);
	}

	static String extractJsonObject(String text) throws ResponseValidationException {
		String trimmed = text.strip();
		if (trimmed.startsWith("```")) {
			int firstNewline = trimmed.indexOf('\n');
			int closingFence = trimmed.lastIndexOf("```");
			if (firstNewline > 0 && closingFence > firstNewline) {
				trimmed = trimmed.substring(firstNewline + 1, closingFence).strip();
			}
		}
		int start = trimmed.indexOf('{');
		int end = trimmed.lastIndexOf('}');
		if (start < 0 || end < start) {
			throw new ResponseValidationException("Reply contains no JSON object");
		}
		return trimmed.substring(start, end + 1);
	}

}
