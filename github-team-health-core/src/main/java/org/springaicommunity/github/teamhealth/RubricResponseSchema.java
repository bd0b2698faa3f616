package org.springaicommunity.github.teamhealth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reply schema for rubric prompts.
 *
 * <p>
 * Expected shape:
 *
 * <pre>
 * {
 *   "categories": [{"category_id": "...", "score": 20, "feedback": "..."}],
 *   "overall_feedback": "...",
 *   "&lt;suggestions field&gt;": ["...", "..."]
 * }
 * </pre>
 *
 * Only shape errors are rejected. Categories with unknown ids are dropped, fractional
 * scores are floored, and out-of-range scores are clamped later by
 * {@link EvaluationCriteria#normalize(RubricResponse)}.
 */
public class RubricResponseSchema implements ResponseSchema<RubricResponse> {

	private static final Logger logger = LoggerFactory.getLogger(RubricResponseSchema.class);

	static final int MAX_SUGGESTIONS = 3;

	private final EvaluationCriteria criteria;

	private final String suggestionsField;

	public RubricResponseSchema(EvaluationCriteria criteria, String suggestionsField) {
		this.criteria = criteria;
		this.suggestionsField = suggestionsField;
	}

	public String suggestionsField() {
		return suggestionsField;
	}

	@Override
	public String name() {
		return criteria.name() + "_rubric";
	}

	@Override
	public JsonNode jsonSchema() {
		JsonNodeFactory f = JsonNodeFactory.instance;

		ObjectNode category = f.objectNode();
		category.put("type", "object");
		ObjectNode categoryProps = category.putObject("properties");
		ArrayNode ids = categoryProps.putObject("category_id").put("type", "string").putArray("enum");
		criteria.categoryIds().forEach(ids::add);
		categoryProps.putObject("score").put("type", "number").put("minimum", 0);
		categoryProps.putObject("feedback").put("type", "string");
		category.putArray("required").add("category_id").add("score").add("feedback");

		ObjectNode schema = f.objectNode();
		schema.put("type", "object");
		ObjectNode props = schema.putObject("properties");
		ObjectNode categories = props.putObject("categories");
		categories.put("type", "array");
		categories.set("items", category);
		props.putObject("overall_feedback").put("type", "string");
		ObjectNode suggestions = props.putObject(suggestionsField);
		suggestions.put("type", "array").put("maxItems", MAX_SUGGESTIONS);
		suggestions.putObject("items").put("type", "string");
		schema.putArray("required").add("categories").add("overall_feedback").add(suggestionsField);
		return schema;
	}

	@Override
	public RubricResponse parse(JsonNode reply) throws ResponseValidationException {
		JsonNode categoriesNode = reply.get("categories");
		if (categoriesNode == null || !categoriesNode.isArray()) {
			throw new ResponseValidationException("Field 'categories' must be an array");
		}
		List<String> knownIds = criteria.categoryIds();
		List<RubricResponse.CategoryAssessment> categories = new ArrayList<>();
		for (JsonNode node : categoriesNode) {
			String id = requireText(node, "category_id");
			JsonNode score = node.get("score");
			if (score == null || !score.isNumber()) {
				throw new ResponseValidationException("Score of category '" + id + "' must be a number");
			}
			String feedback = requireText(node, "feedback");
			if (!knownIds.contains(id)) {
				logger.warn("Ignoring unknown {} category '{}'", criteria.name(), id);
				continue;
			}
			categories.add(new RubricResponse.CategoryAssessment(id, floorToInt(score.doubleValue()), feedback));
		}

		String overallFeedback = requireText(reply, "overall_feedback");

		JsonNode suggestionsNode = reply.get(suggestionsField);
		List<String> suggestions = new ArrayList<>();
		if (suggestionsNode != null && !suggestionsNode.isNull()) {
			if (!suggestionsNode.isArray()) {
				throw new ResponseValidationException("Field '" + suggestionsField + "' must be an array");
			}
			for (JsonNode suggestion : suggestionsNode) {
				if (!suggestion.isTextual()) {
					throw new ResponseValidationException("Entries of '" + suggestionsField + "' must be strings");
				}
				if (suggestions.size() < MAX_SUGGESTIONS) {
					suggestions.add(suggestion.asText());
				}
			}
		}
		return new RubricResponse(categories, overallFeedback, suggestions);
	}

	private static int floorToInt(double score) {
		return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, Math.floor(score)));
	}

	private static String requireText(JsonNode node, String field) throws ResponseValidationException {
		JsonNode value = node.get(field);
		if (value == null || !value.isTextual()) {
			throw new ResponseValidationException("Field '" + field + "' must be a string");
		}
		return value.asText();
	}

}
