package org.springaicommunity.github.teamhealth;

/**
 * One weighted category of an evaluation rubric.
 *
 * @param id stable identifier the AI model echoes back
 * @param label human-readable name
 * @param weight maximum points of the category
 * @param description scoring guidance given to the model
 */
public record EvaluationCategory(String id, String label, int weight, String description) {

	public EvaluationCategory {
		if (id.isBlank()) {
			throw new IllegalArgumentException("Category id must not be blank");
		}
		if (weight <= 0) {
			throw new IllegalArgumentException("Category weight must be positive, got " + weight);
		}
	}

}
