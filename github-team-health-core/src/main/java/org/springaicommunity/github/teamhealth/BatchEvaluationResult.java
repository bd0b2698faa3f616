package org.springaicommunity.github.teamhealth;

import java.util.List;

/**
 * Summary of a batch evaluation run.
 *
 * @param type the evaluated dimension
 * @param evaluated issues scored and stored
 * @param skipped issues found ineligible
 * @param failed issues whose evaluation failed
 * @param remaining pending issues this run did not process
 * @param rateLimited whether the run stopped early on a rate limit
 * @param items per-issue outcomes in processing order
 */
public record BatchEvaluationResult(EvaluationType type, int evaluated, int skipped, int failed, int remaining,
		boolean rateLimited, List<BatchItemResult> items) {

	public BatchEvaluationResult {
		items = List.copyOf(items);
	}

	static BatchEvaluationResult of(EvaluationType type, List<BatchItemResult> items, int remaining,
			boolean rateLimited) {
		int evaluated = 0;
		int skipped = 0;
		int failed = 0;
		for (BatchItemResult item : items) {
			if (item.outcome() instanceof EvaluationOutcome.Evaluated) {
				evaluated++;
			}
			else if (item.outcome() instanceof EvaluationOutcome.Skipped) {
				skipped++;
			}
			else {
				failed++;
			}
		}
		return new BatchEvaluationResult(type, evaluated, skipped, failed, remaining, rateLimited, items);
	}

}
