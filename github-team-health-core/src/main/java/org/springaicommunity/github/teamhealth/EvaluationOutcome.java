package org.springaicommunity.github.teamhealth;

/**
 * Result of evaluating one issue on one dimension.
 */
public sealed interface EvaluationOutcome
		permits EvaluationOutcome.Evaluated, EvaluationOutcome.Skipped, EvaluationOutcome.Failed {

	/**
	 * The score was computed and stored.
	 *
	 * @param score the stored score; speed scores go up to 120
	 * @param grade the stored grade label
	 */
	record Evaluated(int score, String grade) implements EvaluationOutcome {
	}

	/**
	 * The issue is not eligible; nothing was stored.
	 *
	 * @param reason why
	 */
	record Skipped(String reason) implements EvaluationOutcome {
	}

	/**
	 * The evaluation failed; nothing was stored.
	 *
	 * @param reason what went wrong
	 * @param retryable whether a later run may succeed
	 * @param rateLimited whether an upstream rate limit was hit
	 */
	record Failed(String reason, boolean retryable, boolean rateLimited) implements EvaluationOutcome {

		static Failed permanent(String reason) {
			return new Failed(reason, false, false);
		}

		static Failed from(EvaluationException e) {
			return new Failed(e.getMessage(), e.isRetryable(), e.isRateLimited());
		}

	}

}
