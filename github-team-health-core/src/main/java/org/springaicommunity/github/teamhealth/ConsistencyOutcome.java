package org.springaicommunity.github.teamhealth;

/**
 * Result of a consistency evaluation attempt.
 */
public sealed interface ConsistencyOutcome permits ConsistencyOutcome.Evaluated, ConsistencyOutcome.Skipped {

	/**
	 * The issue was compared with its pull requests.
	 *
	 * @param evaluation the evaluation
	 */
	record Evaluated(ConsistencyEvaluation evaluation) implements ConsistencyOutcome {
	}

	/**
	 * Nothing to compare against; no AI call was made.
	 *
	 * @param reason why the issue was skipped
	 */
	record Skipped(String reason) implements ConsistencyOutcome {
	}

}
