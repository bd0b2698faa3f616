package org.springaicommunity.github.teamhealth;

/**
 * Outcome for one issue of a batch run.
 *
 * @param issueId the local issue id
 * @param githubNumber the GitHub issue number
 * @param outcome what happened
 */
public record BatchItemResult(long issueId, int githubNumber, EvaluationOutcome outcome) {
}
