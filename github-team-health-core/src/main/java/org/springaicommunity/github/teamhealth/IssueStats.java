package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Counts and average scores over a set of issues. Averages are rounded and null when no
 * issue in the set has that score.
 *
 * @param total number of issues
 * @param closed closed issues
 * @param open open issues
 * @param averageSpeed mean speed score
 * @param averageQuality mean quality score
 * @param averageConsistency mean consistency score
 * @param averageLeadTime lead-time score of the mean creation-to-close time of closed
 * issues
 */
public record IssueStats(int total, int closed, int open, @Nullable Integer averageSpeed,
		@Nullable Integer averageQuality, @Nullable Integer averageConsistency,
		@Nullable LeadTimeScore averageLeadTime) {

	static IssueStats of(List<Issue> issues, Map<Long, Evaluation> evaluationsByIssueId) {
		int closed = (int) issues.stream().filter(Issue::isClosed).count();
		List<Evaluation> evaluations = issues.stream()
			.map(issue -> evaluationsByIssueId.get(issue.id()))
			.filter(Objects::nonNull)
			.toList();
		return new IssueStats(issues.size(), closed, issues.size() - closed,
				average(evaluations, EvaluationType.SPEED), average(evaluations, EvaluationType.QUALITY),
				average(evaluations, EvaluationType.CONSISTENCY), averageLeadTime(issues));
	}

	private static @Nullable LeadTimeScore averageLeadTime(List<Issue> issues) {
		List<Duration> leadTimes = new ArrayList<>();
		for (Issue issue : issues) {
			LocalDateTime closedAt = issue.githubClosedAt();
			if (issue.isClosed() && closedAt != null && !closedAt.isBefore(issue.githubCreatedAt())) {
				leadTimes.add(Duration.between(issue.githubCreatedAt(), closedAt));
			}
		}
		if (leadTimes.isEmpty()) {
			return null;
		}
		long totalMillis = leadTimes.stream().mapToLong(Duration::toMillis).sum();
		return LeadTimeScore.fromDuration(Duration.ofMillis(totalMillis / leadTimes.size()));
	}

	private static @Nullable Integer average(List<Evaluation> evaluations, EvaluationType type) {
		List<Integer> scores = evaluations.stream().map(e -> e.score(type)).filter(Objects::nonNull).toList();
		if (scores.isEmpty()) {
			return null;
		}
		return (int) Math.round(scores.stream().mapToInt(Integer::intValue).average().orElse(0));
	}

}
