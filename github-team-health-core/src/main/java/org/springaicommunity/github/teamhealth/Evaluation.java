package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * Stored scores of one issue. Each slot is empty until its evaluator has run and is
 * overwritten on re-evaluation. Details are JSON documents.
 */
public record Evaluation(long id, long issueId, @Nullable Integer speedScore, @Nullable String speedGrade,
		@Nullable LocalDateTime speedCalculatedAt, @Nullable Integer qualityScore, @Nullable String qualityGrade,
		@Nullable String qualityDetails, @Nullable LocalDateTime qualityCalculatedAt,
		@Nullable Integer consistencyScore, @Nullable String consistencyGrade, @Nullable String consistencyDetails,
		@Nullable LocalDateTime consistencyCalculatedAt) {

	public boolean hasScore(EvaluationType type) {
		return switch (type) {
			case SPEED -> speedScore != null;
			case QUALITY -> qualityScore != null;
			case CONSISTENCY -> consistencyScore != null;
		};
	}

	public @Nullable Integer score(EvaluationType type) {
		return switch (type) {
			case SPEED -> speedScore;
			case QUALITY -> qualityScore;
			case CONSISTENCY -> consistencyScore;
		};
	}

}
