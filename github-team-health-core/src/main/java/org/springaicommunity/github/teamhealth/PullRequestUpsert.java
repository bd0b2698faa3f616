package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * Values written for one pull request by sync, keyed by (repositoryId, githubNumber).
 * The issue link is not part of it and survives an upsert.
 */
public record PullRequestUpsert(long repositoryId, int githubNumber, String title, @Nullable String body,
		String state, @Nullable Long authorCollaboratorId, LocalDateTime githubCreatedAt,
		@Nullable LocalDateTime githubMergedAt) {
}
