package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * Values written for one issue by sync, keyed by (repositoryId, githubNumber).
 */
public record IssueUpsert(long repositoryId, int githubNumber, String title, @Nullable String body, String state,
		@Nullable Long authorCollaboratorId, @Nullable Long assigneeCollaboratorId, int sprintNumber,
		LocalDateTime githubCreatedAt, @Nullable LocalDateTime githubClosedAt) {
}
