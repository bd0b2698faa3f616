package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * A stored pull request. Unique by (repositoryId, githubNumber).
 *
 * @param id the local id
 * @param repositoryId the owning repository
 * @param githubNumber the GitHub PR number
 * @param title the PR title
 * @param body the PR description
 * @param state "open" or "closed"
 * @param issueId the issue this PR closes, once linked
 * @param authorCollaboratorId the author, when registered as a collaborator
 * @param githubCreatedAt when the PR was created on GitHub
 * @param githubMergedAt when the PR was merged
 * @param createdAt when the row was first stored
 * @param updatedAt when the row was last written
 */
public record PullRequest(long id, long repositoryId, int githubNumber, String title, @Nullable String body,
		String state, @Nullable Long issueId, @Nullable Long authorCollaboratorId, LocalDateTime githubCreatedAt,
		@Nullable LocalDateTime githubMergedAt, LocalDateTime createdAt, LocalDateTime updatedAt) {
}
