package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * A pull request as returned by the GitHub REST API. Timestamps are UTC.
 *
 * @param number the PR number (unique per repository)
 * @param title the PR title
 * @param body the PR description (may be null)
 * @param state "open" or "closed"
 * @param authorLogin login of the user who opened the PR
 * @param createdAt when the PR was created
 * @param updatedAt when the PR was last updated
 * @param mergedAt when the PR was merged (null if not merged)
 * @param htmlUrl the web URL for the PR
 */
public record GitHubPullRequest(int number, String title, @Nullable String body, String state,
		@Nullable String authorLogin, LocalDateTime createdAt, LocalDateTime updatedAt,
		@Nullable LocalDateTime mergedAt, String htmlUrl) {

	public boolean isMerged() {
		return mergedAt != null;
	}

}
