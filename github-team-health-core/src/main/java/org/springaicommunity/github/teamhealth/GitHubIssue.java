package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * An issue as returned by the GitHub REST API. Timestamps are UTC.
 *
 * @param number the issue number (unique per repository)
 * @param title the issue title
 * @param body the issue body (may be null)
 * @param state "open" or "closed"
 * @param authorLogin login of the user who opened the issue
 * @param assigneeLogin login of the first assignee
 * @param createdAt when the issue was created
 * @param updatedAt when the issue was last updated
 * @param closedAt when the issue was closed
 * @param htmlUrl the web URL for the issue
 */
public record GitHubIssue(int number, String title, @Nullable String body, String state,
		@Nullable String authorLogin, @Nullable String assigneeLogin, LocalDateTime createdAt,
		LocalDateTime updatedAt, @Nullable LocalDateTime closedAt, String htmlUrl) {
}
