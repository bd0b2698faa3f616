package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * A stored issue. Unique by (repositoryId, githubNumber); written only by issue sync.
 *
 * @param id the local id
 * @param repositoryId the owning repository
 * @param githubNumber the GitHub issue number
 * @param title the issue title
 * @param body the issue body
 * @param state "open" or "closed"
 * @param authorCollaboratorId the author, when registered as a collaborator
 * @param assigneeCollaboratorId the assignee, when registered as a collaborator
 * @param sprintNumber sprint the issue was created in
 * @param githubCreatedAt when the issue was created on GitHub
 * @param githubClosedAt when the issue was closed on GitHub
 * @param createdAt when the row was first stored
 * @param updatedAt when the row was last written
 */
public record Issue(long id, long repositoryId, int githubNumber, String title, @Nullable String body, String state,
		@Nullable Long authorCollaboratorId, @Nullable Long assigneeCollaboratorId, int sprintNumber,
		LocalDateTime githubCreatedAt, @Nullable LocalDateTime githubClosedAt, LocalDateTime createdAt,
		LocalDateTime updatedAt) {

	public static final String STATE_OPEN = "open";

	public static final String STATE_CLOSED = "closed";

	public boolean isClosed() {
		return STATE_CLOSED.equals(state);
	}

}
