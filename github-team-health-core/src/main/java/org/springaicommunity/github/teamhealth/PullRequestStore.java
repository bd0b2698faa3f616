package org.springaicommunity.github.teamhealth;

import java.util.List;

/**
 * Persistence operations for pull requests.
 */
public interface PullRequestStore {

	/**
	 * Insert or update pull requests keyed by (repositoryId, githubNumber) in a single
	 * transaction. Existing issue links are preserved.
	 * @param pullRequests the pull requests to write
	 * @return the stored pull requests
	 */
	List<PullRequest> upsertAll(List<PullRequestUpsert> pullRequests);

	List<PullRequest> findByRepositoryId(long repositoryId);

	List<PullRequest> findUnlinkedByRepositoryId(long repositoryId);

	List<PullRequest> findByIssueId(long issueId);

	void linkToIssue(long pullRequestId, long issueId);

}
