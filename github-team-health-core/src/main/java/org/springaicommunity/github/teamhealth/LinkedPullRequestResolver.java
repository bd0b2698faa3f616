package org.springaicommunity.github.teamhealth;

import java.util.List;

/**
 * Finds the merged pull requests that reference an issue.
 */
public interface LinkedPullRequestResolver {

	/**
	 * @param repository the repository the issue belongs to
	 * @param issueNumber the GitHub issue number
	 * @return merged pull requests with their content, possibly empty
	 * @throws GitHubHttpClient.GitHubApiException if GitHub cannot be queried
	 */
	List<LinkedPullRequest> findLinkedPullRequests(TrackedRepository repository, int issueNumber);

}
