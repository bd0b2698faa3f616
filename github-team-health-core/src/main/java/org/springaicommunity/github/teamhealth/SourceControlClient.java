package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository data needed by the sync use cases.
 *
 * <p>
 * Every method may throw {@link GitHubHttpClient.GitHubApiException} on transport,
 * authorization or not-found errors.
 */
public interface SourceControlClient {

	RepositoryInfo getRepositoryInfo(String owner, String repo);

	List<GitHubUser> getContributors(String owner, String repo);

	List<GitHubUser> getCollaborators(String owner, String repo);

	/**
	 * All issues updated at or after {@code since}, excluding pull requests.
	 * @param owner repository owner
	 * @param repo repository name
	 * @param since lower bound on the update time, or null for every issue
	 * @return issues in the order GitHub returns them
	 */
	List<GitHubIssue> getIssues(String owner, String repo, @Nullable LocalDateTime since);

	/**
	 * All pull requests updated at or after {@code since}.
	 * @param owner repository owner
	 * @param repo repository name
	 * @param since lower bound on the update time, or null for every pull request
	 * @return pull requests, most recently updated first
	 */
	List<GitHubPullRequest> getPullRequests(String owner, String repo, @Nullable LocalDateTime since);

	/**
	 * Issue numbers a pull request will close when merged.
	 * @param owner repository owner
	 * @param repo repository name
	 * @param prNumber the pull request number
	 * @return closing issue numbers, possibly empty
	 */
	List<Integer> getLinkedIssuesForPullRequest(String owner, String repo, int prNumber);

}
