package org.springaicommunity.github.teamhealth;

import java.util.List;
import java.util.Optional;

/**
 * Persistence operations for issues.
 */
public interface IssueStore {

	/**
	 * Insert or update issues keyed by (repositoryId, githubNumber) in a single
	 * transaction. Either every row is written or none is.
	 * @param issues the issues to write
	 * @return the stored issues
	 */
	List<Issue> upsertAll(List<IssueUpsert> issues);

	Optional<Issue> findById(long id);

	Optional<Issue> findByRepositoryIdAndNumber(long repositoryId, int githubNumber);

	List<Issue> findByRepositoryId(long repositoryId);

	List<Issue> findByRepositoryIdAndSprintNumber(long repositoryId, int sprintNumber);

}
