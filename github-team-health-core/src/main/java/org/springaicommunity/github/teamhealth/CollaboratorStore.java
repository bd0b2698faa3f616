package org.springaicommunity.github.teamhealth;

import java.util.List;

/**
 * Persistence operations for repository collaborators.
 */
public interface CollaboratorStore {

	List<Collaborator> findByRepositoryId(long repositoryId);

	/**
	 * Insert collaborators for a repository. Users already registered are skipped.
	 * @param repositoryId the owning repository
	 * @param users the users to register
	 * @return the collaborators that were inserted
	 */
	List<Collaborator> saveAll(long repositoryId, List<GitHubUser> users);

}
