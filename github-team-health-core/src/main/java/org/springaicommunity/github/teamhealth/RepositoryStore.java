package org.springaicommunity.github.teamhealth;

import java.util.List;
import java.util.Optional;

/**
 * Persistence operations for tracked repositories.
 */
public interface RepositoryStore {

	Optional<TrackedRepository> findById(long id);

	Optional<TrackedRepository> findByOwnerAndName(String ownerName, String repoName);

	List<TrackedRepository> findAll();

	/**
	 * Store a new repository. Every optional value of the registration has already been
	 * resolved.
	 * @param registration the repository to store
	 * @return the stored repository
	 * @throws IllegalStateException if (ownerName, repoName) is already registered
	 */
	TrackedRepository save(RepositoryRegistration registration);

}
