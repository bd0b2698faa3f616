package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Registers a repository's team members as collaborators.
 *
 * <p>
 * Members come from the first available {@link MemberSource}. Only members not yet
 * registered are inserted, optionally restricted to an allow-list of logins. The result
 * holds every collaborator of the repository afterwards.
 */
public class CollaboratorRegistrationService {

	private static final Logger logger = LoggerFactory.getLogger(CollaboratorRegistrationService.class);

	private final RepositoryStore repositoryStore;

	private final CollaboratorStore collaboratorStore;

	private final List<MemberSource> memberSources;

	public CollaboratorRegistrationService(RepositoryStore repositoryStore, CollaboratorStore collaboratorStore,
			List<MemberSource> memberSources) {
		if (memberSources.isEmpty()) {
			throw new IllegalArgumentException("At least one member source is required");
		}
		this.repositoryStore = repositoryStore;
		this.collaboratorStore = collaboratorStore;
		this.memberSources = List.copyOf(memberSources);
	}

	/**
	 * @param repositoryId the repository
	 * @param selectedUserNames logins allowed to be inserted; null or empty for every member
	 * @return the merged collaborator set, or a failure
	 */
	public OperationResult<CollaboratorRegistration> register(long repositoryId,
			@Nullable List<String> selectedUserNames) {
		Optional<TrackedRepository> found = repositoryStore.findById(repositoryId);
		if (found.isEmpty()) {
			return OperationResult.failure(OperationResult.FailureKind.NOT_FOUND,
					"Repository not found: " + repositoryId);
		}
		TrackedRepository repository = found.get();

		List<GitHubUser> members = null;
		String usedSource = null;
		List<String> reasons = new ArrayList<>();
		try {
			for (MemberSource source : memberSources) {
				MemberSource.MemberLookup lookup = source.lookup(repository.ownerName(), repository.repoName());
				if (lookup instanceof MemberSource.MemberLookup.Available available) {
					members = available.members();
					usedSource = source.name();
					break;
				}
				String reason = ((MemberSource.MemberLookup.Unavailable) lookup).reason();
				logger.info("Member source '{}' unavailable for {}: {}", source.name(), repository.fullName(), reason);
				reasons.add(reason);
			}
		}
		catch (RuntimeException e) {
			logger.error("GitHub fetch failed for members of {}: {}", repository.fullName(), e.getMessage());
			return OperationResult.failure(OperationResult.FailureKind.UPSTREAM_FAILURE,
					"GitHub fetch failed: " + e.getMessage());
		}
		if (members == null || usedSource == null) {
			return OperationResult.failure(OperationResult.FailureKind.UPSTREAM_FAILURE,
					"No member source available: " + String.join("; ", reasons));
		}

		List<Collaborator> existing = collaboratorStore.findByRepositoryId(repositoryId);
		Set<String> registered = new HashSet<>();
		existing.forEach(c -> registered.add(c.githubUserName()));
		Set<String> allowed = selectedUserNames == null || selectedUserNames.isEmpty() ? null
				: new HashSet<>(selectedUserNames);

		List<GitHubUser> candidates = new ArrayList<>();
		for (GitHubUser member : members) {
			if (registered.contains(member.login()) || (allowed != null && !allowed.contains(member.login()))) {
				continue;
			}
			if (registered.add(member.login())) {
				candidates.add(member);
			}
		}

		List<Collaborator> inserted;
		try {
			inserted = candidates.isEmpty() ? List.of() : collaboratorStore.saveAll(repositoryId, candidates);
		}
		catch (RuntimeException e) {
			logger.error("Storing collaborators of {} failed", repository.fullName(), e);
			return OperationResult.failure(OperationResult.FailureKind.PERSISTENCE_FAILURE,
					"Failed to store collaborators: " + e.getMessage());
		}

		List<Collaborator> all = new ArrayList<>(existing);
		all.addAll(inserted);
		logger.info("Registered {} new collaborators for {} from {} ({} total)", inserted.size(),
				repository.fullName(), usedSource, all.size());
		return OperationResult.success(new CollaboratorRegistration(all, inserted.size(), usedSource));
	}

}
