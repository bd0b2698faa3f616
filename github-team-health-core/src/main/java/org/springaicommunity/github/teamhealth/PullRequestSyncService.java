package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Copies a repository's GitHub pull requests into the {@link PullRequestStore}.
 *
 * <p>
 * Mirrors {@link IssueSyncService}. Linking pull requests to issues is left to
 * {@link PullRequestLinkService}.
 */
public class PullRequestSyncService {

	private static final Logger logger = LoggerFactory.getLogger(PullRequestSyncService.class);

	private final RepositoryStore repositoryStore;

	private final CollaboratorStore collaboratorStore;

	private final PullRequestStore pullRequestStore;

	private final SourceControlClient sourceControlClient;

	private final Clock clock;

	public PullRequestSyncService(RepositoryStore repositoryStore, CollaboratorStore collaboratorStore,
			PullRequestStore pullRequestStore, SourceControlClient sourceControlClient, Clock clock) {
		this.repositoryStore = repositoryStore;
		this.collaboratorStore = collaboratorStore;
		this.pullRequestStore = pullRequestStore;
		this.sourceControlClient = sourceControlClient;
		this.clock = clock;
	}

	public OperationResult<SyncSummary> sync(long repositoryId, @Nullable LocalDateTime since) {
		Optional<TrackedRepository> found = repositoryStore.findById(repositoryId);
		if (found.isEmpty()) {
			return OperationResult.failure(OperationResult.FailureKind.NOT_FOUND,
					"Repository not found: " + repositoryId);
		}
		TrackedRepository repository = found.get();
		logger.info("Syncing pull requests of {} since {}", repository.fullName(),
				since != null ? since : "the beginning");

		List<GitHubPullRequest> remotePullRequests;
		try {
			remotePullRequests = sourceControlClient.getPullRequests(repository.ownerName(), repository.repoName(),
					since);
		}
		catch (RuntimeException e) {
			logger.error("GitHub fetch failed for pull requests of {}: {}", repository.fullName(), e.getMessage());
			return OperationResult.failure(OperationResult.FailureKind.UPSTREAM_FAILURE,
					"GitHub fetch failed: " + e.getMessage());
		}

		int currentSprint = repository.sprintCalculator().currentSprint(clock).number().value();
		if (remotePullRequests.isEmpty()) {
			return OperationResult.success(new SyncSummary(0, currentSprint));
		}

		CollaboratorResolver collaborators = new CollaboratorResolver(
				collaboratorStore.findByRepositoryId(repositoryId));
		List<PullRequestUpsert> upserts = remotePullRequests.stream()
			.map(pr -> new PullRequestUpsert(repositoryId, pr.number(), pr.title(), pr.body(), pr.state(),
					collaborators.resolve(pr.authorLogin()), pr.createdAt(), pr.mergedAt()))
			.toList();

		try {
			pullRequestStore.upsertAll(upserts);
		}
		catch (RuntimeException e) {
			logger.error("Storing {} pull requests of {} failed", upserts.size(), repository.fullName(), e);
			return OperationResult.failure(OperationResult.FailureKind.PERSISTENCE_FAILURE,
					"Failed to store pull requests: " + e.getMessage());
		}

		logger.info("Synced {} pull requests of {}", upserts.size(), repository.fullName());
		return OperationResult.success(new SyncSummary(upserts.size(), currentSprint));
	}

}
