package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Copies a repository's GitHub issues into the {@link IssueStore}.
 *
 * <p>
 * Authors and assignees are matched to registered collaborators by login; unknown logins
 * stay null. Each issue is tagged with the sprint of its GitHub creation date. Issues are
 * written in one batch after the whole fetch succeeded, so a failed fetch writes nothing.
 */
public class IssueSyncService {

	private static final Logger logger = LoggerFactory.getLogger(IssueSyncService.class);

	private final RepositoryStore repositoryStore;

	private final CollaboratorStore collaboratorStore;

	private final IssueStore issueStore;

	private final SourceControlClient sourceControlClient;

	private final Clock clock;

	public IssueSyncService(RepositoryStore repositoryStore, CollaboratorStore collaboratorStore,
			IssueStore issueStore, SourceControlClient sourceControlClient, Clock clock) {
		this.repositoryStore = repositoryStore;
		this.collaboratorStore = collaboratorStore;
		this.issueStore = issueStore;
		this.sourceControlClient = sourceControlClient;
		this.clock = clock;
	}

	/**
	 * Sync issues updated since the given time.
	 * @param repositoryId the repository to sync
	 * @param since lower bound on the GitHub update time, or null for a full sync
	 * @return the number of synced issues, or a failure
	 */
	public OperationResult<SyncSummary> sync(long repositoryId, @Nullable LocalDateTime since) {
		Optional<TrackedRepository> found = repositoryStore.findById(repositoryId);
		if (found.isEmpty()) {
			return OperationResult.failure(OperationResult.FailureKind.NOT_FOUND,
					"Repository not found: " + repositoryId);
		}
		TrackedRepository repository = found.get();
		logger.info("Syncing issues of {} since {}", repository.fullName(), since != null ? since : "the beginning");

		List<GitHubIssue> remoteIssues;
		try {
			remoteIssues = sourceControlClient.getIssues(repository.ownerName(), repository.repoName(), since);
		}
		catch (RuntimeException e) {
			logger.error("GitHub fetch failed for issues of {}: {}", repository.fullName(), e.getMessage());
			return OperationResult.failure(OperationResult.FailureKind.UPSTREAM_FAILURE,
					"GitHub fetch failed: " + e.getMessage());
		}

		SprintCalculator calculator = repository.sprintCalculator();
		int currentSprint = calculator.currentSprint(clock).number().value();
		if (remoteIssues.isEmpty()) {
			logger.info("No issues to sync for {}", repository.fullName());
			return OperationResult.success(new SyncSummary(0, currentSprint));
		}

		CollaboratorResolver collaborators = new CollaboratorResolver(
				collaboratorStore.findByRepositoryId(repositoryId));
		List<IssueUpsert> upserts = new ArrayList<>(remoteIssues.size());
		for (GitHubIssue issue : remoteIssues) {
			upserts.add(new IssueUpsert(repositoryId, issue.number(), issue.title(), issue.body(), issue.state(),
					collaborators.resolve(issue.authorLogin()), collaborators.resolve(issue.assigneeLogin()),
					calculator.sprintNumber(issue.createdAt()).value(), issue.createdAt(), issue.closedAt()));
		}

		try {
			issueStore.upsertAll(upserts);
		}
		catch (RuntimeException e) {
			logger.error("Storing {} issues of {} failed", upserts.size(), repository.fullName(), e);
			return OperationResult.failure(OperationResult.FailureKind.PERSISTENCE_FAILURE,
					"Failed to store issues: " + e.getMessage());
		}

		logger.info("Synced {} issues of {} (current sprint {})", upserts.size(), repository.fullName(),
				currentSprint);
		return OperationResult.success(new SyncSummary(upserts.size(), currentSprint));
	}

}
