package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Syncs everything for one repository: issues, pull requests and pull request links.
 *
 * <p>
 * Issue sync and pull request sync run independently; a failure of one does not stop
 * the other. The watermark moves to the time this run started, and only when both syncs
 * succeeded, so anything updated during a failed run is fetched again next time.
 */
public class RepositorySyncService {

	private static final Logger logger = LoggerFactory.getLogger(RepositorySyncService.class);

	private final RepositoryStore repositoryStore;

	private final SyncMetadataStore syncMetadataStore;

	private final IssueSyncService issueSyncService;

	private final PullRequestSyncService pullRequestSyncService;

	private final PullRequestLinkService pullRequestLinkService;

	private final Clock clock;

	public RepositorySyncService(RepositoryStore repositoryStore, SyncMetadataStore syncMetadataStore,
			IssueSyncService issueSyncService, PullRequestSyncService pullRequestSyncService,
			PullRequestLinkService pullRequestLinkService, Clock clock) {
		this.repositoryStore = repositoryStore;
		this.syncMetadataStore = syncMetadataStore;
		this.issueSyncService = issueSyncService;
		this.pullRequestSyncService = pullRequestSyncService;
		this.pullRequestLinkService = pullRequestLinkService;
		this.clock = clock;
	}

	/**
	 * Sync one repository.
	 * @param repositoryId the repository
	 * @param since explicit lower bound; when null the stored watermark is used, and a
	 * repository never synced gets a full sync
	 * @return the per-step outcome, or a not-found failure
	 */
	public OperationResult<RepositorySyncReport> sync(long repositoryId, @Nullable LocalDateTime since) {
		if (repositoryStore.findById(repositoryId).isEmpty()) {
			return OperationResult.failure(OperationResult.FailureKind.NOT_FOUND,
					"Repository not found: " + repositoryId);
		}

		LocalDateTime startedAt = LocalDateTime.now(clock);
		LocalDateTime effectiveSince = since != null ? since
				: syncMetadataStore.findLastSyncAt(repositoryId).orElse(null);

		OperationResult<SyncSummary> issues = issueSyncService.sync(repositoryId, effectiveSince);
		OperationResult<SyncSummary> pullRequests = pullRequestSyncService.sync(repositoryId, effectiveSince);

		OperationResult<LinkSummary> links = pullRequests.isSuccess()
				? pullRequestLinkService.linkPullRequests(repositoryId) : OperationResult.success(LinkSummary.empty());

		boolean watermarkAdvanced = false;
		if (issues.isSuccess() && pullRequests.isSuccess()) {
			syncMetadataStore.recordSuccessfulSync(repositoryId, startedAt);
			watermarkAdvanced = true;
		}
		else {
			logger.warn("Watermark of repository {} not advanced: {}", repositoryId,
					String.join("; ", failureMessages(issues, pullRequests)));
		}

		return OperationResult.success(new RepositorySyncReport(repositoryId, effectiveSince, issues, pullRequests,
				links.isSuccess() ? links.getValue() : LinkSummary.empty(), watermarkAdvanced));
	}

	/**
	 * Sync every registered repository. Repositories are independent of each other.
	 */
	public List<RepositorySyncReport> syncAll() {
		List<RepositorySyncReport> reports = new ArrayList<>();
		for (TrackedRepository repository : repositoryStore.findAll()) {
			OperationResult<RepositorySyncReport> result = sync(repository.id(), null);
			if (result.isSuccess()) {
				reports.add(result.getValue());
			}
		}
		return reports;
	}

	private static List<String> failureMessages(OperationResult<?>... results) {
		List<String> messages = new ArrayList<>();
		for (OperationResult<?> result : results) {
			if (!result.isSuccess()) {
				messages.add(result.getFailure().message());
			}
		}
		return messages;
	}

}
