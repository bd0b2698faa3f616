package org.springaicommunity.github.teamhealth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Links stored pull requests to the stored issue they close, using GitHub's closing-issue
 * references. A pull request that cannot be resolved is counted and skipped; it never
 * fails the run.
 */
public class PullRequestLinkService {

	private static final Logger logger = LoggerFactory.getLogger(PullRequestLinkService.class);

	private final RepositoryStore repositoryStore;

	private final IssueStore issueStore;

	private final PullRequestStore pullRequestStore;

	private final SourceControlClient sourceControlClient;

	public PullRequestLinkService(RepositoryStore repositoryStore, IssueStore issueStore,
			PullRequestStore pullRequestStore, SourceControlClient sourceControlClient) {
		this.repositoryStore = repositoryStore;
		this.issueStore = issueStore;
		this.pullRequestStore = pullRequestStore;
		this.sourceControlClient = sourceControlClient;
	}

	/**
	 * Link every not yet linked pull request of the repository.
	 * @param repositoryId the repository
	 * @return link counts, or a not-found failure
	 */
	public OperationResult<LinkSummary> linkPullRequests(long repositoryId) {
		Optional<TrackedRepository> found = repositoryStore.findById(repositoryId);
		if (found.isEmpty()) {
			return OperationResult.failure(OperationResult.FailureKind.NOT_FOUND,
					"Repository not found: " + repositoryId);
		}
		TrackedRepository repository = found.get();

		int linked = 0;
		int unlinked = 0;
		int failed = 0;
		for (PullRequest pullRequest : pullRequestStore.findUnlinkedByRepositoryId(repositoryId)) {
			try {
				List<Integer> issueNumbers = sourceControlClient.getLinkedIssuesForPullRequest(repository.ownerName(),
						repository.repoName(), pullRequest.githubNumber());
				Optional<Issue> issue = issueNumbers.stream()
					.map(number -> issueStore.findByRepositoryIdAndNumber(repositoryId, number))
					.flatMap(Optional::stream)
					.findFirst();
				if (issue.isPresent()) {
					pullRequestStore.linkToIssue(pullRequest.id(), issue.get().id());
					linked++;
				}
				else {
					unlinked++;
				}
			}
			catch (RuntimeException e) {
				logger.warn("Could not resolve closing issues of PR #{} in {}: {}", pullRequest.githubNumber(),
						repository.fullName(), e.getMessage());
				failed++;
			}
		}

		logger.info("Linked {} pull requests of {} ({} without closing issue, {} failed)", linked,
				repository.fullName(), unlinked, failed);
		return OperationResult.success(new LinkSummary(linked, unlinked, failed));
	}

}
