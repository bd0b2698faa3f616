package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * Outcome of {@link RepositorySyncService#sync(long, LocalDateTime)}.
 *
 * @param repositoryId the synced repository
 * @param since lower bound used for both syncs, null for a full sync
 * @param issues issue sync outcome
 * @param pullRequests pull request sync outcome
 * @param links link outcome, empty when pull request sync failed
 * @param watermarkAdvanced whether the stored watermark moved
 */
public record RepositorySyncReport(long repositoryId, @Nullable LocalDateTime since,
		OperationResult<SyncSummary> issues, OperationResult<SyncSummary> pullRequests, LinkSummary links,
		boolean watermarkAdvanced) {

	public boolean isFullySuccessful() {
		return issues.isSuccess() && pullRequests.isSuccess();
	}

}
