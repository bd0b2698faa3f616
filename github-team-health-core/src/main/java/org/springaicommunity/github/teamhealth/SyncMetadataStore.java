package org.springaicommunity.github.teamhealth;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Stores the sync watermark of each repository.
 */
public interface SyncMetadataStore {

	Optional<LocalDateTime> findLastSyncAt(long repositoryId);

	void recordSuccessfulSync(long repositoryId, LocalDateTime syncedAt);

}
