package org.springaicommunity.github.teamhealth.app.persistence;

import org.springaicommunity.github.teamhealth.SyncMetadataStore;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

@Component
@Transactional
public class JpaSyncMetadataStore implements SyncMetadataStore {

	private final SyncMetadataEntityRepository syncMetadata;

	public JpaSyncMetadataStore(SyncMetadataEntityRepository syncMetadata) {
		this.syncMetadata = syncMetadata;
	}

	@Override
	@Transactional(readOnly = true)
	public Optional<LocalDateTime> findLastSyncAt(long repositoryId) {
		return syncMetadata.findById(repositoryId).map(SyncMetadataEntity::getLastSyncAt);
	}

	@Override
	public void recordSuccessfulSync(long repositoryId, LocalDateTime syncedAt) {
		SyncMetadataEntity entity = syncMetadata.findById(repositoryId)
			.orElseGet(() -> new SyncMetadataEntity(repositoryId, syncedAt));
		entity.setLastSyncAt(syncedAt);
		syncMetadata.save(entity);
	}

}
