package org.springaicommunity.github.teamhealth.app.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "sync_metadata")
public class SyncMetadataEntity {

	@Id
	@Column(name = "repository_id")
	private Long repositoryId;

	@Column(name = "last_sync_at", nullable = false)
	private LocalDateTime lastSyncAt;

	protected SyncMetadataEntity() {
	}

	public SyncMetadataEntity(Long repositoryId, LocalDateTime lastSyncAt) {
		this.repositoryId = repositoryId;
		this.lastSyncAt = lastSyncAt;
	}

	public Long getRepositoryId() {
		return repositoryId;
	}

	public LocalDateTime getLastSyncAt() {
		return lastSyncAt;
	}

	public void setLastSyncAt(LocalDateTime lastSyncAt) {
		this.lastSyncAt = lastSyncAt;
	}

}
