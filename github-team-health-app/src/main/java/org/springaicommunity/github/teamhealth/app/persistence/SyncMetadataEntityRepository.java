package org.springaicommunity.github.teamhealth.app.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SyncMetadataEntityRepository extends JpaRepository<SyncMetadataEntity, Long> {

}
