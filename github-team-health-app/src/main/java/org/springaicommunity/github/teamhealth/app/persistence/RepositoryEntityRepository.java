package org.springaicommunity.github.teamhealth.app.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface RepositoryEntityRepository extends JpaRepository<RepositoryEntity, Long> {

	Optional<RepositoryEntity> findByOwnerNameAndRepoName(String ownerName, String repoName);

	List<RepositoryEntity> findAllByOrderByIdAsc();

}
