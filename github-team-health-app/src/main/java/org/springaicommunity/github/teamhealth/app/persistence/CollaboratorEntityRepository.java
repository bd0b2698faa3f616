package org.springaicommunity.github.teamhealth.app.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CollaboratorEntityRepository extends JpaRepository<CollaboratorEntity, Long> {

	List<CollaboratorEntity> findByRepositoryIdOrderByGithubUserNameAsc(Long repositoryId);

}
