package org.springaicommunity.github.teamhealth.app.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface EvaluationEntityRepository extends JpaRepository<EvaluationEntity, Long> {

	Optional<EvaluationEntity> findByIssueId(Long issueId);

	List<EvaluationEntity> findByIssueIdIn(Collection<Long> issueIds);

}
