package org.springaicommunity.github.teamhealth;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations for issue evaluations. The evaluation row of an issue is
 * created by the first save; later saves overwrite only their own slot.
 */
public interface EvaluationStore {

	Optional<Evaluation> findByIssueId(long issueId);

	List<Evaluation> findByIssueIds(Collection<Long> issueIds);

	void saveSpeed(long issueId, SpeedEvaluation evaluation);

	void saveQuality(long issueId, QualityEvaluation evaluation);

	void saveConsistency(long issueId, ConsistencyEvaluation evaluation);

}
