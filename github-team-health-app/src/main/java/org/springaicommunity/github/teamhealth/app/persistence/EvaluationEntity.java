package org.springaicommunity.github.teamhealth.app.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.springaicommunity.github.teamhealth.Evaluation;

import java.time.LocalDateTime;

/**
 * One row per issue holding a slot for each evaluation type.
 */
@Entity
@Table(name = "evaluations",
		uniqueConstraints = @UniqueConstraint(name = "uk_evaluations_issue", columnNames = { "issue_id" }))
public class EvaluationEntity {

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Long id;

	@Column(name = "issue_id", nullable = false)
	private Long issueId;

	@Column(name = "speed_score")
	private Integer speedScore;

	@Column(name = "speed_grade", length = 2)
	private String speedGrade;

	@Column(name = "speed_calculated_at")
	private LocalDateTime speedCalculatedAt;

	@Column(name = "quality_score")
	private Integer qualityScore;

	@Column(name = "quality_grade", length = 2)
	private String qualityGrade;

	@Column(name = "quality_details", length = 100000)
	private String qualityDetails;

	@Column(name = "quality_calculated_at")
	private LocalDateTime qualityCalculatedAt;

	@Column(name = "consistency_score")
	private Integer consistencyScore;

	@Column(name = "consistency_grade", length = 2)
	private String consistencyGrade;

	@Column(name = "consistency_details", length = 100000)
	private String consistencyDetails;

	@Column(name = "consistency_calculated_at")
	private LocalDateTime consistencyCalculatedAt;

	protected EvaluationEntity() {
	}

	public EvaluationEntity(Long issueId) {
		this.issueId = issueId;
	}

	public Evaluation toEvaluation() {
		return new Evaluation(id, issueId, speedScore, speedGrade, speedCalculatedAt, qualityScore, qualityGrade,
				qualityDetails, qualityCalculatedAt, consistencyScore, consistencyGrade, consistencyDetails,
				consistencyCalculatedAt);
	}

	public void setSpeed(int score, String grade, LocalDateTime calculatedAt) {
		this.speedScore = score;
		this.speedGrade = grade;
		this.speedCalculatedAt = calculatedAt;
	}

	public void setQuality(int score, String grade, String details, LocalDateTime calculatedAt) {
		this.qualityScore = score;
		this.qualityGrade = grade;
		this.qualityDetails = details;
		this.qualityCalculatedAt = calculatedAt;
	}

	public void setConsistency(int score, String grade, String details, LocalDateTime calculatedAt) {
		this.consistencyScore = score;
		this.consistencyGrade = grade;
		this.consistencyDetails = details;
		this.consistencyCalculatedAt = calculatedAt;
	}

	public Long getId() {
		return id;
	}

	public Long getIssueId() {
		return issueId;
	}

	public Integer getSpeedScore() {
		return speedScore;
	}

	public Integer getQualityScore() {
		return qualityScore;
	}

	public String getQualityDetails() {
		return qualityDetails;
	}

	public Integer getConsistencyScore() {
		return consistencyScore;
	}

	public String getConsistencyDetails() {
		return consistencyDetails;
	}

}
