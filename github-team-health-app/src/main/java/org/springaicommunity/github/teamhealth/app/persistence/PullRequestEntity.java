package org.springaicommunity.github.teamhealth.app.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.springaicommunity.github.teamhealth.PullRequest;
import org.springaicommunity.github.teamhealth.PullRequestUpsert;

import java.time.LocalDateTime;

@Entity
@Table(name = "pull_requests",
		uniqueConstraints = @UniqueConstraint(name = "uk_pull_requests_repository_number",
				columnNames = { "repository_id", "github_number" }),
		indexes = @Index(name = "idx_pull_requests_issue", columnList = "issue_id"))
public class PullRequestEntity {

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Long id;

	@Column(name = "repository_id", nullable = false)
	private Long repositoryId;

	@Column(name = "github_number", nullable = false)
	private int githubNumber;

	@Column(name = "title", nullable = false, length = 1000)
	private String title;

	@Column(name = "body", length = 100000)
	private String body;

	@Column(name = "state", nullable = false, length = 20)
	private String state;

	@Column(name = "issue_id")
	private Long issueId;

	@Column(name = "author_collaborator_id")
	private Long authorCollaboratorId;

	@Column(name = "github_created_at", nullable = false)
	private LocalDateTime githubCreatedAt;

	@Column(name = "github_merged_at")
	private LocalDateTime githubMergedAt;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	/**
	 * Copy the synced values onto this row. The issue link is not touched.
	 */
	public void apply(PullRequestUpsert upsert, LocalDateTime now) {
		this.repositoryId = upsert.repositoryId();
		this.githubNumber = upsert.githubNumber();
		this.title = upsert.title();
		this.body = upsert.body();
		this.state = upsert.state();
		this.authorCollaboratorId = upsert.authorCollaboratorId();
		this.githubCreatedAt = upsert.githubCreatedAt();
		this.githubMergedAt = upsert.githubMergedAt();
		if (this.createdAt == null) {
			this.createdAt = now;
		}
		this.updatedAt = now;
	}

	public PullRequest toPullRequest() {
		return new PullRequest(id, repositoryId, githubNumber, title, body, state, issueId, authorCollaboratorId,
				githubCreatedAt, githubMergedAt, createdAt, updatedAt);
	}

	public Long getId() {
		return id;
	}

	public void setId(Long id) {
		this.id = id;
	}

	public Long getRepositoryId() {
		return repositoryId;
	}

	public int getGithubNumber() {
		return githubNumber;
	}

	public String getTitle() {
		return title;
	}

	public String getState() {
		return state;
	}

	public Long getIssueId() {
		return issueId;
	}

	public void setIssueId(Long issueId) {
		this.issueId = issueId;
	}

	public LocalDateTime getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(LocalDateTime updatedAt) {
		this.updatedAt = updatedAt;
	}

}
