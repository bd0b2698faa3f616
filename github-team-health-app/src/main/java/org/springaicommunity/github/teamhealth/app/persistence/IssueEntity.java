package org.springaicommunity.github.teamhealth.app.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.springaicommunity.github.teamhealth.Issue;
import org.springaicommunity.github.teamhealth.IssueUpsert;

import java.time.LocalDateTime;

@Entity
@Table(name = "issues",
		uniqueConstraints = @UniqueConstraint(name = "uk_issues_repository_number",
				columnNames = { "repository_id", "github_number" }),
		indexes = @Index(name = "idx_issues_repository_sprint", columnList = "repository_id, sprint_number"))
public class IssueEntity {

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

	@Column(name = "author_collaborator_id")
	private Long authorCollaboratorId;

	@Column(name = "assignee_collaborator_id")
	private Long assigneeCollaboratorId;

	@Column(name = "sprint_number", nullable = false)
	private int sprintNumber;

	@Column(name = "github_created_at", nullable = false)
	private LocalDateTime githubCreatedAt;

	@Column(name = "github_closed_at")
	private LocalDateTime githubClosedAt;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	/**
	 * Copy the synced values onto this row. Identity columns and {@code createdAt} are left
	 * alone.
	 */
	public void apply(IssueUpsert upsert, LocalDateTime now) {
		this.repositoryId = upsert.repositoryId();
		this.githubNumber = upsert.githubNumber();
		this.title = upsert.title();
		this.body = upsert.body();
		this.state = upsert.state();
		this.authorCollaboratorId = upsert.authorCollaboratorId();
		this.assigneeCollaboratorId = upsert.assigneeCollaboratorId();
		this.sprintNumber = upsert.sprintNumber();
		this.githubCreatedAt = upsert.githubCreatedAt();
		this.githubClosedAt = upsert.githubClosedAt();
		if (this.createdAt == null) {
			this.createdAt = now;
		}
		this.updatedAt = now;
	}

	public Issue toIssue() {
		return new Issue(id, repositoryId, githubNumber, title, body, state, authorCollaboratorId,
				assigneeCollaboratorId, sprintNumber, githubCreatedAt, githubClosedAt, createdAt, updatedAt);
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

	public String getBody() {
		return body;
	}

	public String getState() {
		return state;
	}

	public Long getAuthorCollaboratorId() {
		return authorCollaboratorId;
	}

	public Long getAssigneeCollaboratorId() {
		return assigneeCollaboratorId;
	}

	public int getSprintNumber() {
		return sprintNumber;
	}

	public LocalDateTime getGithubCreatedAt() {
		return githubCreatedAt;
	}

	public LocalDateTime getGithubClosedAt() {
		return githubClosedAt;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public LocalDateTime getUpdatedAt() {
		return updatedAt;
	}

}
