package org.springaicommunity.github.teamhealth.app.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.springaicommunity.github.teamhealth.Collaborator;

import java.time.LocalDateTime;

@Entity
@Table(name = "collaborators",
		uniqueConstraints = @UniqueConstraint(name = "uk_collaborators_repository_login",
				columnNames = { "repository_id", "github_user_name" }))
public class CollaboratorEntity {

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Long id;

	@Column(name = "repository_id", nullable = false)
	private Long repositoryId;

	@Column(name = "github_user_name", nullable = false)
	private String githubUserName;

	@Column(name = "display_name")
	private String displayName;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	public Collaborator toCollaborator() {
		return new Collaborator(id, repositoryId, githubUserName, displayName);
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

	public void setRepositoryId(Long repositoryId) {
		this.repositoryId = repositoryId;
	}

	public String getGithubUserName() {
		return githubUserName;
	}

	public void setGithubUserName(String githubUserName) {
		this.githubUserName = githubUserName;
	}

	public String getDisplayName() {
		return displayName;
	}

	public void setDisplayName(String displayName) {
		this.displayName = displayName;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

}
