package org.springaicommunity.github.teamhealth.app.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.springaicommunity.github.teamhealth.TrackedRepository;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "repositories",
		uniqueConstraints = @UniqueConstraint(name = "uk_repositories_owner_repo",
				columnNames = { "owner_name", "repo_name" }))
public class RepositoryEntity {

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Long id;

	@Column(name = "owner_name", nullable = false)
	private String ownerName;

	@Column(name = "repo_name", nullable = false)
	private String repoName;

	@Column(name = "encrypted_token", length = 1000)
	private String encryptedToken;

	@Column(name = "tracking_start_date", nullable = false)
	private LocalDate trackingStartDate;

	@Column(name = "sprint_start_day_of_week", nullable = false)
	private int sprintStartDayOfWeek;

	@Column(name = "sprint_duration_weeks", nullable = false)
	private int sprintDurationWeeks;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	public TrackedRepository toRepository() {
		return new TrackedRepository(id, ownerName, repoName, encryptedToken, trackingStartDate, sprintStartDayOfWeek,
				sprintDurationWeeks, createdAt);
	}

	public Long getId() {
		return id;
	}

	public void setId(Long id) {
		this.id = id;
	}

	public String getOwnerName() {
		return ownerName;
	}

	public void setOwnerName(String ownerName) {
		this.ownerName = ownerName;
	}

	public String getRepoName() {
		return repoName;
	}

	public void setRepoName(String repoName) {
		this.repoName = repoName;
	}

	public String getEncryptedToken() {
		return encryptedToken;
	}

	public void setEncryptedToken(String encryptedToken) {
		this.encryptedToken = encryptedToken;
	}

	public LocalDate getTrackingStartDate() {
		return trackingStartDate;
	}

	public void setTrackingStartDate(LocalDate trackingStartDate) {
		this.trackingStartDate = trackingStartDate;
	}

	public int getSprintStartDayOfWeek() {
		return sprintStartDayOfWeek;
	}

	public void setSprintStartDayOfWeek(int sprintStartDayOfWeek) {
		this.sprintStartDayOfWeek = sprintStartDayOfWeek;
	}

	public int getSprintDurationWeeks() {
		return sprintDurationWeeks;
	}

	public void setSprintDurationWeeks(int sprintDurationWeeks) {
		this.sprintDurationWeeks = sprintDurationWeeks;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

}
