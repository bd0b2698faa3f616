package org.springaicommunity.github.teamhealth.app;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springaicommunity.github.teamhealth.BatchEvaluationResult;
import org.springaicommunity.github.teamhealth.BatchEvaluationService;
import org.springaicommunity.github.teamhealth.CollaboratorRegistrationService;
import org.springaicommunity.github.teamhealth.EvaluationOutcome;
import org.springaicommunity.github.teamhealth.EvaluationService;
import org.springaicommunity.github.teamhealth.EvaluationType;
import org.springaicommunity.github.teamhealth.Issue;
import org.springaicommunity.github.teamhealth.IssueStore;
import org.springaicommunity.github.teamhealth.LinkSummary;
import org.springaicommunity.github.teamhealth.OperationResult;
import org.springaicommunity.github.teamhealth.RepositoryRegistration;
import org.springaicommunity.github.teamhealth.RepositoryRegistrationService;
import org.springaicommunity.github.teamhealth.RepositoryStore;
import org.springaicommunity.github.teamhealth.RepositorySyncReport;
import org.springaicommunity.github.teamhealth.RepositorySyncService;
import org.springaicommunity.github.teamhealth.SprintDashboardService;
import org.springaicommunity.github.teamhealth.SyncSummary;
import org.springaicommunity.github.teamhealth.TrackedRepository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@DisplayName("TeamHealthCommandRunner Tests")
@ExtendWith(MockitoExtension.class)
class TeamHealthCommandRunnerTest {

	@Mock
	private RepositoryStore repositoryStore;

	@Mock
	private IssueStore issueStore;

	@Mock
	private RepositoryRegistrationService repositoryRegistrationService;

	@Mock
	private CollaboratorRegistrationService collaboratorRegistrationService;

	@Mock
	private RepositorySyncService repositorySyncService;

	@Mock
	private EvaluationService evaluationService;

	@Mock
	private BatchEvaluationService batchEvaluationService;

	@Mock
	private SprintDashboardService sprintDashboardService;

	private TeamHealthCommandRunner runner;

	private static final TrackedRepository REPOSITORY = new TrackedRepository(1, "acme", "app", null,
			LocalDate.of(2024, 1, 6), 6, 1, LocalDateTime.of(2024, 1, 6, 0, 0));

	@BeforeEach
	void setUp() {
		runner = new TeamHealthCommandRunner(new ArgumentParser(), repositoryStore, issueStore,
				repositoryRegistrationService, collaboratorRegistrationService, repositorySyncService,
				evaluationService, batchEvaluationService, sprintDashboardService);
	}

	@Test
	@DisplayName("Help exits cleanly without touching services")
	void help() {
		assertThat(runner.execute("--help")).isZero();
		verifyNoInteractions(repositoryStore, repositorySyncService);
	}

	@Test
	@DisplayName("Invalid arguments exit with 1")
	void invalidArguments() {
		assertThat(runner.execute("sync", "--repo", "acme")).isEqualTo(1);
		verifyNoInteractions(repositorySyncService);
	}

	@Test
	@DisplayName("Unregistered repository exits with 1")
	void unregisteredRepository() {
		when(repositoryStore.findByOwnerAndName("acme", "app")).thenReturn(Optional.empty());

		assertThat(runner.execute("dashboard", "--repo", "acme/app")).isEqualTo(1);
		verifyNoInteractions(sprintDashboardService);
	}

	@Nested
	@DisplayName("Register Tests")
	class RegisterTest {

		@Test
		@DisplayName("Passes sprint settings through")
		void passesSettings() {
			when(repositoryRegistrationService.register(any())).thenReturn(OperationResult.success(REPOSITORY));

			assertThat(runner.execute("register", "-r", "acme/app", "--sprint-weeks", "2")).isZero();
			verify(repositoryRegistrationService)
				.register(new RepositoryRegistration("acme", "app", null, null, null, 2));
		}

		@Test
		@DisplayName("Duplicate registration exits with 1")
		void duplicate() {
			when(repositoryRegistrationService.register(any())).thenReturn(OperationResult
				.failure(OperationResult.FailureKind.ALREADY_EXISTS, "Repository already registered: acme/app"));

			assertThat(runner.execute("register", "-r", "acme/app")).isEqualTo(1);
		}

	}

	@Nested
	@DisplayName("Sync Tests")
	class SyncTest {

		@Test
		@DisplayName("Fully successful sync exits with 0")
		void success() {
			when(repositoryStore.findByOwnerAndName("acme", "app")).thenReturn(Optional.of(REPOSITORY));
			when(repositorySyncService.sync(1, null)).thenReturn(OperationResult.success(new RepositorySyncReport(1,
					null, OperationResult.success(new SyncSummary(0, 2)), OperationResult.success(new SyncSummary(0, 2)),
					LinkSummary.empty(), true)));

			assertThat(runner.execute("sync", "-r", "acme/app")).isZero();
		}

		@Test
		@DisplayName("Partially failed sync exits with 1")
		void partialFailure() {
			when(repositoryStore.findByOwnerAndName("acme", "app")).thenReturn(Optional.of(REPOSITORY));
			when(repositorySyncService.sync(eq(1L), isNull())).thenReturn(OperationResult.success(
					new RepositorySyncReport(1, null, OperationResult.success(new SyncSummary(3, 2)),
							OperationResult.failure(OperationResult.FailureKind.UPSTREAM_FAILURE, "GitHub down"),
							LinkSummary.empty(), false)));

			assertThat(runner.execute("sync", "-r", "acme/app")).isEqualTo(1);
		}

		@Test
		@DisplayName("Sync of every repository")
		void syncAll() {
			when(repositorySyncService.syncAll()).thenReturn(List.of());

			assertThat(runner.execute("sync", "--all")).isZero();
			verifyNoInteractions(repositoryStore);
		}

	}

	@Nested
	@DisplayName("Evaluate Tests")
	class EvaluateTest {

		@Test
		@DisplayName("Single issue evaluation")
		void singleIssue() {
			Issue issue = new Issue(3, 1, 7, "Title", null, Issue.STATE_CLOSED, null, null, 1,
					LocalDateTime.of(2024, 1, 8, 9, 0), LocalDateTime.of(2024, 1, 9, 8, 0),
					LocalDateTime.of(2024, 1, 9, 8, 0), LocalDateTime.of(2024, 1, 9, 8, 0));
			when(repositoryStore.findByOwnerAndName("acme", "app")).thenReturn(Optional.of(REPOSITORY));
			when(issueStore.findByRepositoryIdAndNumber(1, 7)).thenReturn(Optional.of(issue));
			when(evaluationService.evaluate(issue, EvaluationType.SPEED))
				.thenReturn(new EvaluationOutcome.Evaluated(120, "S"));

			assertThat(runner.execute("evaluate", "-r", "acme/app", "-t", "speed", "-n", "7")).isZero();
			verifyNoInteractions(batchEvaluationService);
		}

		@Test
		@DisplayName("Failed single evaluation exits with 1")
		void singleIssueFailed() {
			Issue issue = new Issue(3, 1, 7, "Title", null, Issue.STATE_OPEN, null, null, 1,
					LocalDateTime.of(2024, 1, 8, 9, 0), null, LocalDateTime.of(2024, 1, 9, 8, 0),
					LocalDateTime.of(2024, 1, 9, 8, 0));
			when(repositoryStore.findByOwnerAndName("acme", "app")).thenReturn(Optional.of(REPOSITORY));
			when(issueStore.findByRepositoryIdAndNumber(1, 7)).thenReturn(Optional.of(issue));
			when(evaluationService.evaluate(issue, EvaluationType.QUALITY))
				.thenReturn(new EvaluationOutcome.Failed("Invalid AI response: no JSON", false, false));

			assertThat(runner.execute("evaluate", "-r", "acme/app", "-t", "quality", "-n", "7")).isEqualTo(1);
		}

		@Test
		@DisplayName("Batch evaluation passes the limit")
		void batch() {
			when(repositoryStore.findByOwnerAndName("acme", "app")).thenReturn(Optional.of(REPOSITORY));
			when(batchEvaluationService.evaluate(1, EvaluationType.QUALITY, 5)).thenReturn(OperationResult
				.success(new BatchEvaluationResult(EvaluationType.QUALITY, 0, 0, 0, 0, false, List.of())));

			assertThat(runner.execute("evaluate", "-r", "acme/app", "-t", "quality", "-l", "5")).isZero();
		}

	}

}
