package org.springaicommunity.github.teamhealth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@DisplayName("SprintDashboardService Tests")
@ExtendWith(MockitoExtension.class)
class SprintDashboardServiceTest {

	@Mock
	private RepositoryStore repositoryStore;

	@Mock
	private CollaboratorStore collaboratorStore;

	@Mock
	private IssueStore issueStore;

	@Mock
	private EvaluationStore evaluationStore;

	private SprintDashboardService service;

	private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 16, 10, 0);

	private static final LocalDateTime T = LocalDateTime.of(2024, 1, 14, 9, 0);

	@BeforeEach
	void setUp() {
		service = new SprintDashboardService(repositoryStore, collaboratorStore, issueStore, evaluationStore,
				Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
	}

	private static Evaluation evaluation(long issueId, Integer speed, Integer quality) {
		return new Evaluation(issueId, issueId, speed, speed != null ? "S" : null, speed != null ? T : null, quality,
				quality != null ? "B" : null, null, quality != null ? T : null, null, null, null, null);
	}

	@Test
	@DisplayName("Should aggregate the current sprint overall and per author")
	void aggregatesSprint() {
		Issue alicesClosed = TestIssues.authoredBy(TestIssues.closed(1, T, T.plusHours(20)), 10L);
		Issue alicesOpen = TestIssues.authoredBy(TestIssues.open(2, T), 10L);
		Issue anonymous = TestIssues.closed(3, T, T.plusHours(100));
		when(repositoryStore.findById(1L)).thenReturn(Optional.of(TestIssues.repository()));
		when(issueStore.findByRepositoryIdAndSprintNumber(1L, 2))
			.thenReturn(List.of(alicesClosed, alicesOpen, anonymous));
		when(evaluationStore.findByIssueIds(anyCollection()))
			.thenReturn(List.of(evaluation(1, 120, 70), evaluation(2, null, 81), evaluation(3, 40, null)));
		when(collaboratorStore.findByRepositoryId(1L)).thenReturn(
				List.of(new Collaborator(10L, 1L, "alice", "Alice"), new Collaborator(11L, 1L, "bob", null)));

		SprintDashboard dashboard = service.dashboard(1L, 0).getValue();

		assertThat(dashboard.sprint().number().value()).isEqualTo(2);
		assertThat(dashboard.sprint().current()).isTrue();
		IssueStats overall = dashboard.overall();
		assertThat(overall.total()).isEqualTo(3);
		assertThat(overall.closed()).isEqualTo(2);
		assertThat(overall.open()).isEqualTo(1);
		assertThat(overall.averageSpeed()).isEqualTo(80);
		assertThat(overall.averageQuality()).isEqualTo(76);
		assertThat(overall.averageConsistency()).isNull();
		assertThat(overall.averageLeadTime()).isNotNull();
		assertThat(overall.averageLeadTime().leadTimeDays()).isEqualTo(2.5);
		assertThat(overall.averageLeadTime().score().value()).isEqualTo(80);

		assertThat(dashboard.collaborators()).hasSize(1);
		CollaboratorStats alice = dashboard.collaborators().get(0);
		assertThat(alice.collaborator().githubUserName()).isEqualTo("alice");
		assertThat(alice.stats().total()).isEqualTo(2);
		assertThat(alice.stats().averageSpeed()).isEqualTo(120);
	}

	@Test
	@DisplayName("Empty sprint has no averages")
	void emptySprint() {
		when(repositoryStore.findById(1L)).thenReturn(Optional.of(TestIssues.repository()));
		when(issueStore.findByRepositoryIdAndSprintNumber(1L, 1)).thenReturn(List.of());
		when(collaboratorStore.findByRepositoryId(1L)).thenReturn(List.of());

		SprintDashboard dashboard = service.dashboard(1L, -1).getValue();

		assertThat(dashboard.sprint().current()).isFalse();
		assertThat(dashboard.overall().total()).isZero();
		assertThat(dashboard.overall().averageQuality()).isNull();
		assertThat(dashboard.overall().averageLeadTime()).isNull();
		verifyNoInteractions(evaluationStore);
	}

	@Test
	@DisplayName("Unknown repository is not found")
	void unknownRepository() {
		when(repositoryStore.findById(1L)).thenReturn(Optional.empty());

		assertThat(service.dashboard(1L, 0).getFailure().kind()).isEqualTo(OperationResult.FailureKind.NOT_FOUND);
	}

}
