package org.springaicommunity.github.teamhealth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("CollaboratorRegistrationService Tests")
@ExtendWith(MockitoExtension.class)
class CollaboratorRegistrationServiceTest {

	@Mock
	private RepositoryStore repositoryStore;

	@Mock
	private CollaboratorStore collaboratorStore;

	@Mock
	private SourceControlClient sourceControlClient;

	private CollaboratorRegistrationService service;

	private static final GitHubUser ALICE = new GitHubUser("alice", 1, "Alice");

	private static final GitHubUser BOB = new GitHubUser("bob", 2, null);

	@BeforeEach
	void setUp() {
		service = new CollaboratorRegistrationService(repositoryStore, collaboratorStore,
				SourceControlMemberSource.defaultChain(sourceControlClient));
	}

	private static GitHubHttpClient.GitHubApiException denied(int status) {
		return new GitHubHttpClient.GitHubApiException("HTTP " + status, status, "", 10, 0);
	}

	@Nested
	@DisplayName("Fallback Chain Tests")
	class FallbackTest {

		@BeforeEach
		void repositoryExists() {
			when(repositoryStore.findById(1L)).thenReturn(Optional.of(TestIssues.repository()));
		}

		@Test
		@DisplayName("Contributors answer first")
		void contributorsFirst() {
			when(sourceControlClient.getContributors("acme", "app")).thenReturn(List.of(ALICE, BOB));
			when(collaboratorStore.findByRepositoryId(1L)).thenReturn(List.of());
			when(collaboratorStore.saveAll(eq(1L), anyList()))
				.thenReturn(List.of(new Collaborator(10L, 1L, "alice", "Alice"), new Collaborator(11L, 1L, "bob", null)));

			OperationResult<CollaboratorRegistration> result = service.register(1L, null);

			assertThat(result.getValue().source()).isEqualTo("contributors");
			assertThat(result.getValue().addedCount()).isEqualTo(2);
			verify(sourceControlClient, never()).getCollaborators(any(), any());
		}

		@Test
		@DisplayName("Falls back to collaborators when contributors are forbidden")
		void fallsBackOnForbidden() {
			when(sourceControlClient.getContributors("acme", "app")).thenThrow(denied(403));
			when(sourceControlClient.getCollaborators("acme", "app")).thenReturn(List.of(BOB));
			when(collaboratorStore.findByRepositoryId(1L)).thenReturn(List.of());
			when(collaboratorStore.saveAll(1L, List.of(BOB))).thenReturn(List.of(new Collaborator(11L, 1L, "bob", null)));

			OperationResult<CollaboratorRegistration> result = service.register(1L, null);

			assertThat(result.getValue().source()).isEqualTo("collaborators");
			assertThat(result.getValue().collaborators()).extracting(Collaborator::githubUserName)
				.containsExactly("bob");
		}

		@Test
		@DisplayName("Falls back to issue authors when the others are empty or missing")
		void fallsBackToIssueAuthors() {
			LocalDateTime t = LocalDateTime.of(2024, 1, 8, 9, 0);
			when(sourceControlClient.getContributors("acme", "app")).thenReturn(List.of());
			when(sourceControlClient.getCollaborators("acme", "app")).thenThrow(denied(404));
			when(sourceControlClient.getIssues("acme", "app", null)).thenReturn(List.of(
					new GitHubIssue(1, "a", null, "open", "carol", null, t, t, null, "u1"),
					new GitHubIssue(2, "b", null, "open", "carol", null, t, t, null, "u2")));
			when(collaboratorStore.findByRepositoryId(1L)).thenReturn(List.of());
			when(collaboratorStore.saveAll(eq(1L), anyList()))
				.thenReturn(List.of(new Collaborator(12L, 1L, "carol", null)));

			OperationResult<CollaboratorRegistration> result = service.register(1L, null);

			assertThat(result.getValue().source()).isEqualTo("issue authors");
			assertThat(result.getValue().addedCount()).isEqualTo(1);
		}

		@Test
		@DisplayName("Fails when no source is available")
		void noSourceAvailable() {
			when(sourceControlClient.getContributors("acme", "app")).thenThrow(denied(403));
			when(sourceControlClient.getCollaborators("acme", "app")).thenThrow(denied(403));
			when(sourceControlClient.getIssues("acme", "app", null)).thenReturn(List.of());

			OperationResult<CollaboratorRegistration> result = service.register(1L, null);

			assertThat(result.getFailure().kind()).isEqualTo(OperationResult.FailureKind.UPSTREAM_FAILURE);
			assertThat(result.getFailure().message()).contains("No member source available");
			verifyNoInteractions(collaboratorStore);
		}

		@Test
		@DisplayName("Server errors stop the chain")
		void serverErrorStopsChain() {
			when(sourceControlClient.getContributors("acme", "app"))
				.thenThrow(new GitHubHttpClient.GitHubApiException("Server error", 500, ""));

			OperationResult<CollaboratorRegistration> result = service.register(1L, null);

			assertThat(result.getFailure().kind()).isEqualTo(OperationResult.FailureKind.UPSTREAM_FAILURE);
			verify(sourceControlClient, never()).getCollaborators(any(), any());
		}

	}

	@Nested
	@DisplayName("Merge Tests")
	class MergeTest {

		@BeforeEach
		void repositoryExists() {
			when(repositoryStore.findById(1L)).thenReturn(Optional.of(TestIssues.repository()));
			when(sourceControlClient.getContributors("acme", "app")).thenReturn(List.of(ALICE, BOB));
		}

		@Test
		@DisplayName("Only members not yet registered are inserted")
		void insertsOnlyNewMembers() {
			Collaborator existing = new Collaborator(10L, 1L, "alice", "Alice");
			when(collaboratorStore.findByRepositoryId(1L)).thenReturn(List.of(existing));
			when(collaboratorStore.saveAll(1L, List.of(BOB))).thenReturn(List.of(new Collaborator(11L, 1L, "bob", null)));

			OperationResult<CollaboratorRegistration> result = service.register(1L, null);

			assertThat(result.getValue().addedCount()).isEqualTo(1);
			assertThat(result.getValue().collaborators()).extracting(Collaborator::githubUserName)
				.containsExactly("alice", "bob");
		}

		@Test
		@DisplayName("Selection restricts the inserted members")
		void selectionRestrictsMembers() {
			when(collaboratorStore.findByRepositoryId(1L)).thenReturn(List.of());
			when(collaboratorStore.saveAll(1L, List.of(ALICE)))
				.thenReturn(List.of(new Collaborator(10L, 1L, "alice", "Alice")));

			OperationResult<CollaboratorRegistration> result = service.register(1L, List.of("alice"));

			assertThat(result.getValue().collaborators()).hasSize(1);
		}

		@Test
		@DisplayName("An empty selection means every member")
		void emptySelectionAllowsEveryone() {
			when(collaboratorStore.findByRepositoryId(1L)).thenReturn(List.of());
			when(collaboratorStore.saveAll(1L, List.of(ALICE, BOB))).thenReturn(List
				.of(new Collaborator(10L, 1L, "alice", "Alice"), new Collaborator(11L, 1L, "bob", null)));

			OperationResult<CollaboratorRegistration> result = service.register(1L, List.of());

			assertThat(result.getValue().addedCount()).isEqualTo(2);
		}

		@Test
		@DisplayName("Nothing new means nothing is stored")
		void nothingNew() {
			when(collaboratorStore.findByRepositoryId(1L)).thenReturn(
					List.of(new Collaborator(10L, 1L, "alice", null), new Collaborator(11L, 1L, "bob", null)));

			OperationResult<CollaboratorRegistration> result = service.register(1L, null);

			assertThat(result.getValue().addedCount()).isZero();
			verify(collaboratorStore, never()).saveAll(anyLong(), anyList());
		}

	}

	@Test
	@DisplayName("Unknown repository is not found")
	void unknownRepository() {
		when(repositoryStore.findById(5L)).thenReturn(Optional.empty());

		assertThat(service.register(5L, null).getFailure().kind()).isEqualTo(OperationResult.FailureKind.NOT_FOUND);
	}

}
