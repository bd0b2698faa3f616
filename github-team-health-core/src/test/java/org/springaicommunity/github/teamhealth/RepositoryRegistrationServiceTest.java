package org.springaicommunity.github.teamhealth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("RepositoryRegistrationService Tests")
@ExtendWith(MockitoExtension.class)
class RepositoryRegistrationServiceTest {

	@Mock
	private RepositoryStore repositoryStore;

	private RepositoryRegistrationService service;

	@BeforeEach
	void setUp() {
		service = new RepositoryRegistrationService(repositoryStore, new TeamHealthProperties(),
				Clock.fixed(Instant.parse("2024-03-05T12:00:00Z"), ZoneOffset.UTC));
	}

	private static TrackedRepository stored(RepositoryRegistration r) {
		return new TrackedRepository(1L, r.ownerName(), r.repoName(), r.encryptedToken(), r.trackingStartDate(),
				r.sprintStartDayOfWeek(), r.sprintDurationWeeks(), LocalDateTime.of(2024, 3, 5, 12, 0));
	}

	@Test
	@DisplayName("Should apply defaults and trim names")
	void appliesDefaults() {
		when(repositoryStore.findByOwnerAndName("acme", "app")).thenReturn(Optional.empty());
		when(repositoryStore.save(any())).thenAnswer(invocation -> stored(invocation.getArgument(0)));

		OperationResult<TrackedRepository> result = service.register(RepositoryRegistration.of(" acme ", "app "));

		ArgumentCaptor<RepositoryRegistration> captor = ArgumentCaptor.forClass(RepositoryRegistration.class);
		verify(repositoryStore).save(captor.capture());
		RepositoryRegistration saved = captor.getValue();
		assertThat(saved.ownerName()).isEqualTo("acme");
		assertThat(saved.repoName()).isEqualTo("app");
		assertThat(saved.trackingStartDate()).isEqualTo(LocalDate.of(2024, 3, 5));
		assertThat(saved.sprintStartDayOfWeek()).isEqualTo(6);
		assertThat(saved.sprintDurationWeeks()).isEqualTo(1);
		assertThat(result.getValue().fullName()).isEqualTo("acme/app");
	}

	@Test
	@DisplayName("Should reject blank names")
	void rejectsBlankNames() {
		OperationResult<TrackedRepository> result = service.register(RepositoryRegistration.of("acme", "  "));

		assertThat(result.getFailure().kind()).isEqualTo(OperationResult.FailureKind.INVALID_INPUT);
		verifyNoInteractions(repositoryStore);
	}

	@Test
	@DisplayName("Should reject unsupported sprint lengths")
	void rejectsSprintLength() {
		OperationResult<TrackedRepository> result = service
			.register(new RepositoryRegistration("acme", "app", null, null, 1, 3));

		assertThat(result.getFailure().kind()).isEqualTo(OperationResult.FailureKind.INVALID_INPUT);
		assertThat(result.getFailure().message()).contains("1 or 2 weeks");
	}

	@Test
	@DisplayName("Should reject invalid start day")
	void rejectsStartDay() {
		OperationResult<TrackedRepository> result = service
			.register(new RepositoryRegistration("acme", "app", null, null, 7, 1));

		assertThat(result.getFailure().kind()).isEqualTo(OperationResult.FailureKind.INVALID_INPUT);
	}

	@Test
	@DisplayName("Should refuse duplicates")
	void refusesDuplicates() {
		when(repositoryStore.findByOwnerAndName("acme", "app")).thenReturn(Optional.of(TestIssues.repository()));

		OperationResult<TrackedRepository> result = service.register(RepositoryRegistration.of("acme", "app"));

		assertThat(result.getFailure().kind()).isEqualTo(OperationResult.FailureKind.ALREADY_EXISTS);
		verify(repositoryStore, never()).save(any());
	}

}
