package org.springaicommunity.github.teamhealth.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.teamhealth.BatchEvaluationResult;
import org.springaicommunity.github.teamhealth.BatchEvaluationService;
import org.springaicommunity.github.teamhealth.BatchItemResult;
import org.springaicommunity.github.teamhealth.CollaboratorRegistration;
import org.springaicommunity.github.teamhealth.CollaboratorRegistrationService;
import org.springaicommunity.github.teamhealth.CollaboratorStats;
import org.springaicommunity.github.teamhealth.EvaluationOutcome;
import org.springaicommunity.github.teamhealth.EvaluationService;
import org.springaicommunity.github.teamhealth.Issue;
import org.springaicommunity.github.teamhealth.IssueStats;
import org.springaicommunity.github.teamhealth.IssueStore;
import org.springaicommunity.github.teamhealth.OperationResult;
import org.springaicommunity.github.teamhealth.RepositoryRegistration;
import org.springaicommunity.github.teamhealth.RepositoryRegistrationService;
import org.springaicommunity.github.teamhealth.RepositoryStore;
import org.springaicommunity.github.teamhealth.RepositorySyncReport;
import org.springaicommunity.github.teamhealth.RepositorySyncService;
import org.springaicommunity.github.teamhealth.SprintDashboard;
import org.springaicommunity.github.teamhealth.SprintDashboardService;
import org.springaicommunity.github.teamhealth.SyncSummary;
import org.springaicommunity.github.teamhealth.TrackedRepository;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Runs one command per invocation and exits with status 1 when it fails.
 *
 * <p>
 * Usage: java -jar github-team-health-app.jar COMMAND [OPTIONS]
 *
 * <p>
 * Environment Variables: GITHUB_TOKEN - GitHub personal access token, OPENAI_API_KEY -
 * key for the scoring model
 */
@Component
public class TeamHealthCommandRunner implements CommandLineRunner {

	private static final Logger logger = LoggerFactory.getLogger(TeamHealthCommandRunner.class);

	private final ArgumentParser argumentParser;

	private final RepositoryStore repositoryStore;

	private final IssueStore issueStore;

	private final RepositoryRegistrationService repositoryRegistrationService;

	private final CollaboratorRegistrationService collaboratorRegistrationService;

	private final RepositorySyncService repositorySyncService;

	private final EvaluationService evaluationService;

	private final BatchEvaluationService batchEvaluationService;

	private final SprintDashboardService sprintDashboardService;

	public TeamHealthCommandRunner(ArgumentParser argumentParser, RepositoryStore repositoryStore,
			IssueStore issueStore, RepositoryRegistrationService repositoryRegistrationService,
			CollaboratorRegistrationService collaboratorRegistrationService,
			RepositorySyncService repositorySyncService, EvaluationService evaluationService,
			BatchEvaluationService batchEvaluationService, SprintDashboardService sprintDashboardService) {
		this.argumentParser = argumentParser;
		this.repositoryStore = repositoryStore;
		this.issueStore = issueStore;
		this.repositoryRegistrationService = repositoryRegistrationService;
		this.collaboratorRegistrationService = collaboratorRegistrationService;
		this.repositorySyncService = repositorySyncService;
		this.evaluationService = evaluationService;
		this.batchEvaluationService = batchEvaluationService;
		this.sprintDashboardService = sprintDashboardService;
	}

	@Override
	public void run(String... args) {
		int exitCode = execute(args);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	/**
	 * Parse and run a command.
	 * @param args command-line arguments
	 * @return the process exit code
	 */
	public int execute(String... args) {
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		CommandLineOptions options;
		try {
			options = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error("{}", e.getMessage());
			logger.error("Run with --help for usage");
			return 1;
		}
		logger.debug("Options: {}", options);

		try {
			return switch (options.command) {
				case REGISTER -> register(options);
				case COLLABORATORS -> registerCollaborators(options);
				case SYNC -> sync(options);
				case EVALUATE -> evaluate(options);
				case DASHBOARD -> dashboard(options);
			};
		}
		catch (RuntimeException e) {
			logger.error("Command {} failed: {}", options.command.name().toLowerCase(), e.getMessage());
			if (options.verbose) {
				logger.error("Stack trace:", e);
			}
			return 1;
		}
	}

	private int register(CommandLineOptions options) {
		OperationResult<TrackedRepository> result = repositoryRegistrationService
			.register(new RepositoryRegistration(options.ownerName(), options.repoName(), null, options.trackingStart,
					options.sprintStartDay, options.sprintWeeks));
		if (!result.isSuccess()) {
			return fail(result);
		}
		TrackedRepository repository = result.getValue();
		logger.info("Registered {} with id {}", repository.fullName(), repository.id());
		logger.info("  Sprint 1 starts: {}", repository.trackingStartDate());
		logger.info("  Sprint length: {} week(s), starting on day {}", repository.sprintDurationWeeks(),
				repository.sprintStartDayOfWeek());
		return 0;
	}

	private int registerCollaborators(CommandLineOptions options) {
		Optional<TrackedRepository> repository = findRepository(options);
		if (repository.isEmpty()) {
			return 1;
		}
		OperationResult<CollaboratorRegistration> result = collaboratorRegistrationService
			.register(repository.get().id(), options.users);
		if (!result.isSuccess()) {
			return fail(result);
		}
		CollaboratorRegistration registration = result.getValue();
		logger.info("Added {} collaborator(s) from {}; {} registered in total", registration.addedCount(),
				registration.source(), registration.collaborators().size());
		if (options.verbose) {
			registration.collaborators().forEach(c -> logger.info("  - {}", c.githubUserName()));
		}
		return 0;
	}

	private int sync(CommandLineOptions options) {
		if (options.allRepositories) {
			List<RepositorySyncReport> reports = repositorySyncService.syncAll();
			reports.forEach(this::logSyncReport);
			return reports.stream().allMatch(RepositorySyncReport::isFullySuccessful) ? 0 : 1;
		}

		Optional<TrackedRepository> repository = findRepository(options);
		if (repository.isEmpty()) {
			return 1;
		}
		OperationResult<RepositorySyncReport> result = repositorySyncService.sync(repository.get().id(),
				options.since);
		if (!result.isSuccess()) {
			return fail(result);
		}
		logSyncReport(result.getValue());
		return result.getValue().isFullySuccessful() ? 0 : 1;
	}

	private void logSyncReport(RepositorySyncReport report) {
		logger.info("Sync of repository {} since {}", report.repositoryId(),
				report.since() != null ? report.since() : "the beginning");
		logger.info("  Issues: {}", describe(report.issues()));
		logger.info("  Pull requests: {}", describe(report.pullRequests()));
		logger.info("  Links: {} linked, {} unlinked, {} failed", report.links().linked(), report.links().unlinked(),
				report.links().failed());
		logger.info("  Watermark advanced: {}", report.watermarkAdvanced());
	}

	private static String describe(OperationResult<SyncSummary> result) {
		if (!result.isSuccess()) {
			return "failed (" + result.getFailure().message() + ")";
		}
		return result.getValue().syncedCount() + " synced, current sprint "
				+ result.getValue().currentSprintNumber();
	}

	private int evaluate(CommandLineOptions options) {
		Optional<TrackedRepository> repository = findRepository(options);
		if (repository.isEmpty()) {
			return 1;
		}

		if (options.issueNumber != null) {
			Optional<Issue> issue = issueStore.findByRepositoryIdAndNumber(repository.get().id(),
					options.issueNumber);
			if (issue.isEmpty()) {
				logger.error("Issue #{} of {} is not synced", options.issueNumber, options.repository);
				return 1;
			}
			EvaluationOutcome outcome = evaluationService.evaluate(issue.get(), options.evaluationType);
			logger.info("Issue #{}: {}", options.issueNumber, describe(outcome));
			return outcome instanceof EvaluationOutcome.Failed ? 1 : 0;
		}

		OperationResult<BatchEvaluationResult> result = batchEvaluationService.evaluate(repository.get().id(),
				options.evaluationType, options.limit);
		if (!result.isSuccess()) {
			return fail(result);
		}
		BatchEvaluationResult batch = result.getValue();
		logger.info("{} evaluation of {} completed", batch.type(), options.repository);
		logger.info("  Evaluated: {}", batch.evaluated());
		logger.info("  Skipped: {}", batch.skipped());
		logger.info("  Failed: {}", batch.failed());
		logger.info("  Remaining: {}", batch.remaining());
		if (batch.rateLimited()) {
			logger.warn("Stopped early after hitting a rate limit; run again later");
		}
		for (BatchItemResult item : batch.items()) {
			if (options.verbose || item.outcome() instanceof EvaluationOutcome.Failed) {
				logger.info("  #{}: {}", item.githubNumber(), describe(item.outcome()));
			}
		}
		return 0;
	}

	private static String describe(EvaluationOutcome outcome) {
		if (outcome instanceof EvaluationOutcome.Evaluated evaluated) {
			return evaluated.score() + " (" + evaluated.grade() + ")";
		}
		if (outcome instanceof EvaluationOutcome.Skipped skipped) {
			return "skipped: " + skipped.reason();
		}
		EvaluationOutcome.Failed failed = (EvaluationOutcome.Failed) outcome;
		return "failed: " + failed.reason() + (failed.retryable() ? " (retryable)" : "");
	}

	private int dashboard(CommandLineOptions options) {
		Optional<TrackedRepository> repository = findRepository(options);
		if (repository.isEmpty()) {
			return 1;
		}
		OperationResult<SprintDashboard> result = sprintDashboardService.dashboard(repository.get().id(),
				options.sprintOffset);
		if (!result.isSuccess()) {
			return fail(result);
		}
		SprintDashboard dashboard = result.getValue();
		logger.info("{} sprint {} ({}){}", dashboard.repository().fullName(), dashboard.sprint().number(),
				dashboard.sprint().period().format(), dashboard.sprint().current() ? " [current]" : "");
		logger.info("  All: {}", describe(dashboard.overall()));
		for (CollaboratorStats stats : dashboard.collaborators()) {
			logger.info("  {}: {}", stats.collaborator().githubUserName(), describe(stats.stats()));
		}
		return 0;
	}

	private static String describe(IssueStats stats) {
		return stats.total() + " issues (" + stats.closed() + " closed, " + stats.open() + " open), speed "
				+ orDash(stats.averageSpeed()) + ", quality " + orDash(stats.averageQuality()) + ", consistency "
				+ orDash(stats.averageConsistency()) + ", lead time "
				+ (stats.averageLeadTime() != null ? stats.averageLeadTime().score().value() : "-");
	}

	private static String orDash(Integer value) {
		return value != null ? value.toString() : "-";
	}

	private Optional<TrackedRepository> findRepository(CommandLineOptions options) {
		Optional<TrackedRepository> repository = repositoryStore.findByOwnerAndName(options.ownerName(),
				options.repoName());
		if (repository.isEmpty()) {
			logger.error("Repository {} is not registered. Run 'register --repo {}' first", options.repository,
					options.repository);
		}
		return repository;
	}

	private static int fail(OperationResult<?> result) {
		OperationResult.Failure<?> failure = result.getFailure();
		logger.error("{}: {}", failure.kind(), failure.message());
		return 1;
	}

}
