package org.springaicommunity.github.teamhealth.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springaicommunity.github.teamhealth.BatchEvaluationService;
import org.springaicommunity.github.teamhealth.CollaboratorRegistrationService;
import org.springaicommunity.github.teamhealth.CollaboratorStore;
import org.springaicommunity.github.teamhealth.ConsistencyEvaluator;
import org.springaicommunity.github.teamhealth.EnvironmentSupport;
import org.springaicommunity.github.teamhealth.EvaluationService;
import org.springaicommunity.github.teamhealth.EvaluationStore;
import org.springaicommunity.github.teamhealth.GitHubClient;
import org.springaicommunity.github.teamhealth.GitHubHttpClient;
import org.springaicommunity.github.teamhealth.GitHubLinkedPullRequestResolver;
import org.springaicommunity.github.teamhealth.GitHubSourceControlClient;
import org.springaicommunity.github.teamhealth.IssueStore;
import org.springaicommunity.github.teamhealth.IssueSyncService;
import org.springaicommunity.github.teamhealth.LinkedPullRequestResolver;
import org.springaicommunity.github.teamhealth.ObjectMapperFactory;
import org.springaicommunity.github.teamhealth.PullRequestLinkService;
import org.springaicommunity.github.teamhealth.PullRequestStore;
import org.springaicommunity.github.teamhealth.PullRequestSyncService;
import org.springaicommunity.github.teamhealth.QualityEvaluator;
import org.springaicommunity.github.teamhealth.RepositoryRegistrationService;
import org.springaicommunity.github.teamhealth.RepositoryStore;
import org.springaicommunity.github.teamhealth.RepositorySyncService;
import org.springaicommunity.github.teamhealth.RetryingGitHubClient;
import org.springaicommunity.github.teamhealth.SourceControlClient;
import org.springaicommunity.github.teamhealth.SourceControlMemberSource;
import org.springaicommunity.github.teamhealth.SpeedEvaluator;
import org.springaicommunity.github.teamhealth.SprintDashboardService;
import org.springaicommunity.github.teamhealth.StructuredOutputParser;
import org.springaicommunity.github.teamhealth.StructuredOutputService;
import org.springaicommunity.github.teamhealth.SyncMetadataStore;
import org.springaicommunity.github.teamhealth.TeamHealthProperties;
import org.springaicommunity.github.teamhealth.app.ai.SpringAiStructuredOutputService;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.time.Clock;

/**
 * Spring wiring for the core services. The core module has no Spring dependency; every
 * service is created here with its collaborators passed in.
 */
@Configuration
public class TeamHealthConfiguration {

	@Value("${GITHUB_TOKEN:}")
	private String githubToken;

	@Value("${team-health.github-api-base:https://api.github.com}")
	private String githubApiBase;

	@Bean
	@ConfigurationProperties(prefix = "team-health")
	public TeamHealthProperties teamHealthProperties() {
		return new TeamHealthProperties();
	}

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public GitHubClient gitHubClient(TeamHealthProperties properties) {
		String token = EnvironmentSupport.require(githubToken, EnvironmentSupport.GITHUB_TOKEN);
		return RetryingGitHubClient.builder()
			.wrapping(new GitHubHttpClient(token, githubApiBase, properties.getGithubRequestTimeout()))
			.maxRetries(properties.getMaxRetries())
			.build();
	}

	@Bean
	public SourceControlClient sourceControlClient(GitHubClient gitHubClient, ObjectMapper objectMapper,
			TeamHealthProperties properties) {
		return new GitHubSourceControlClient(gitHubClient, objectMapper, properties.getPageSize());
	}

	@Bean
	public LinkedPullRequestResolver linkedPullRequestResolver(GitHubClient gitHubClient, ObjectMapper objectMapper,
			TeamHealthProperties properties) {
		return new GitHubLinkedPullRequestResolver(gitHubClient, objectMapper, properties.getDiffCharacterLimit());
	}

	/**
	 * The chat model is resolved on first use, so commands that never score issues run
	 * without an AI provider key.
	 */
	@Bean
	public StructuredOutputService structuredOutputService(@Lazy ChatModel chatModel, ObjectMapper objectMapper) {
		return new SpringAiStructuredOutputService(chatModel, new StructuredOutputParser(objectMapper), objectMapper);
	}

	@Bean
	public SpeedEvaluator speedEvaluator(Clock clock) {
		return new SpeedEvaluator(clock);
	}

	@Bean
	public QualityEvaluator qualityEvaluator(StructuredOutputService structuredOutputService,
			TeamHealthProperties properties, Clock clock) {
		return new QualityEvaluator(structuredOutputService, properties, clock);
	}

	@Bean
	public ConsistencyEvaluator consistencyEvaluator(StructuredOutputService structuredOutputService,
			LinkedPullRequestResolver linkedPullRequestResolver, TeamHealthProperties properties, Clock clock) {
		return new ConsistencyEvaluator(structuredOutputService, linkedPullRequestResolver, properties, clock);
	}

	@Bean
	public RepositoryRegistrationService repositoryRegistrationService(RepositoryStore repositoryStore,
			TeamHealthProperties properties, Clock clock) {
		return new RepositoryRegistrationService(repositoryStore, properties, clock);
	}

	@Bean
	public CollaboratorRegistrationService collaboratorRegistrationService(RepositoryStore repositoryStore,
			CollaboratorStore collaboratorStore, SourceControlClient sourceControlClient) {
		return new CollaboratorRegistrationService(repositoryStore, collaboratorStore,
				SourceControlMemberSource.defaultChain(sourceControlClient));
	}

	@Bean
	public IssueSyncService issueSyncService(RepositoryStore repositoryStore, CollaboratorStore collaboratorStore,
			IssueStore issueStore, SourceControlClient sourceControlClient, Clock clock) {
		return new IssueSyncService(repositoryStore, collaboratorStore, issueStore, sourceControlClient, clock);
	}

	@Bean
	public PullRequestSyncService pullRequestSyncService(RepositoryStore repositoryStore,
			CollaboratorStore collaboratorStore, PullRequestStore pullRequestStore,
			SourceControlClient sourceControlClient, Clock clock) {
		return new PullRequestSyncService(repositoryStore, collaboratorStore, pullRequestStore, sourceControlClient,
				clock);
	}

	@Bean
	public PullRequestLinkService pullRequestLinkService(RepositoryStore repositoryStore, IssueStore issueStore,
			PullRequestStore pullRequestStore, SourceControlClient sourceControlClient) {
		return new PullRequestLinkService(repositoryStore, issueStore, pullRequestStore, sourceControlClient);
	}

	@Bean
	public RepositorySyncService repositorySyncService(RepositoryStore repositoryStore,
			SyncMetadataStore syncMetadataStore, IssueSyncService issueSyncService,
			PullRequestSyncService pullRequestSyncService, PullRequestLinkService pullRequestLinkService,
			Clock clock) {
		return new RepositorySyncService(repositoryStore, syncMetadataStore, issueSyncService, pullRequestSyncService,
				pullRequestLinkService, clock);
	}

	@Bean
	public EvaluationService evaluationService(RepositoryStore repositoryStore, CollaboratorStore collaboratorStore,
			IssueStore issueStore, EvaluationStore evaluationStore, SpeedEvaluator speedEvaluator,
			QualityEvaluator qualityEvaluator, ConsistencyEvaluator consistencyEvaluator) {
		return new EvaluationService(repositoryStore, collaboratorStore, issueStore, evaluationStore, speedEvaluator,
				qualityEvaluator, consistencyEvaluator);
	}

	@Bean
	public BatchEvaluationService batchEvaluationService(RepositoryStore repositoryStore, IssueStore issueStore,
			EvaluationStore evaluationStore, EvaluationService evaluationService, TeamHealthProperties properties) {
		return new BatchEvaluationService(repositoryStore, issueStore, evaluationStore, evaluationService,
				properties);
	}

	@Bean
	public SprintDashboardService sprintDashboardService(RepositoryStore repositoryStore,
			CollaboratorStore collaboratorStore, IssueStore issueStore, EvaluationStore evaluationStore,
			Clock clock) {
		return new SprintDashboardService(repositoryStore, collaboratorStore, issueStore, evaluationStore, clock);
	}

}
