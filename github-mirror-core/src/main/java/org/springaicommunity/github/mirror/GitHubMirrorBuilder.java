package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Paths;

/**
 * Builder wiring the mirror components.
 *
 * <p>
 * Components built by one builder share a single {@link Persister}, so a retriever and a
 * publisher obtained from the same builder see the same store.
 *
 * <pre>
 * {@code
 * GitHubMirrorBuilder builder = GitHubMirrorBuilder.create()
 *     .tokenFromEnv()
 *     .properties(MirrorProperties.fromEnvironment());
 *
 * Retriever retriever = builder.buildRetriever();
 * retriever.retrievePullRequests("spring-projects", "spring-ai");
 *
 * BackpressurePublisher publisher = builder.buildPublisher(CollectionRoute.COMMITS, ScanFilter.all());
 * PublishResult result = publisher.run();
 *
 * // For testing
 * Retriever testRetriever = GitHubMirrorBuilder.create()
 *     .httpClient(mockClient)
 *     .persister(new InMemoryPersister())
 *     .buildRetriever();
 * }
 * </pre>
 */
public class GitHubMirrorBuilder {

	private @Nullable String token;

	private MirrorProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private @Nullable Persister persister;

	private @Nullable BrokerChannel brokerChannel;

	private GitHubMirrorBuilder() {
		this.properties = new MirrorProperties();
	}

	public static GitHubMirrorBuilder create() {
		return new GitHubMirrorBuilder();
	}

	public GitHubMirrorBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN} (environment or {@code .env}).
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public GitHubMirrorBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.get("GITHUB_TOKEN");
		if (this.token == null || this.token.trim().isEmpty()) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token.");
		}
		return this;
	}

	/**
	 * @param properties configuration properties (null to use defaults)
	 */
	public GitHubMirrorBuilder properties(@Nullable MirrorProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	public GitHubMirrorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Use a custom {@link GitHubClient}. When set, no token is required and no retry
	 * decorator is added.
	 */
	public GitHubMirrorBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Use a custom {@link Persister} instead of the file-system store under
	 * {@link MirrorProperties#getStoreDirectory()}.
	 */
	public GitHubMirrorBuilder persister(@Nullable Persister persister) {
		this.persister = persister;
		return this;
	}

	/**
	 * Use a custom {@link BrokerChannel} instead of connecting to RabbitMQ.
	 */
	public GitHubMirrorBuilder brokerChannel(@Nullable BrokerChannel brokerChannel) {
		this.brokerChannel = brokerChannel;
		return this;
	}

	/**
	 * Build a retriever. Without a custom client, the token falls back to
	 * {@code GITHUB_TOKEN} when none was given.
	 * @throws IllegalStateException if no token is available
	 */
	public Retriever buildRetriever() {
		validateToken();
		Persister store = buildPersister();
		return new Retriever(buildClient(), mapper(), new RetrievalCache(store), new CollectionSync(store),
				properties);
	}

	/**
	 * Build a publisher for one collection. Connects to the broker unless a custom
	 * channel was set.
	 */
	public BackpressurePublisher buildPublisher(CollectionRoute route, ScanFilter filter) {
		BrokerChannel channel = brokerChannel != null ? brokerChannel : RabbitBrokerChannel.open(properties);
		return new BackpressurePublisher(buildPersister(), channel, mapper(), route, filter,
				properties.getPublishBatchSize(), properties.getConfirmPollMs());
	}

	/**
	 * The store shared by everything this builder creates.
	 */
	public Persister buildPersister() {
		if (persister == null) {
			persister = new FileSystemPersister(Paths.get(properties.getStoreDirectory()), mapper());
		}
		return persister;
	}

	private void validateToken() {
		if (httpClient != null) {
			return;
		}
		if (token == null) {
			token = EnvironmentSupport.get("GITHUB_TOKEN");
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
	}

	private GitHubClient buildClient() {
		if (httpClient != null) {
			return httpClient;
		}
		GitHubClient client = new GitHubHttpClient(properties.getApiBaseUrl(), token);
		if (properties.getMaxRetries() > 0) {
			client = RetryingGitHubClient.builder()
				.wrapping(client)
				.maxRetries(properties.getMaxRetries())
				.initialDelayMs(properties.getRetryDelayMs())
				.build();
		}
		return client;
	}

	private ObjectMapper mapper() {
		if (objectMapper == null) {
			objectMapper = ObjectMapperFactory.create();
		}
		return objectMapper;
	}

}
