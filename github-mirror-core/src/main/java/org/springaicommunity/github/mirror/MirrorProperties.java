package org.springaicommunity.github.mirror;

/**
 * Configuration properties for mirroring and loading.
 *
 * <p>
 * Defaults are suitable for a local RabbitMQ broker and the public GitHub API. Use
 * {@link #fromEnvironment()} to apply overrides from the environment or a {@code .env}
 * file.
 */
public class MirrorProperties {

	/**
	 * Base URL of the GitHub REST API.
	 */
	private String apiBaseUrl = "https://api.github.com";

	/**
	 * Items requested per page of a listing ({@code per_page}).
	 */
	private int pageSize = 100;

	/**
	 * Maximum number of commit listing pages fetched for a repository.
	 */
	private int commitPagesNewRepo = 3;

	/**
	 * Maximum number of retry attempts for failed API requests (0 disables retrying).
	 */
	private int maxRetries = 3;

	/**
	 * Initial delay in milliseconds between retry attempts (doubles on each retry).
	 */
	private long retryDelayMs = 1000;

	/**
	 * Directory holding the file-system store.
	 */
	private String storeDirectory = "mirror-store";

	private String amqpHost = "localhost";

	private int amqpPort = 5672;

	private String amqpUsername = "guest";

	private String amqpPassword = "guest";

	/**
	 * Durable topic exchange records are published to.
	 */
	private String amqpExchange = "github";

	/**
	 * Records read (and at most unconfirmed) per publisher batch.
	 */
	private int publishBatchSize = 1000;

	/**
	 * How often, in milliseconds, the publisher wakes up while waiting for confirms to
	 * check for cancellation.
	 */
	private long confirmPollMs = 500;

	private boolean verbose = false;

	/**
	 * Properties with defaults overridden by {@code GITHUB_API_URL},
	 * {@code MIRROR_STORE_DIR}, {@code AMQP_HOST}, {@code AMQP_PORT},
	 * {@code AMQP_USERNAME}, {@code AMQP_PASSWORD} and {@code AMQP_EXCHANGE}.
	 */
	public static MirrorProperties fromEnvironment() {
		MirrorProperties properties = new MirrorProperties();
		properties.setApiBaseUrl(EnvironmentSupport.get("GITHUB_API_URL", properties.getApiBaseUrl()));
		properties.setStoreDirectory(EnvironmentSupport.get("MIRROR_STORE_DIR", properties.getStoreDirectory()));
		properties.setAmqpHost(EnvironmentSupport.get("AMQP_HOST", properties.getAmqpHost()));
		properties.setAmqpPort(EnvironmentSupport.getInt("AMQP_PORT", properties.getAmqpPort()));
		properties.setAmqpUsername(EnvironmentSupport.get("AMQP_USERNAME", properties.getAmqpUsername()));
		properties.setAmqpPassword(EnvironmentSupport.get("AMQP_PASSWORD", properties.getAmqpPassword()));
		properties.setAmqpExchange(EnvironmentSupport.get("AMQP_EXCHANGE", properties.getAmqpExchange()));
		return properties;
	}

	public String getApiBaseUrl() {
		return apiBaseUrl;
	}

	public void setApiBaseUrl(String apiBaseUrl) {
		this.apiBaseUrl = apiBaseUrl;
	}

	public int getPageSize() {
		return pageSize;
	}

	public void setPageSize(int pageSize) {
		this.pageSize = pageSize;
	}

	public int getCommitPagesNewRepo() {
		return commitPagesNewRepo;
	}

	public void setCommitPagesNewRepo(int commitPagesNewRepo) {
		this.commitPagesNewRepo = commitPagesNewRepo;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public long getRetryDelayMs() {
		return retryDelayMs;
	}

	public void setRetryDelayMs(long retryDelayMs) {
		this.retryDelayMs = retryDelayMs;
	}

	public String getStoreDirectory() {
		return storeDirectory;
	}

	public void setStoreDirectory(String storeDirectory) {
		this.storeDirectory = storeDirectory;
	}

	public String getAmqpHost() {
		return amqpHost;
	}

	public void setAmqpHost(String amqpHost) {
		this.amqpHost = amqpHost;
	}

	public int getAmqpPort() {
		return amqpPort;
	}

	public void setAmqpPort(int amqpPort) {
		this.amqpPort = amqpPort;
	}

	public String getAmqpUsername() {
		return amqpUsername;
	}

	public void setAmqpUsername(String amqpUsername) {
		this.amqpUsername = amqpUsername;
	}

	public String getAmqpPassword() {
		return amqpPassword;
	}

	public void setAmqpPassword(String amqpPassword) {
		this.amqpPassword = amqpPassword;
	}

	public String getAmqpExchange() {
		return amqpExchange;
	}

	public void setAmqpExchange(String amqpExchange) {
		this.amqpExchange = amqpExchange;
	}

	public int getPublishBatchSize() {
		return publishBatchSize;
	}

	public void setPublishBatchSize(int publishBatchSize) {
		this.publishBatchSize = publishBatchSize;
	}

	public long getConfirmPollMs() {
		return confirmPollMs;
	}

	public void setConfirmPollMs(long confirmPollMs) {
		this.confirmPollMs = confirmPollMs;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
