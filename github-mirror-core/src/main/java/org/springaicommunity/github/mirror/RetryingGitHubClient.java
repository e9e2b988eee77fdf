package org.springaicommunity.github.mirror;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Decorator that retries failed requests of a {@link GitHubClient}.
 *
 * <p>
 * Server errors, network failures and rate limit errors (429, or 403 with no remaining
 * requests) are retried with exponential backoff. A rate limit error that carries a reset
 * time waits until that reset instead, as long as it is less than an hour away. Other
 * client errors (including 404) are rethrown immediately.
 *
 * <p>
 * The mirror core never retries on its own; wrapping the HTTP client is the only place
 * where a failed request is attempted again.
 *
 * <pre>
 * {@code
 * GitHubClient client = RetryingGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient(apiBaseUrl, token))
 *     .maxRetries(5)
 *     .initialDelay(Duration.ofSeconds(2))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	private static final long MAX_RESET_WAIT_SECONDS = 3600;

	private final GitHubClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private RetryingGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String path) {
		return execute(() -> delegate.get(path), "GET " + path);
	}

	@Override
	public GitHubPage getPage(String pathOrUrl) {
		return execute(() -> delegate.getPage(pathOrUrl), "GET page " + pathOrUrl);
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return delegate.getLastRateLimitInfo();
	}

	private <T> T execute(Attempt<T> attempt, String description) {
		long delay = initialDelayMs;
		RuntimeException lastFailure = null;

		for (int attemptNumber = 1; attemptNumber <= maxRetries + 1; attemptNumber++) {
			try {
				return attempt.run();
			}
			catch (GitHubHttpClient.GitHubApiException e) {
				if (!isRetryable(e)) {
					throw e;
				}
				lastFailure = e;
				if (attemptNumber <= maxRetries) {
					long waitMs = waitTime(e, delay);
					logger.warn("{} failed (attempt {}/{}): {}. Waiting {}ms...", description, attemptNumber,
							maxRetries + 1, e.getMessage(), waitMs);
					sleep(waitMs);
					delay *= 2;
				}
			}
			catch (RuntimeException e) {
				lastFailure = e;
				if (attemptNumber <= maxRetries) {
					logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, attemptNumber,
							maxRetries + 1, e.getMessage(), delay);
					sleep(delay);
					delay *= 2;
				}
			}
		}

		logger.error("{} failed after {} attempts", description, maxRetries + 1);
		throw lastFailure;
	}

	private static boolean isRetryable(GitHubHttpClient.GitHubApiException e) {
		int status = e.getStatusCode();
		return status < 400 || status >= 500 || e.isRateLimitError();
	}

	private static long waitTime(GitHubHttpClient.GitHubApiException e, long backoffMs) {
		if (!e.isRateLimitError() || e.getResetEpochSeconds() <= 0) {
			return backoffMs;
		}
		long waitSeconds = e.getResetEpochSeconds() - Instant.now().getEpochSecond() + 1;
		if (waitSeconds > 0 && waitSeconds <= MAX_RESET_WAIT_SECONDS) {
			logger.info("Rate limit exceeded. Waiting {} seconds until reset at epoch {}", waitSeconds,
					e.getResetEpochSeconds());
			return waitSeconds * 1000;
		}
		return backoffMs;
	}

	private static void sleep(long ms) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubHttpClient.GitHubApiException("Retry interrupted", e);
		}
	}

	@FunctionalInterface
	private interface Attempt<T> {

		T run();

	}

	/**
	 * Builder for {@link RetryingGitHubClient}. Defaults: 3 retries, 1 second initial
	 * delay.
	 */
	public static class Builder {

		private @Nullable GitHubClient delegate;

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

		private Builder() {
		}

		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * @return configured RetryingGitHubClient
		 * @throws IllegalStateException if no client to wrap was given or a setting is
		 * out of range
		 */
		public RetryingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingGitHubClient(this);
		}

	}

}
