package org.springaicommunity.github.mirror;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTTP client for GitHub REST API calls using the JDK {@link HttpClient}.
 *
 * <p>
 * Extracts rate limit headers from all responses and makes them available via
 * {@link #getLastRateLimitInfo()}. Paginated listings follow the {@code Link} response
 * header.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	private static final Pattern LINK_PART = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"([^\"]+)\"");

	private final HttpClient httpClient;

	private final String apiBaseUrl;

	private final @Nullable String token;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	/**
	 * @param apiBaseUrl base URL that relative paths are resolved against (e.g.
	 * {@code https://api.github.com})
	 * @param token personal access token, or null for unauthenticated access
	 */
	public GitHubHttpClient(String apiBaseUrl, @Nullable String token) {
		this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
		this.token = token;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public String get(String path) {
		return send(resolve(path)).body();
	}

	@Override
	public GitHubPage getPage(String pathOrUrl) {
		HttpResponse<String> response = send(resolve(pathOrUrl));
		String next = response.headers().firstValue("Link").map(GitHubHttpClient::parseNextLink).orElse(null);
		return new GitHubPage(response.body(), next);
	}

	/**
	 * Extract the {@code rel="next"} URL from a {@code Link} header value.
	 * @param linkHeader header value, e.g.
	 * {@code <https://api.github.com/x?page=2>; rel="next", <...>; rel="last"}
	 * @return the next URL, or null if the header has none
	 */
	static @Nullable String parseNextLink(String linkHeader) {
		Matcher matcher = LINK_PART.matcher(linkHeader);
		while (matcher.find()) {
			if ("next".equals(matcher.group(2))) {
				return matcher.group(1);
			}
		}
		return null;
	}

	private String resolve(String path) {
		if (path.startsWith("http")) {
			return path;
		}
		return apiBaseUrl + (path.startsWith("/") ? path : "/" + path);
	}

	private HttpResponse<String> send(String url) {
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Accept", "application/vnd.github.v3+json")
			.header("User-Agent", "github-mirror")
			.GET();
		if (token != null && !token.isBlank()) {
			builder.header("Authorization", "token " + token);
		}

		try {
			HttpResponse<String> response = executeRequest(builder.build());
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
					response.body().length());
			return response;
		}
		catch (RuntimeException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	private HttpResponse<String> executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			// Extract rate limit headers from ALL responses (2xx included)
			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			int used = parseIntHeader(response, "X-RateLimit-Used", -1);

			if (remaining >= 0) {
				this.lastRateLimitInfo = new RateLimitInfo(limit, remaining, reset, used);
				if (remaining < 100) {
					logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
				else {
					logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
			}

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response;
			}
			else if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: Bad credentials. Check your GITHUB_TOKEN.", statusCode,
						response.body(), remaining, reset);
			}
			else if (statusCode == 403) {
				if (remaining == 0) {
					throw new GitHubApiException("Rate limit exceeded. Resets at epoch: " + reset, statusCode,
							response.body(), remaining, reset);
				}
				throw new GitHubApiException("Forbidden: " + response.body(), statusCode, response.body(), remaining,
						reset);
			}
			else if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, response.body(), remaining,
						reset);
			}
			else if (statusCode == 429) {
				throw new GitHubApiException("Too Many Requests (429). Resets at epoch: " + reset, statusCode,
						response.body(), remaining, reset);
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, response.body(), remaining,
						reset);
			}
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when GitHub API calls fail.
	 *
	 * <p>
	 * Carries rate limit information when available, enabling smart retry logic in
	 * {@link RetryingGitHubClient}.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		private final @Nullable String responseBody;

		private final int rateLimitRemaining;

		private final long resetEpochSeconds;

		public GitHubApiException(String message, int statusCode, String responseBody) {
			this(message, statusCode, responseBody, -1, -1);
		}

		public GitHubApiException(String message, int statusCode, String responseBody, int rateLimitRemaining,
				long resetEpochSeconds) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
			this.rateLimitRemaining = rateLimitRemaining;
			this.resetEpochSeconds = resetEpochSeconds;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
			this.rateLimitRemaining = -1;
			this.resetEpochSeconds = -1;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

		public int getRateLimitRemaining() {
			return rateLimitRemaining;
		}

		public long getResetEpochSeconds() {
			return resetEpochSeconds;
		}

		public boolean isNotFound() {
			return statusCode == 404;
		}

		/**
		 * Returns true if this exception represents a rate limit error (either 403 with
		 * remaining=0 or 429).
		 */
		public boolean isRateLimitError() {
			return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
		}

	}

}
