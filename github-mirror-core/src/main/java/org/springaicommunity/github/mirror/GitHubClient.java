package org.springaicommunity.github.mirror;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub REST API HTTP operations.
 *
 * <p>
 * Provides abstraction over the GitHub REST API, enabling testability and decorator
 * implementations (retrying, logging).
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo") or full URL
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a GET request for one page of a paginated listing.
	 * @param pathOrUrl API path or full URL (as found in a {@code Link} header)
	 * @return the page body and the URL of the next page, if any
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	GitHubPage getPage(String pathOrUrl);

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
