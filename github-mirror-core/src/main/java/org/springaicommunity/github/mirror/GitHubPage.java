package org.springaicommunity.github.mirror;

import org.jspecify.annotations.Nullable;

/**
 * One page of a paginated GitHub listing.
 *
 * @param body response body (a JSON array for listings)
 * @param nextUrl URL of the {@code rel="next"} page, or null on the last page
 */
public record GitHubPage(String body, @Nullable String nextUrl) {

	public boolean hasNext() {
		return nextUrl != null;
	}

}
