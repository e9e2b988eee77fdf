package org.springaicommunity.github.mirror;

import java.time.Instant;

/**
 * Rate limit status parsed from the {@code X-RateLimit-*} response headers.
 *
 * @param limit the maximum number of requests allowed per hour
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds)
 * @param used the number of requests used in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	public boolean isExceeded() {
		return remaining <= 0;
	}

}
