package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy, finite sequence of records obtained by following the {@code rel="next"} links of a
 * GitHub listing.
 *
 * <p>
 * Pages are fetched only as the iteration reaches them. Every call to {@link #iterator()}
 * restarts from the first URL. When {@code maxPages} is positive, at most that many pages
 * are fetched.
 */
public final class PagedListing implements Iterable<ObjectNode> {

	private static final Logger logger = LoggerFactory.getLogger(PagedListing.class);

	private final GitHubClient client;

	private final ObjectMapper objectMapper;

	private final String firstUrl;

	private final int maxPages;

	public PagedListing(GitHubClient client, ObjectMapper objectMapper, String firstUrl, int maxPages) {
		this.client = client;
		this.objectMapper = objectMapper;
		this.firstUrl = firstUrl;
		this.maxPages = maxPages;
	}

	/**
	 * Listing without a page bound.
	 */
	public PagedListing(GitHubClient client, ObjectMapper objectMapper, String firstUrl) {
		this(client, objectMapper, firstUrl, 0);
	}

	public String firstUrl() {
		return firstUrl;
	}

	@Override
	public Iterator<ObjectNode> iterator() {
		return new PageIterator();
	}

	@Override
	public String toString() {
		return "PagedListing{" + firstUrl + (maxPages > 0 ? ", maxPages=" + maxPages : "") + '}';
	}

	private final class PageIterator implements Iterator<ObjectNode> {

		private final Deque<ObjectNode> buffer = new ArrayDeque<>();

		private @Nullable String nextUrl = firstUrl;

		private int pagesFetched;

		@Override
		public boolean hasNext() {
			while (buffer.isEmpty() && nextUrl != null) {
				fetchPage(nextUrl);
			}
			return !buffer.isEmpty();
		}

		@Override
		public ObjectNode next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			return buffer.removeFirst();
		}

		private void fetchPage(String url) {
			GitHubPage page = client.getPage(url);
			pagesFetched++;
			nextUrl = (maxPages > 0 && pagesFetched >= maxPages) ? null : page.nextUrl();

			JsonNode items;
			try {
				items = objectMapper.readTree(page.body());
			}
			catch (JsonProcessingException e) {
				throw new GitHubHttpClient.GitHubApiException("Unparseable listing page " + url, e);
			}
			if (items.isArray()) {
				for (JsonNode item : items) {
					if (item instanceof ObjectNode record) {
						buffer.addLast(record);
					}
				}
			}
			else {
				logger.warn("Expected a JSON array from {}, got {}", url, items.getNodeType());
			}
			logger.debug("Page {} of {}: {} items", pagesFetched, firstUrl, buffer.size());
		}

	}

}
