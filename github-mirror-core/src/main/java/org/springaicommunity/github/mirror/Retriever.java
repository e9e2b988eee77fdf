package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Retrieves GitHub entities through the local store.
 *
 * <p>
 * Single entities (users, repositories, commits) go through the {@link RetrievalCache}
 * and are fetched at most once. Entities listed under a parent (followers, organization
 * members, collaborators, watchers, pull requests, commit comments) are merged into the
 * store with {@link CollectionSync}, keyed by a discriminator field.
 *
 * <p>
 * Directly requested entities that do not exist throw {@link NotFoundException}. Items
 * looked up inside a scope return {@link Optional#empty()} when they are gone upstream.
 */
public class Retriever {

	private static final Logger logger = LoggerFactory.getLogger(Retriever.class);

	private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

	public static final String USERS = "users";

	public static final String FOLLOWERS = "followers";

	public static final String COMMITS = "commits";

	public static final String REPOS = "repos";

	public static final String ORG_MEMBERS = "org_members";

	public static final String COMMIT_COMMENTS = "commit_comments";

	public static final String REPO_COLLABORATORS = "repo_collaborators";

	public static final String WATCHERS = "watchers";

	public static final String PULL_REQUESTS = "pull_requests";

	public static final String EVENTS = "events";

	private final GitHubClient client;

	private final ObjectMapper objectMapper;

	private final RetrievalCache cache;

	private final CollectionSync sync;

	private final MirrorProperties properties;

	public Retriever(GitHubClient client, ObjectMapper objectMapper, RetrievalCache cache, CollectionSync sync,
			MirrorProperties properties) {
		this.client = client;
		this.objectMapper = objectMapper;
		this.cache = cache;
		this.sync = sync;
		this.properties = properties;
	}

	// ========== Users and organizations ==========

	public ObjectNode retrieveUser(String login) {
		ObjectNode user = cache.fetchSingle(USERS, Selector.of("login", login), single("/users/" + login))
			.orElseThrow();
		logger.debug("Retrieved {} {}", userType(user), login);
		return user;
	}

	/**
	 * Look a user up by email. The answer is optional information and is not stored.
	 */
	public Optional<ObjectNode> retrieveUserByEmail(String email) {
		return single("/legacy/user/email/" + URLEncoder.encode(email, StandardCharsets.UTF_8)).get();
	}

	/**
	 * Sync the followers of a user; each follower record gets {@code follows = login}.
	 */
	public List<ObjectNode> retrieveUserFollowers(String login) {
		return sync.syncScopedCollection(FOLLOWERS, Selector.of("follows", login),
				List.of(listing("/users/" + login + "/followers")), "login");
	}

	public List<ObjectNode> retrieveOrgs(String login) {
		List<ObjectNode> orgs = new ArrayList<>();
		for (ObjectNode org : listing("/users/" + login + "/orgs")) {
			orgs.add(retrieveOrg(org.path("login").asText()));
		}
		return orgs;
	}

	public ObjectNode retrieveOrg(String org) {
		return retrieveUser(org);
	}

	/**
	 * Sync the members of an organization and return each member's user record.
	 */
	public List<ObjectNode> retrieveOrgMembers(String org) {
		List<ObjectNode> members = sync.syncScopedCollection(ORG_MEMBERS, Selector.of("org", org),
				List.of(listing("/orgs/" + org + "/members")), "login");
		List<ObjectNode> users = new ArrayList<>();
		for (ObjectNode member : members) {
			users.add(retrieveUser(member.path("login").asText()));
		}
		return users;
	}

	// ========== Repositories and commits ==========

	public ObjectNode retrieveRepo(String owner, String repo) {
		Selector selector = Selector.of("owner.login", owner).and("name", repo);
		return cache.fetchSingle(REPOS, selector, single("/repos/" + owner + "/" + repo)).orElseThrow();
	}

	public ObjectNode retrieveCommit(String owner, String repo, String sha) {
		String path = "/repos/" + owner + "/" + repo + "/commits/" + sha;
		return cache.fetchSingle(COMMITS, Selector.of("sha", sha), single(path)).orElseThrow();
	}

	/**
	 * Retrieve the commits reachable from {@code sha} (default branch {@code master} when
	 * null), bounded by {@link MirrorProperties#getCommitPagesNewRepo()} listing pages.
	 */
	public List<ObjectNode> retrieveCommits(String owner, String repo, @Nullable String sha) {
		String from = sha != null ? sha : "master";
		PagedListing listing = new PagedListing(client, objectMapper,
				"/repos/" + owner + "/" + repo + "/commits?sha=" + from + "&per_page=" + properties.getPageSize(),
				properties.getCommitPagesNewRepo());
		List<ObjectNode> commits = new ArrayList<>();
		for (ObjectNode commit : listing) {
			commits.add(retrieveCommit(owner, repo, commit.path("sha").asText()));
		}
		return commits;
	}

	public List<ObjectNode> retrieveCommitComments(String owner, String repo, String sha) {
		Selector scope = repoScope(owner, repo).and("commit_id", sha);
		return sync.syncScopedCollection(COMMIT_COMMENTS, scope,
				List.of(listing("/repos/" + owner + "/" + repo + "/commits/" + sha + "/comments")), "id");
	}

	/**
	 * Retrieve a single commit comment.
	 * @return the comment, or empty if it was deleted upstream
	 */
	public Optional<ObjectNode> retrieveCommitComment(String owner, String repo, long id) {
		Selector scope = repoScope(owner, repo);
		Supplier<Optional<ObjectNode>> fetch = () -> single("/repos/" + owner + "/" + repo + "/comments/" + id).get()
			.map(comment -> {
				comment.put("owner", owner);
				comment.put("repo", repo);
				return comment;
			});
		RetrievalResult result = cache.fetchSingle(COMMIT_COMMENTS, scope.and("id", id), fetch);
		if (!result.isFound()) {
			logger.debug("Commit comment {}/{} {} deleted", owner, repo, id);
		}
		return result.record();
	}

	// ========== Repository-bound collections ==========

	public List<ObjectNode> retrieveRepoCollaborators(String owner, String repo) {
		return sync.syncScopedCollection(REPO_COLLABORATORS, repoScope(owner, repo),
				List.of(listing("/repos/" + owner + "/" + repo + "/collaborators")), "login");
	}

	public Optional<ObjectNode> retrieveRepoCollaborator(String owner, String repo, String login) {
		return sync
			.fetchScopedItem(REPO_COLLABORATORS, repoScope(owner, repo), "login", NODES.textNode(login),
					List.of(listing("/repos/" + owner + "/" + repo + "/collaborators")))
			.record();
	}

	public List<ObjectNode> retrieveWatchers(String owner, String repo) {
		return sync.syncScopedCollection(WATCHERS, repoScope(owner, repo),
				List.of(listing("/repos/" + owner + "/" + repo + "/watchers")), "login");
	}

	public Optional<ObjectNode> retrieveWatcher(String owner, String repo, String login) {
		return sync
			.fetchScopedItem(WATCHERS, repoScope(owner, repo), "login", NODES.textNode(login),
					List.of(listing("/repos/" + owner + "/" + repo + "/watchers")))
			.record();
	}

	/**
	 * Sync open and closed pull requests of a repository.
	 */
	public List<ObjectNode> retrievePullRequests(String owner, String repo) {
		return sync.syncScopedCollection(PULL_REQUESTS, repoScope(owner, repo), pullRequestListings(owner, repo),
				"number");
	}

	public Optional<ObjectNode> retrievePullRequest(String owner, String repo, int number) {
		return sync
			.fetchScopedItem(PULL_REQUESTS, repoScope(owner, repo), "number", NODES.numberNode(number),
					pullRequestListings(owner, repo))
			.record();
	}

	// ========== Events ==========

	/**
	 * Store the current public events that are not stored yet.
	 * @return every current event, in stored form
	 */
	public List<ObjectNode> retrieveEvents() {
		JsonNode events = parse(client.get("/events"), "/events");
		List<ObjectNode> result = new ArrayList<>();
		for (JsonNode event : events) {
			if (event instanceof ObjectNode record && record.hasNonNull("id")) {
				Selector selector = Selector.of("id", record.get("id"));
				result.add(cache.fetchSingle(EVENTS, selector, () -> Optional.of(record)).orElseThrow());
			}
		}
		return result;
	}

	// ========== Helpers ==========

	private List<PagedListing> pullRequestListings(String owner, String repo) {
		String base = "/repos/" + owner + "/" + repo + "/pulls";
		return List.of(listing(base), listing(base + "?state=closed"));
	}

	private PagedListing listing(String path) {
		String separator = path.contains("?") ? "&" : "?";
		return new PagedListing(client, objectMapper, path + separator + "per_page=" + properties.getPageSize());
	}

	private static Selector repoScope(String owner, String repo) {
		return Selector.of("owner", owner).and("repo", repo);
	}

	/**
	 * Fetch function for one entity; 404 and empty bodies mean "does not exist".
	 */
	private Supplier<Optional<ObjectNode>> single(String path) {
		return () -> {
			try {
				JsonNode node = parse(client.get(path), path);
				if (node instanceof ObjectNode record && !record.isEmpty()) {
					return Optional.of(record);
				}
				return Optional.empty();
			}
			catch (GitHubHttpClient.GitHubApiException e) {
				if (e.isNotFound()) {
					return Optional.empty();
				}
				throw e;
			}
		};
	}

	private JsonNode parse(String body, String path) {
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new GitHubHttpClient.GitHubApiException("Unparseable response from " + path, e);
		}
	}

	private static String userType(JsonNode user) {
		return "Organization".equals(user.path("type").asText()) ? "organization" : "user";
	}

}
