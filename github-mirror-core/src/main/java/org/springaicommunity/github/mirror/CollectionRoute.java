package org.springaicommunity.github.mirror;

import java.util.List;
import java.util.Optional;

/**
 * How records of one collection are turned into messages.
 *
 * @param collection stored collection to read
 * @param payloadPath dot path of the message payload; empty for the whole record
 * @param keyPath dot path of the value inserted into the routing key
 * @param routingKeyTemplate {@link String#format} template with one {@code %s}
 */
public record CollectionRoute(String collection, String payloadPath, String keyPath, String routingKeyTemplate) {

	public static final CollectionRoute COMMITS = new CollectionRoute(Retriever.COMMITS, "", "sha", "commit.%s");

	public static final CollectionRoute EVENTS = new CollectionRoute(Retriever.EVENTS, "", "type", "evt.%s");

	public static final CollectionRoute USERS = new CollectionRoute(Retriever.USERS, "", "login", "user.%s");

	public static final CollectionRoute REPOS = new CollectionRoute(Retriever.REPOS, "", "full_name", "repo.%s");

	public static List<CollectionRoute> defaults() {
		return List.of(COMMITS, EVENTS, USERS, REPOS);
	}

	public static Optional<CollectionRoute> forCollection(String collection) {
		return defaults().stream().filter(route -> route.collection().equals(collection)).findFirst();
	}

	public String routingKey(String value) {
		return String.format(routingKeyTemplate, value);
	}

}
