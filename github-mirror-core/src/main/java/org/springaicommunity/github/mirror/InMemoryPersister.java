package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.util.List;

/**
 * {@link Persister} that lives only as long as the process.
 */
public class InMemoryPersister extends AbstractPersister {

	public InMemoryPersister() {
		this(Clock.systemUTC());
	}

	public InMemoryPersister(Clock clock) {
		super(clock);
	}

	@Override
	protected List<ObjectNode> load(String collection) {
		return List.of();
	}

	@Override
	protected void stored(String collection, ObjectNode document) {
	}

}
