package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Filter applied by the publisher when reading batches: an equality {@link Selector},
 * regular expressions on attribute values, and an optional store-id floor.
 *
 * <p>
 * A pattern matches when it is found anywhere in the textual value of the attribute.
 */
public final class ScanFilter {

	private final Selector selector;

	private final Map<String, Pattern> patterns;

	private final long idFloor;

	private ScanFilter(Selector selector, Map<String, Pattern> patterns, long idFloor) {
		this.selector = selector;
		this.patterns = Collections.unmodifiableMap(patterns);
		this.idFloor = idFloor;
	}

	public static ScanFilter all() {
		return new ScanFilter(Selector.empty(), new LinkedHashMap<>(), 0);
	}

	public ScanFilter withSelector(Selector selector) {
		return new ScanFilter(selector, new LinkedHashMap<>(patterns), idFloor);
	}

	public ScanFilter withPattern(String path, Pattern pattern) {
		Map<String, Pattern> next = new LinkedHashMap<>(patterns);
		next.put(path, pattern);
		return new ScanFilter(selector, next, idFloor);
	}

	public ScanFilter withIdFloor(long idFloor) {
		return new ScanFilter(selector, new LinkedHashMap<>(patterns), idFloor);
	}

	/**
	 * @param record stored record (with its {@code _id})
	 * @return true if the record passes every criterion
	 */
	public boolean matches(JsonNode record) {
		if (record.path(Persister.ID_FIELD).asLong(0) < idFloor) {
			return false;
		}
		if (!selector.matches(record)) {
			return false;
		}
		for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
			JsonNode value = JsonPaths.read(record, entry.getKey());
			if (value.isMissingNode() || value.isNull()) {
				return false;
			}
			String text = value.isValueNode() ? value.asText() : value.toString();
			if (!entry.getValue().matcher(text).find()) {
				return false;
			}
		}
		return true;
	}

	public Selector selector() {
		return selector;
	}

	public Map<String, Pattern> patterns() {
		return patterns;
	}

	public long idFloor() {
		return idFloor;
	}

	@Override
	public String toString() {
		return "ScanFilter{selector=" + selector + ", patterns=" + patterns + ", idFloor=" + idFloor + '}';
	}

}
