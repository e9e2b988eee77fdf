package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Equality query over stored records: each dot-delimited field path must hold the given
 * value.
 *
 * <p>
 * Two selectors are equal when their path/value sets are equal, regardless of the order
 * in which the entries were added.
 */
public final class Selector {

	private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

	private final Map<String, JsonNode> criteria;

	private Selector(Map<String, JsonNode> criteria) {
		this.criteria = Collections.unmodifiableMap(criteria);
	}

	public static Selector empty() {
		return new Selector(new LinkedHashMap<>());
	}

	public static Selector of(String path, String value) {
		return empty().and(path, value);
	}

	public static Selector of(String path, JsonNode value) {
		return empty().and(path, value);
	}

	/**
	 * Returns a new selector with one more criterion. An existing criterion on the same
	 * path is replaced.
	 */
	public Selector and(String path, JsonNode value) {
		Map<String, JsonNode> next = new LinkedHashMap<>(criteria);
		next.put(path, value);
		return new Selector(next);
	}

	public Selector and(String path, String value) {
		return and(path, NODES.textNode(value));
	}

	public Selector and(String path, long value) {
		return and(path, NODES.numberNode(value));
	}

	/**
	 * Returns a new selector holding the criteria of both selectors; entries of
	 * {@code other} win on conflicting paths.
	 */
	public Selector and(Selector other) {
		Map<String, JsonNode> next = new LinkedHashMap<>(criteria);
		next.putAll(other.criteria);
		return new Selector(next);
	}

	public boolean matches(JsonNode record) {
		for (Map.Entry<String, JsonNode> criterion : criteria.entrySet()) {
			JsonNode actual = JsonPaths.read(record, criterion.getKey());
			if (actual.isMissingNode() || !JsonPaths.valuesEqual(actual, criterion.getValue())) {
				return false;
			}
		}
		return true;
	}

	public Map<String, JsonNode> criteria() {
		return criteria;
	}

	public boolean isEmpty() {
		return criteria.isEmpty();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Selector other)) {
			return false;
		}
		if (!criteria.keySet().equals(other.criteria.keySet())) {
			return false;
		}
		for (Map.Entry<String, JsonNode> criterion : criteria.entrySet()) {
			if (!JsonPaths.valuesEqual(criterion.getValue(), other.criteria.get(criterion.getKey()))) {
				return false;
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		int hash = 0;
		for (Map.Entry<String, JsonNode> criterion : criteria.entrySet()) {
			hash += criterion.getKey().hashCode() ^ valueHash(criterion.getValue());
		}
		return hash;
	}

	// numbers hash by value, consistent with JsonPaths.valuesEqual
	private static int valueHash(JsonNode value) {
		if (value.isNumber()) {
			BigDecimal number = value.decimalValue();
			return number.signum() == 0 ? 0 : number.stripTrailingZeros().hashCode();
		}
		return value.hashCode();
	}

	@Override
	public String toString() {
		return criteria.toString();
	}

}
