package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Navigation of dot-delimited field paths (e.g. {@code owner.login}) inside stored
 * records.
 */
public final class JsonPaths {

	private JsonPaths() {
	}

	/**
	 * Read the value at a dot-delimited path. An empty path returns the node itself.
	 * @param node the node to navigate
	 * @param path dot-delimited field path
	 * @return the value, or {@link MissingNode} if any segment is absent
	 */
	public static JsonNode read(JsonNode node, String path) {
		if (path.isEmpty()) {
			return node;
		}
		JsonNode target = node;
		for (String segment : path.split("\\.")) {
			target = target.path(segment);
			if (target.isMissingNode()) {
				return MissingNode.getInstance();
			}
		}
		return target;
	}

	/**
	 * Write a value at a dot-delimited path, creating intermediate objects as needed.
	 * @param record the record to modify
	 * @param path dot-delimited field path (must not be empty)
	 * @param value the value to set
	 */
	public static void write(ObjectNode record, String path, JsonNode value) {
		String[] segments = path.split("\\.");
		ObjectNode target = record;
		for (int i = 0; i < segments.length - 1; i++) {
			JsonNode child = target.get(segments[i]);
			if (child instanceof ObjectNode objectChild) {
				target = objectChild;
			}
			else {
				target = target.putObject(segments[i]);
			}
		}
		target.set(segments[segments.length - 1], value);
	}

	/**
	 * Value equality that treats numbers of different widths as equal when their values
	 * are ({@code 5} and {@code 5L}).
	 * @param a first value
	 * @param b second value
	 * @return true if both values are equal
	 */
	public static boolean valuesEqual(JsonNode a, JsonNode b) {
		if (a.isNumber() && b.isNumber()) {
			return a.decimalValue().compareTo(b.decimalValue()) == 0;
		}
		return a.equals(b);
	}

}
