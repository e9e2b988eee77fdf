package org.springaicommunity.github.mirror;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	public static final String LOAD = "load";

	public static final String MIRROR = "mirror";

	// Command: load or mirror (null when none was given)
	public String command;

	public boolean helpRequested = false;

	public boolean verbose = false;

	// Load options
	public String collection; // null = nothing to load

	public Long earliest; // seconds since epoch, null = no lower bound

	public Map<String, String> filters = new LinkedHashMap<>(); // attribute path -> regexp

	public int batchSize;

	// Mirror options
	public String repository; // owner/repo

	public List<String> what = new ArrayList<>();

	public String user;

	public String org;

	public boolean events = false;

	public ParsedConfiguration(MirrorProperties defaultProperties) {
		this.batchSize = defaultProperties.getPublishBatchSize();
		this.verbose = defaultProperties.isVerbose();
	}

	/**
	 * Scan filter of the load command: attribute patterns plus the store-id floor derived
	 * from {@link #earliest}.
	 */
	public ScanFilter scanFilter() {
		ScanFilter filter = ScanFilter.all();
		for (Map.Entry<String, String> entry : filters.entrySet()) {
			filter = filter.withPattern(entry.getKey(), Pattern.compile(entry.getValue()));
		}
		if (earliest != null) {
			filter = filter.withIdFloor(StoreIds.floorOf(Instant.ofEpochSecond(earliest)));
		}
		return filter;
	}

	public String owner() {
		return repository.split("/")[0];
	}

	public String repo() {
		return repository.split("/")[1];
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "command='" + command + '\'' + ", helpRequested=" + helpRequested
				+ ", verbose=" + verbose + ", collection='" + collection + '\'' + ", earliest=" + earliest
				+ ", filters=" + filters + ", batchSize=" + batchSize + ", repository='" + repository + '\''
				+ ", what=" + what + ", user='" + user + '\'' + ", org='" + org + '\'' + ", events=" + events + '}';
	}

}
