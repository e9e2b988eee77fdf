package org.springaicommunity.github.mirror;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Command-line argument parser for the {@code mirror} and {@code load} commands.
 */
public class ArgumentParser {

	public static final List<String> MIRROR_TARGETS = List.of("repo", "commits", "pull_requests", "watchers",
			"collaborators");

	private final MirrorProperties defaultProperties;

	public ArgumentParser(MirrorProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-c", "--collection":
					config.collection = getRequiredValue(args, i, "collection").toLowerCase();
					i++;
					break;

				case "-e", "--earliest":
					String earliestStr = getRequiredValue(args, i, "earliest");
					try {
						config.earliest = Long.parseLong(earliestStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid earliest timestamp '" + earliestStr + "': must be seconds since the epoch");
					}
					i++;
					break;

				case "-f", "--filter":
					parseFilters(getRequiredValue(args, i, "filter"), config);
					i++;
					break;

				case "-b", "--batch-size":
					String batchSizeStr = getRequiredValue(args, i, "batch-size");
					try {
						config.batchSize = Integer.parseInt(batchSizeStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid batch size '" + batchSizeStr + "': must be a positive integer");
					}
					i++;
					break;

				case "-r", "--repo":
					config.repository = getRequiredValue(args, i, "repository");
					i++;
					break;

				case "-w", "--what":
					config.what = Arrays.stream(getRequiredValue(args, i, "what").split(","))
						.map(String::trim)
						.filter(s -> !s.isEmpty())
						.map(String::toLowerCase)
						.collect(Collectors.toCollection(ArrayList::new));
					i++;
					break;

				case "-u", "--user":
					config.user = getRequiredValue(args, i, "user");
					i++;
					break;

				case "-o", "--org":
					config.org = getRequiredValue(args, i, "org");
					i++;
					break;

				case "--events":
					config.events = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					if (config.command != null) {
						throw new IllegalArgumentException("Unexpected argument: " + arg);
					}
					config.command = arg.toLowerCase();
					break;
			}
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-mirror <mirror|load> [OPTIONS]\n");
		help.append("\n");
		help.append("Mirror GitHub entities into a local store and publish stored collections to RabbitMQ.\n");
		help.append("\n");
		help.append("COMMON OPTIONS:\n");
		help.append("    -h, --help                  Show this help message\n");
		help.append("    -v, --verbose               Enable debug logging\n");
		help.append("\n");
		help.append("MIRROR OPTIONS:\n");
		help.append("    -r, --repo REPO             Repository in format owner/repo\n");
		help.append("    -w, --what LIST             Comma-separated subset of ")
			.append(String.join(",", MIRROR_TARGETS))
			.append(" (default: all)\n");
		help.append("    -u, --user LOGIN            Mirror a user with followers and organizations\n");
		help.append("    -o, --org ORG               Mirror the members of an organization\n");
		help.append("    --events                    Mirror the current public events\n");
		help.append("\n");
		help.append("LOAD OPTIONS:\n");
		help.append("    -c, --collection NAME       Collection to publish: ")
			.append(CollectionRoute.defaults()
				.stream()
				.map(CollectionRoute::collection)
				.collect(Collectors.joining(", ")))
			.append("\n");
		help.append("    -e, --earliest SECONDS      Only records stored at or after this epoch second\n");
		help.append("    -f, --filter ATTR=REGEXP,.. Only records whose attributes match the expressions\n");
		help.append("    -b, --batch-size SIZE       Messages per confirmed batch (default: ")
			.append(defaultProperties.getPublishBatchSize())
			.append(")\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN                GitHub personal access token (required for mirror)\n");
		help.append("    GITHUB_API_URL              GitHub API base URL\n");
		help.append("    MIRROR_STORE_DIR            Store directory (default: ")
			.append(defaultProperties.getStoreDirectory())
			.append(")\n");
		help.append("    AMQP_HOST, AMQP_PORT, AMQP_USERNAME, AMQP_PASSWORD, AMQP_EXCHANGE\n");
		help.append("                                Broker connection (default exchange: ")
			.append(defaultProperties.getAmqpExchange())
			.append(")\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-mirror mirror --repo spring-projects/spring-ai --what repo,pull_requests\n");
		help.append("    github-mirror mirror --user octocat --events\n");
		help.append("    github-mirror load -c commits -e 1700000000 -f commit.author.name=^A\n");
		help.append("    github-mirror load -c events -b 200 -v\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void parseFilters(String value, ParsedConfiguration config) {
		for (String item : value.split(",")) {
			String trimmed = item.trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			int separator = trimmed.indexOf('=');
			if (separator <= 0) {
				throw new IllegalArgumentException("Invalid filter '" + trimmed + "': must be attribute=regexp");
			}
			String regexp = trimmed.substring(separator + 1);
			try {
				Pattern.compile(regexp);
			}
			catch (PatternSyntaxException e) {
				throw new IllegalArgumentException("Invalid filter '" + trimmed + "': " + e.getDescription());
			}
			config.filters.put(trimmed.substring(0, separator), regexp);
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.command == null) {
			errors.add("A command is required: 'mirror' or 'load'");
		}
		else if (ParsedConfiguration.LOAD.equals(config.command)) {
			if (config.collection != null && CollectionRoute.forCollection(config.collection).isEmpty()) {
				errors.add("Unknown collection: " + config.collection + " (must be one of "
						+ CollectionRoute.defaults()
							.stream()
							.map(CollectionRoute::collection)
							.collect(Collectors.joining(", "))
						+ ")");
			}
			if (config.earliest != null && config.earliest < 0) {
				errors.add("Earliest timestamp must not be negative (got: " + config.earliest + ")");
			}
			else if (config.earliest != null && config.earliest > StoreIds.MAX_EPOCH_SECOND) {
				errors.add("Earliest timestamp must not exceed " + StoreIds.MAX_EPOCH_SECOND + " (got: "
						+ config.earliest + ")");
			}
			if (config.batchSize <= 0) {
				errors.add("Batch size must be positive (got: " + config.batchSize + ")");
			}
		}
		else if (ParsedConfiguration.MIRROR.equals(config.command)) {
			if (config.repository != null
					&& !config.repository.matches("^[a-zA-Z0-9._-]+/[a-zA-Z0-9._-]+$")) {
				errors.add("Repository must be in format 'owner/repo' (e.g., 'spring-projects/spring-ai')");
			}
			for (String target : config.what) {
				if (!MIRROR_TARGETS.contains(target)) {
					errors.add("Invalid mirror target: " + target + " (must be one of "
							+ String.join(", ", MIRROR_TARGETS) + ")");
				}
			}
			if (!config.what.isEmpty() && config.repository == null) {
				errors.add("--what requires --repo");
			}
			if (config.repository == null && config.user == null && config.org == null && !config.events) {
				errors.add("Nothing to mirror: give --repo, --user, --org or --events");
			}
		}
		else {
			errors.add("Unknown command: " + config.command + " (must be 'mirror' or 'load')");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
