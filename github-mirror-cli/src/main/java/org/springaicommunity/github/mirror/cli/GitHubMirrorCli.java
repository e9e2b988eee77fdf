package org.springaicommunity.github.mirror.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.mirror.*;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * GitHub Mirror CLI Application
 *
 * Plain Java command-line application with two commands: {@code mirror} copies GitHub
 * entities into the local store, {@code load} publishes one stored collection to the
 * RabbitMQ topic exchange with publisher confirms.
 *
 * Usage: java -jar github-mirror-cli.jar &lt;mirror|load&gt; [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN (mirror), MIRROR_STORE_DIR, AMQP_HOST, AMQP_PORT,
 * AMQP_USERNAME, AMQP_PASSWORD, AMQP_EXCHANGE
 *
 * Examples:
 * <pre>
 * java -jar github-mirror-cli.jar mirror --repo spring-projects/spring-ai
 * java -jar github-mirror-cli.jar load -c commits -e 1700000000 -b 500
 * </pre>
 */
public class GitHubMirrorCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubMirrorCli.class);

	static final int EXIT_FAILURE = 1;

	static final int EXIT_USAGE = 2;

	static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

	public static void main(String[] args) {
		int exitCode;
		try {
			exitCode = run(args);
		}
		catch (Exception e) {
			logger.error("Run failed: {}", e.getMessage(), e);
			exitCode = EXIT_FAILURE;
		}
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args) {
		MirrorProperties properties = MirrorProperties.fromEnvironment();
		return run(args, properties, GitHubMirrorBuilder.create().properties(properties));
	}

	static int run(String[] args, MirrorProperties properties, GitHubMirrorBuilder builder) {
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			System.err.println(e.getMessage());
			System.err.println("Use --help for usage.");
			return EXIT_USAGE;
		}

		if (config.verbose) {
			enableDebugLogging();
		}
		logger.debug("{}", config);

		if (ParsedConfiguration.LOAD.equals(config.command)) {
			properties.setPublishBatchSize(config.batchSize);
			return load(config, builder);
		}
		return mirror(config, builder);
	}

	private static int load(ParsedConfiguration config, GitHubMirrorBuilder builder) {
		if (config.collection == null) {
			logger.info("No collection given, nothing to load");
			return 0;
		}
		CollectionRoute route = CollectionRoute.forCollection(config.collection)
			.orElseThrow(() -> new IllegalStateException("No route for collection " + config.collection));

		BackpressurePublisher publisher = builder.buildPublisher(route, config.scanFilter());
		CountDownLatch finished = new CountDownLatch(1);
		Thread shutdownHook = shutdownHook(publisher, finished);
		Runtime.getRuntime().addShutdownHook(shutdownHook);
		try {
			publishAndSignal(publisher, finished);
		}
		finally {
			removeShutdownHook(shutdownHook);
		}
		return 0;
	}

	/**
	 * Run the publisher and log its summary, then release a waiting shutdown hook.
	 */
	static PublishResult publishAndSignal(BackpressurePublisher publisher, CountDownLatch finished) {
		try {
			PublishResult result = publisher.run();
			logger.info("Load completed{}", result.cancelled() ? " (cancelled)" : "");
			logger.info("  Collection: {}", result.collection());
			logger.info("  Published: {}", result.published());
			logger.info("  Batches: {}", result.batches());
			logger.info("  Acked: {}", result.acked());
			logger.info("  Nacked: {}", result.nacked());
			logger.info("  Max outstanding: {}", result.maxOutstanding());
			logger.info("  Duration: {}", Duration.between(result.startedAt(), result.finishedAt()));
			return result;
		}
		finally {
			finished.countDown();
		}
	}

	/**
	 * Hook that cancels the publisher and keeps the JVM alive until the run has closed the
	 * broker channel, or {@link #SHUTDOWN_TIMEOUT_SECONDS} have passed.
	 */
	static Thread shutdownHook(BackpressurePublisher publisher, CountDownLatch finished) {
		return new Thread(() -> {
			publisher.cancel();
			try {
				if (!finished.await(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
					logger.warn("Load did not stop within {} seconds of cancellation", SHUTDOWN_TIMEOUT_SECONDS);
				}
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Interrupted while waiting for the load to stop");
			}
		}, "github-mirror-shutdown");
	}

	private static int mirror(ParsedConfiguration config, GitHubMirrorBuilder builder) {
		Retriever retriever = builder.buildRetriever();

		if (config.repository != null) {
			List<String> targets = config.what.isEmpty() ? ArgumentParser.MIRROR_TARGETS : config.what;
			mirrorRepository(retriever, config.owner(), config.repo(), targets);
		}
		if (config.user != null) {
			logger.info("User {}: {}", config.user, retriever.retrieveUser(config.user).path("type").asText("User"));
			logger.info("  Followers: {}", retriever.retrieveUserFollowers(config.user).size());
			logger.info("  Organizations: {}", retriever.retrieveOrgs(config.user).size());
		}
		if (config.org != null) {
			logger.info("Organization {}: {} members", config.org, retriever.retrieveOrgMembers(config.org).size());
		}
		if (config.events) {
			logger.info("Events: {} current", retriever.retrieveEvents().size());
		}
		logger.info("Mirror completed");
		return 0;
	}

	private static void mirrorRepository(Retriever retriever, String owner, String repo, List<String> targets) {
		logger.info("Mirroring {}/{}: {}", owner, repo, targets);
		if (targets.contains("repo")) {
			retriever.retrieveRepo(owner, repo);
		}
		if (targets.contains("commits")) {
			logger.info("  Commits: {}", retriever.retrieveCommits(owner, repo, null).size());
		}
		if (targets.contains("pull_requests")) {
			logger.info("  Pull requests: {}", retriever.retrievePullRequests(owner, repo).size());
		}
		if (targets.contains("watchers")) {
			logger.info("  Watchers: {}", retriever.retrieveWatchers(owner, repo).size());
		}
		if (targets.contains("collaborators")) {
			logger.info("  Collaborators: {}", retriever.retrieveRepoCollaborators(owner, repo).size());
		}
	}

	private static void removeShutdownHook(Thread hook) {
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		}
		catch (IllegalStateException e) {
			// JVM is already shutting down
			logger.debug("Shutdown in progress, hook stays registered");
		}
	}

	private static void enableDebugLogging() {
		Optional.of(LoggerFactory.getLogger("org.springaicommunity.github.mirror"))
			.filter(ch.qos.logback.classic.Logger.class::isInstance)
			.map(ch.qos.logback.classic.Logger.class::cast)
			.ifPresent(mirrorLogger -> mirrorLogger.setLevel(Level.DEBUG));
	}

}
