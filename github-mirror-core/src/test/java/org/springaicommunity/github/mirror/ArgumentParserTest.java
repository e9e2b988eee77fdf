package org.springaicommunity.github.mirror;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ArgumentParser using plain JUnit only.
 */
@DisplayName("ArgumentParser Tests")
class ArgumentParserTest {

	private MirrorProperties defaultProperties;

	private ArgumentParser argumentParser;

	@BeforeEach
	void setUp() {
		defaultProperties = new MirrorProperties();
		argumentParser = new ArgumentParser(defaultProperties);
	}

	@Nested
	@DisplayName("Load Command Tests")
	class LoadCommandTest {

		@Test
		@DisplayName("Should parse collection, earliest and batch size")
		void shouldParseLoadOptions() {
			String[] args = { "load", "-c", "commits", "-e", "1700000000", "-b", "250" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.command).isEqualTo(ParsedConfiguration.LOAD);
			assertThat(config.collection).isEqualTo("commits");
			assertThat(config.earliest).isEqualTo(1700000000L);
			assertThat(config.batchSize).isEqualTo(250);
		}

		@Test
		@DisplayName("Batch size should default to the configured publish batch size")
		void defaultBatchSize() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "load", "-c", "users" });

			assertThat(config.batchSize).isEqualTo(defaultProperties.getPublishBatchSize());
		}

		@Test
		@DisplayName("Load without a collection should parse")
		void loadWithoutCollection() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "load" });

			assertThat(config.collection).isNull();
		}

		@Test
		@DisplayName("Should parse comma-separated filters")
		void shouldParseFilters() {
			String[] args = { "load", "-c", "commits", "-f", "commit.author.name=^A,sha=[0-9a-f]+" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.filters).containsEntry("commit.author.name", "^A").containsEntry("sha", "[0-9a-f]+");
		}

		@Test
		@DisplayName("Filter values may contain '='")
		void filterWithEquals() {
			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "load", "-c", "events", "-f", "payload.ref=a=b" });

			assertThat(config.filters).containsEntry("payload.ref", "a=b");
		}

		@Test
		@DisplayName("Scan filter should combine patterns and the earliest floor")
		void scanFilter() {
			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "load", "-c", "commits", "-e", "1700000000", "-f", "sha=^a" });

			ScanFilter filter = config.scanFilter();

			assertThat(filter.idFloor()).isEqualTo(StoreIds.floorOf(Instant.ofEpochSecond(1700000000L)));
			assertThat(filter.patterns()).containsOnlyKeys("sha");
		}

		@ParameterizedTest
		@ValueSource(strings = { "noequals", "=value", "sha=[unclosed" })
		@DisplayName("Should reject malformed filters")
		void shouldRejectMalformedFilters(String filter) {
			String[] args = { "load", "-c", "commits", "-f", filter };

			assertThatThrownBy(() -> argumentParser.parseAndValidate(args))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid filter");
		}

		@Test
		@DisplayName("Should reject unknown collections")
		void unknownCollection() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "load", "-c", "gists" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown collection");
		}

		@ParameterizedTest
		@ValueSource(strings = { "0", "-5", "abc" })
		@DisplayName("Should reject invalid batch sizes")
		void invalidBatchSize(String size) {
			String[] args = { "load", "-c", "users", "-b", size };

			assertThatThrownBy(() -> argumentParser.parseAndValidate(args))
				.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should reject a non-numeric earliest timestamp")
		void invalidEarliest() {
			assertThatThrownBy(
					() -> argumentParser.parseAndValidate(new String[] { "load", "-c", "users", "-e", "yesterday" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("earliest");
		}

		@Test
		@DisplayName("Should reject an earliest timestamp beyond what store ids can encode")
		void earliestBeyondIdRange() {
			String tooLate = String.valueOf(StoreIds.MAX_EPOCH_SECOND + 1);

			assertThatThrownBy(
					() -> argumentParser.parseAndValidate(new String[] { "load", "-c", "users", "-e", tooLate }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("must not exceed " + StoreIds.MAX_EPOCH_SECOND);
		}

		@Test
		@DisplayName("Latest encodable earliest timestamp should give a positive floor")
		void latestEarliestKeepsFloorPositive() {
			String latest = String.valueOf(StoreIds.MAX_EPOCH_SECOND);

			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "load", "-c", "users", "-e", latest });

			assertThat(config.scanFilter().idFloor()).isPositive();
		}

	}

	@Nested
	@DisplayName("Mirror Command Tests")
	class MirrorCommandTest {

		@Test
		@DisplayName("Should parse repository and targets")
		void shouldParseMirrorOptions() {
			String[] args = { "mirror", "--repo", "spring-projects/spring-ai", "--what", "repo, Pull_Requests" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.command).isEqualTo(ParsedConfiguration.MIRROR);
			assertThat(config.owner()).isEqualTo("spring-projects");
			assertThat(config.repo()).isEqualTo("spring-ai");
			assertThat(config.what).containsExactly("repo", "pull_requests");
		}

		@Test
		@DisplayName("Should parse user, org and events")
		void shouldParseUserOrgEvents() {
			String[] args = { "mirror", "--user", "octocat", "--org", "github", "--events", "-v" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.user).isEqualTo("octocat");
			assertThat(config.org).isEqualTo("github");
			assertThat(config.events).isTrue();
			assertThat(config.verbose).isTrue();
		}

		@Test
		@DisplayName("Should reject unknown targets")
		void unknownTarget() {
			String[] args = { "mirror", "--repo", "o/r", "--what", "issues" };

			assertThatThrownBy(() -> argumentParser.parseAndValidate(args))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid mirror target");
		}

		@Test
		@DisplayName("Should reject malformed repositories")
		void malformedRepository() {
			String[] args = { "mirror", "--repo", "just-a-name" };

			assertThatThrownBy(() -> argumentParser.parseAndValidate(args))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("owner/repo");
		}

		@Test
		@DisplayName("Should reject a mirror command with nothing to do")
		void nothingToMirror() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "mirror" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Nothing to mirror");
		}

	}

	@Nested
	@DisplayName("General Tests")
	class GeneralTest {

		@Test
		@DisplayName("Should require a command")
		void commandRequired() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "-v" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("command is required");
		}

		@Test
		@DisplayName("Should reject unknown commands and options")
		void unknownCommandAndOption() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "sync" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown command");
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "load", "--zip" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown option");
		}

		@Test
		@DisplayName("Should report a missing option value")
		void missingValue() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "load", "-c" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Missing value for collection");
		}

		@Test
		@DisplayName("Help should be detected without validation")
		void help() {
			assertThat(argumentParser.isHelpRequested(new String[] { "load", "--help" })).isTrue();
			assertThat(argumentParser.parseAndValidate(new String[] { "-h" }).helpRequested).isTrue();
			assertThat(argumentParser.generateHelpText()).contains("load", "mirror", "--earliest", "AMQP_HOST");
		}

	}

}
