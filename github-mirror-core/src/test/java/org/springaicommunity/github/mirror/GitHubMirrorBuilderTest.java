package org.springaicommunity.github.mirror;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GitHubMirrorBuilder Tests")
@ExtendWith(MockitoExtension.class)
class GitHubMirrorBuilderTest {

	@Mock
	private GitHubClient client;

	@TempDir
	Path tempDir;

	@Test
	@DisplayName("Custom client should not require a token")
	void customClientNeedsNoToken() {
		Retriever retriever = GitHubMirrorBuilder.create()
			.httpClient(client)
			.persister(new InMemoryPersister())
			.buildRetriever();

		assertThat(retriever).isNotNull();
	}

	@Test
	@DisplayName("Default persister should be a file store under the configured directory")
	void defaultPersister() {
		MirrorProperties properties = new MirrorProperties();
		properties.setStoreDirectory(tempDir.resolve("store").toString());
		GitHubMirrorBuilder builder = GitHubMirrorBuilder.create().properties(properties);

		Persister persister = builder.buildPersister();

		assertThat(persister).isInstanceOf(FileSystemPersister.class);
		assertThat(builder.buildPersister()).isSameAs(persister);
		assertThat(tempDir.resolve("store")).isDirectory();
	}

	@Test
	@DisplayName("Publisher should use the shared persister and custom channel")
	void publisherSharesPersister() {
		InMemoryPersister persister = new InMemoryPersister();
		FakeBrokerChannel channel = FakeBrokerChannel.confirming();
		GitHubMirrorBuilder builder = GitHubMirrorBuilder.create().persister(persister).brokerChannel(channel);
		persister.store(Retriever.USERS, ObjectMapperFactory.create().createObjectNode().put("login", "octocat"));

		PublishResult result = builder.buildPublisher(CollectionRoute.USERS, ScanFilter.all()).run();

		assertThat(result.published()).isEqualTo(1);
		assertThat(channel.messages()).extracting(FakeBrokerChannel.Message::routingKey)
			.containsExactly("user.octocat");
	}

	@Test
	@DisplayName("Explicit blank token should be rejected")
	void blankToken() {
		GitHubMirrorBuilder builder = GitHubMirrorBuilder.create().token("  ").persister(new InMemoryPersister());

		assertThatThrownBy(builder::buildRetriever)
			.isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("token");
	}

}
