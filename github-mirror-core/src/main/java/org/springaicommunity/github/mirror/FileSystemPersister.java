package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * File system implementation of {@link Persister}.
 *
 * <p>
 * Each collection is a JSON-lines file ({@code <collection>.jsonl}) under the base
 * directory, one stored document per line. A collection file is read on first access and
 * appended to on every store.
 */
public class FileSystemPersister extends AbstractPersister {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemPersister.class);

	private final Path baseDirectory;

	private final ObjectMapper objectMapper;

	public FileSystemPersister(Path baseDirectory, ObjectMapper objectMapper) {
		this(baseDirectory, objectMapper, Clock.systemUTC());
	}

	public FileSystemPersister(Path baseDirectory, ObjectMapper objectMapper, Clock clock) {
		super(clock);
		this.baseDirectory = baseDirectory;
		this.objectMapper = objectMapper;
		try {
			Files.createDirectories(baseDirectory);
		}
		catch (IOException e) {
			throw new PersisterException("Failed to create store directory: " + baseDirectory, e);
		}
	}

	@Override
	protected List<ObjectNode> load(String collection) {
		Path file = collectionFile(collection);
		List<ObjectNode> documents = new ArrayList<>();
		if (!Files.exists(file)) {
			return documents;
		}
		try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			String line;
			int lineNumber = 0;
			while ((line = reader.readLine()) != null) {
				lineNumber++;
				if (line.isBlank()) {
					continue;
				}
				JsonNode node = objectMapper.readTree(line);
				if (node instanceof ObjectNode document) {
					documents.add(document);
				}
				else {
					logger.warn("Skipping non-object line {} in {}", lineNumber, file);
				}
			}
		}
		catch (IOException e) {
			throw new PersisterException("Failed to load collection " + collection + " from " + file, e);
		}
		documents.sort(Comparator.comparingLong(d -> d.path(ID_FIELD).asLong()));
		logger.debug("Loaded {} documents from {}", documents.size(), file);
		return documents;
	}

	@Override
	protected void stored(String collection, ObjectNode document) {
		Path file = collectionFile(collection);
		try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
				StandardOpenOption.APPEND)) {
			writer.write(objectMapper.writeValueAsString(document));
			writer.newLine();
		}
		catch (IOException e) {
			throw new PersisterException("Failed to append to collection " + collection + " at " + file, e);
		}
	}

	private Path collectionFile(String collection) {
		if (!collection.matches("[a-zA-Z0-9_-]+")) {
			throw new IllegalArgumentException("Invalid collection name: " + collection);
		}
		return baseDirectory.resolve(collection + ".jsonl");
	}

}
