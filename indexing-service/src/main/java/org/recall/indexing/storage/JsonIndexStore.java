package org.recall.indexing.storage;

import org.recall.core.index.InvertedIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps a single index in one JSON file.
 */
public class JsonIndexStore {
	private static final Logger logger = LoggerFactory.getLogger(JsonIndexStore.class);

	private final Path indexFile;
	private final IndexSerializer serializer;

	public JsonIndexStore(Path indexFile, IndexSerializer serializer) {
		this.indexFile = indexFile.toAbsolutePath();
		this.serializer = serializer;
	}

	/**
	 * Read the index from disk.
	 *
	 * @return the index, or empty if the file does not exist
	 * @throws IndexFormatException if the file exists but does not hold a valid index
	 * @throws IOException if the file cannot be read
	 */
	public Optional<InvertedIndex> load() throws IOException {
		if (!Files.exists(indexFile)) {
			logger.info("Index file does not exist yet: {}", indexFile);
			return Optional.empty();
		}

		String json = Files.readString(indexFile, StandardCharsets.UTF_8);
		InvertedIndex index = serializer.fromJson(json);

		logger.info("Loaded index from {} ({} documents, {} terms)",
				indexFile, index.totalDocs(), index.vocabularySize());
		return Optional.of(index);
	}

	/**
	 * Write the whole index, replacing the previous file.
	 */
	public void save(InvertedIndex index) throws IOException {
		Path parent = indexFile.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}

		String json = serializer.toJson(index);
		Path tempFile = indexFile.resolveSibling(indexFile.getFileName() + ".tmp");
		Files.writeString(tempFile, json, StandardCharsets.UTF_8);

		try {
			Files.move(tempFile, indexFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(tempFile, indexFile, StandardCopyOption.REPLACE_EXISTING);
		}

		logger.info("Saved index to {} ({} documents, {} terms, {} MB)",
				indexFile, index.totalDocs(), index.vocabularySize(), String.format("%.3f", getSizeInMB()));
	}

	public boolean exists() {
		return Files.exists(indexFile);
	}

	public double getSizeInMB() {
		try {
			if (Files.exists(indexFile)) {
				long bytes = Files.size(indexFile);
				return bytes / (1024.0 * 1024.0);
			}
		} catch (IOException e) {
			logger.warn("Failed to get index file size", e);
		}
		return 0.0;
	}

	public Path getIndexFile() {
		return indexFile;
	}
}
