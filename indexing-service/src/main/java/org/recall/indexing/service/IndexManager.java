package org.recall.indexing.service;

import org.recall.core.index.InvertedIndex;
import org.recall.core.index.InvertedIndexBuilder;
import org.recall.core.model.MemoryDocument;
import org.recall.core.model.MemoryFields;
import org.recall.core.model.SearchHit;
import org.recall.core.search.Bm25Searcher;
import org.recall.core.search.SearchOptions;
import org.recall.indexing.model.IndexStats;
import org.recall.indexing.model.RebuildResult;
import org.recall.indexing.storage.IndexFormatException;
import org.recall.indexing.storage.JsonIndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the one in-memory keyword index of a process and keeps it in step with its backing file.
 *
 * <p>The index is loaded lazily on first use, at most once, even when several threads race to be first.
 * A missing or unreadable file yields an empty index. Mutations mark the index dirty; the
 * {@link FlushPolicy} decides when a mutation also writes the file, and {@link #flush()} forces it.</p>
 */
public class IndexManager implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(IndexManager.class);

	private final JsonIndexStore store;
	private final InvertedIndexBuilder indexBuilder;
	private final Bm25Searcher searcher;
	private final FlushPolicy flushPolicy;
	private final SearchOptions defaultOptions;

	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
	private final AtomicReference<CompletableFuture<InvertedIndex>> loading = new AtomicReference<>();
	private volatile boolean dirty;

	public IndexManager(
			JsonIndexStore store,
			InvertedIndexBuilder indexBuilder,
			Bm25Searcher searcher,
			FlushPolicy flushPolicy,
			SearchOptions defaultOptions
	) {
		if (indexBuilder.getTokenizer() != searcher.getTokenizer()) {
			throw new IllegalArgumentException("Indexing and search must share one Tokenizer");
		}
		this.store = store;
		this.indexBuilder = indexBuilder;
		this.searcher = searcher;
		this.flushPolicy = flushPolicy;
		this.defaultOptions = defaultOptions;
		this.dirty = false;
	}

	/**
	 * Return the cached index, reading the backing file on first call.
	 */
	public InvertedIndex loadIndex() {
		CompletableFuture<InvertedIndex> current = loading.get();
		if (current != null) {
			return current.join();
		}

		CompletableFuture<InvertedIndex> created = new CompletableFuture<>();
		if (!loading.compareAndSet(null, created)) {
			return loading.get().join();
		}

		try {
			created.complete(readOrCreate());
		} catch (RuntimeException e) {
			loading.compareAndSet(created, null);
			created.completeExceptionally(e);
			throw e;
		}
		return created.join();
	}

	public boolean isLoaded() {
		CompletableFuture<InvertedIndex> current = loading.get();
		return current != null && current.isDone() && !current.isCompletedExceptionally();
	}

	/**
	 * Write the index if it has unsaved changes.
	 *
	 * @throws IOException if the file cannot be written; the in-memory index is unaffected and stays dirty
	 */
	public void saveIndex() throws IOException {
		lock.writeLock().lock();
		try {
			if (!dirty || !isLoaded()) {
				return;
			}
			save(loadIndex());
		} finally {
			lock.writeLock().unlock();
		}
	}

	/**
	 * Force pending changes to disk.
	 */
	public void flush() throws IOException {
		saveIndex();
	}

	/**
	 * Save only if the flush policy asks for it. Intended for a periodic background check.
	 */
	public void flushIfDue() throws IOException {
		lock.writeLock().lock();
		try {
			if (dirty && flushPolicy.shouldFlush()) {
				save(loadIndex());
			}
		} finally {
			lock.writeLock().unlock();
		}
	}

	/**
	 * Add or replace a memory in the index.
	 *
	 * @throws IOException if the flush policy triggered a save and it failed
	 */
	public void indexMemory(MemoryDocument memory) throws IOException {
		requireIndexable(memory);

		lock.writeLock().lock();
		try {
			InvertedIndex index = loadIndex();
			indexBuilder.indexDocument(index, memory.id(), IndexableText.of(memory));
			markDirty(index);
		} finally {
			lock.writeLock().unlock();
		}
	}

	public void indexDocument(String id, MemoryFields fields) throws IOException {
		indexMemory(MemoryDocument.of(id, fields));
	}

	/**
	 * Remove a memory from the index. Unknown ids are ignored.
	 *
	 * @return {@code true} if the memory was indexed
	 */
	public boolean removeMemoryFromIndex(String memoryId) throws IOException {
		lock.writeLock().lock();
		try {
			InvertedIndex index = loadIndex();
			if (!index.removeDocument(memoryId)) {
				logger.debug("Memory {} was not indexed, nothing to remove", memoryId);
				return false;
			}
			markDirty(index);
			return true;
		} finally {
			lock.writeLock().unlock();
		}
	}

	public boolean removeDocument(String id) throws IOException {
		return removeMemoryFromIndex(id);
	}

	/**
	 * Index many memories and save once at the end.
	 *
	 * @return number of memories indexed
	 */
	public int batchIndex(Collection<MemoryDocument> memories) throws IOException {
		memories.forEach(IndexManager::requireIndexable);

		lock.writeLock().lock();
		try {
			InvertedIndex index = loadIndex();
			for (MemoryDocument memory : memories) {
				indexBuilder.indexDocument(index, memory.id(), IndexableText.of(memory));
			}
			dirty = true;
			save(index);
			logger.info("Batch indexed {} memories", memories.size());
			return memories.size();
		} finally {
			lock.writeLock().unlock();
		}
	}

	/**
	 * Discard the current index and build a new one from a full snapshot of the memories.
	 * Memories that cannot be indexed are skipped and counted. A repeated id counts once, the last copy wins.
	 */
	public RebuildResult rebuildIndex(Collection<MemoryDocument> memories) throws IOException {
		logger.info("Starting full index rebuild from {} memories...", memories.size());

		InvertedIndex fresh = InvertedIndex.createEmpty();
		Set<String> indexedIds = new HashSet<>();
		int skipped = 0;

		for (MemoryDocument memory : memories) {
			try {
				requireIndexable(memory);
				indexBuilder.indexDocument(fresh, memory.id(), IndexableText.of(memory));
				indexedIds.add(memory.id());
			} catch (RuntimeException e) {
				skipped++;
				logger.warn("Skipping memory {} during rebuild: {}", memory, e.getMessage());
			}
		}

		lock.writeLock().lock();
		try {
			replace(fresh);
			save(fresh);
			logger.info("Index rebuild complete: {} memories indexed, {} skipped", indexedIds.size(), skipped);
			return new RebuildResult(statsOf(fresh), indexedIds.size(), skipped);
		} finally {
			lock.writeLock().unlock();
		}
	}

	public RebuildResult rebuild(Collection<MemoryDocument> memories) throws IOException {
		return rebuildIndex(memories);
	}

	/**
	 * Replace the index with an empty one and persist it.
	 */
	public void clearIndex() throws IOException {
		lock.writeLock().lock();
		try {
			InvertedIndex empty = InvertedIndex.createEmpty();
			replace(empty);
			save(empty);
			logger.info("Cleared index");
		} finally {
			lock.writeLock().unlock();
		}
	}

	public boolean hasMemory(String memoryId) {
		lock.readLock().lock();
		try {
			return loadIndex().containsDocument(memoryId);
		} finally {
			lock.readLock().unlock();
		}
	}

	public List<SearchHit> search(String query) {
		return search(query, defaultOptions);
	}

	public List<SearchHit> search(String query, SearchOptions options) {
		lock.readLock().lock();
		try {
			return searcher.search(loadIndex(), query, options);
		} finally {
			lock.readLock().unlock();
		}
	}

	public IndexStats getStats() {
		lock.readLock().lock();
		try {
			return statsOf(loadIndex());
		} finally {
			lock.readLock().unlock();
		}
	}

	public IndexStats stats() {
		return getStats();
	}

	public SearchOptions getDefaultOptions() {
		return defaultOptions;
	}

	public JsonIndexStore getStore() {
		return store;
	}

	@Override
	public void close() throws IOException {
		flush();
	}

	private InvertedIndex readOrCreate() {
		try {
			return store.load().orElseGet(InvertedIndex::createEmpty);
		} catch (IndexFormatException e) {
			logger.warn("Index file {} is malformed ({}), starting with a fresh index",
					store.getIndexFile(), e.getMessage());
		} catch (IOException e) {
			logger.warn("Failed to read index file {}, starting with a fresh index", store.getIndexFile(), e);
		}
		return InvertedIndex.createEmpty();
	}

	private void markDirty(InvertedIndex index) throws IOException {
		dirty = true;
		flushPolicy.recordMutation();
		if (flushPolicy.shouldFlush()) {
			save(index);
		}
	}

	private void replace(InvertedIndex index) {
		loading.set(CompletableFuture.completedFuture(index));
		dirty = true;
	}

	private void save(InvertedIndex index) throws IOException {
		store.save(index);
		dirty = false;
		flushPolicy.onFlushed();
	}

	private IndexStats statsOf(InvertedIndex index) {
		return new IndexStats(
				index.totalDocs(),
				index.vocabularySize(),
				index.totalTokens(),
				index.averageDocLength(),
				dirty,
				store.getIndexFile().toString()
		);
	}

	private static void requireIndexable(MemoryDocument memory) {
		if (memory == null) {
			throw new IllegalArgumentException("Memory must not be null");
		}
		if (memory.id() == null || memory.id().isBlank()) {
			throw new IllegalArgumentException("Memory id must not be blank");
		}
	}
}
