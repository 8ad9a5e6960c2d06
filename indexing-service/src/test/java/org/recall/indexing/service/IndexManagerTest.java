package org.recall.indexing.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.recall.core.index.InvertedIndex;
import org.recall.core.index.InvertedIndexBuilder;
import org.recall.core.model.MemoryDocument;
import org.recall.core.model.MemoryFields;
import org.recall.core.model.SearchHit;
import org.recall.core.search.Bm25Parameters;
import org.recall.core.search.Bm25Searcher;
import org.recall.core.search.SearchOptions;
import org.recall.core.text.Tokenizer;
import org.recall.indexing.model.IndexStats;
import org.recall.indexing.model.RebuildResult;
import org.recall.indexing.storage.IndexSerializer;
import org.recall.indexing.storage.JsonIndexStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class IndexManagerTest {

	@TempDir
	Path tempDir;

	private static IndexManager newManager(JsonIndexStore store, FlushPolicy flushPolicy) {
		Tokenizer tokenizer = new Tokenizer();
		return new IndexManager(
				store,
				new InvertedIndexBuilder(tokenizer),
				new Bm25Searcher(tokenizer, Bm25Parameters.defaults()),
				flushPolicy,
				SearchOptions.defaults()
		);
	}

	private IndexManager newManager(FlushPolicy flushPolicy) {
		return newManager(new JsonIndexStore(indexFile(), new IndexSerializer()), flushPolicy);
	}

	private Path indexFile() {
		return tempDir.resolve("memory").resolve("bm25-index.json");
	}

	@Test
	public void testStandupScenario() throws Exception {
		IndexManager manager = newManager(FlushPolicy.never());

		manager.indexMemory(MemoryDocument.of("a", "daily standup notes about project alpha"));
		manager.indexMemory(MemoryDocument.of("b", "grocery list: milk eggs bread"));

		List<SearchHit> hits = manager.search("project alpha");
		assertEquals(1, hits.size());
		assertEquals("a", hits.get(0).id());
		assertTrue(hits.get(0).score() > 0);

		assertTrue(manager.removeMemoryFromIndex("a"));
		assertTrue(manager.search("project alpha").isEmpty());

		System.out.println("✅ Index manager scenario test passed!");
	}

	@Test
	public void testRebuildWithNoMemoriesPersistsEmptyIndex() throws Exception {
		IndexManager manager = newManager(FlushPolicy.never());

		RebuildResult result = manager.rebuildIndex(List.of());

		assertEquals(0, result.stats().totalDocs());
		assertEquals(0, result.stats().vocabularySize());
		assertEquals(0, result.indexed());
		assertEquals(0, result.skipped());
		assertFalse(result.stats().dirty());
		assertTrue(Files.exists(indexFile()));

		InvertedIndex reloaded = new IndexSerializer().fromJson(Files.readString(indexFile()));
		assertEquals(0, reloaded.totalDocs());
	}

	@Test
	public void testCorruptFileFallsBackToEmptyIndex() throws Exception {
		Files.createDirectories(indexFile().getParent());
		Files.writeString(indexFile(), "not json");

		IndexManager manager = newManager(FlushPolicy.never());
		InvertedIndex index = assertDoesNotThrow(manager::loadIndex);

		assertEquals(0, index.totalDocs());
		assertTrue(manager.search("not json").isEmpty());
	}

	@Test
	public void testEmptyAndInvalidFilesFallBackToEmptyIndex() throws Exception {
		Files.createDirectories(indexFile().getParent());

		for (String content : List.of("", "   ", "{}", "{\"version\": 1, \"totalDocs\": 3}", "[]")) {
			Files.writeString(indexFile(), content);
			IndexManager manager = newManager(FlushPolicy.never());

			assertEquals(0, manager.getStats().totalDocs(), "content: '" + content + "'");
		}
	}

	@Test
	public void testIndexSurvivesRestart() throws Exception {
		IndexManager first = newManager(FlushPolicy.never());
		first.indexMemory(new MemoryDocument("m1", "Call the dentist on Friday", "todo", List.of("health"), "inbox"));
		first.indexMemory(new MemoryDocument("m2", "Dentist appointment moved", "event", List.of("calendar"), null));
		first.indexMemory(MemoryDocument.of("m3", "Buy oat milk"));
		List<SearchHit> before = first.search("dentist health");
		first.flush();

		IndexManager second = newManager(FlushPolicy.never());

		assertEquals(before, second.search("dentist health"));
		assertEquals(3, second.getStats().totalDocs());
		assertEquals(first.getStats().vocabularySize(), second.getStats().vocabularySize());
	}

	@Test
	public void testDirtyTrackingAndExplicitFlush() throws Exception {
		IndexManager manager = newManager(FlushPolicy.never());
		assertFalse(manager.getStats().dirty());

		manager.indexMemory(MemoryDocument.of("a", "alpha"));
		assertTrue(manager.getStats().dirty());
		assertFalse(Files.exists(indexFile()));

		manager.flush();
		assertFalse(manager.getStats().dirty());
		assertTrue(Files.exists(indexFile()));

		Files.delete(indexFile());
		manager.flush();
		assertFalse(Files.exists(indexFile()), "a clean index must not be rewritten");
	}

	@Test
	public void testFlushPolicyTriggersOpportunisticSave() throws Exception {
		IndexManager manager = newManager(new ThresholdFlushPolicy(3, Duration.ZERO));

		manager.indexMemory(MemoryDocument.of("a", "alpha"));
		manager.indexMemory(MemoryDocument.of("b", "beta"));
		assertFalse(Files.exists(indexFile()));

		manager.removeMemoryFromIndex("a");
		assertTrue(Files.exists(indexFile()));
		assertFalse(manager.getStats().dirty());

		manager.indexMemory(MemoryDocument.of("c", "gamma"));
		assertTrue(manager.getStats().dirty());
	}

	@Test
	public void testRemovingUnknownMemoryDoesNotDirtyIndex() throws Exception {
		IndexManager manager = newManager(FlushPolicy.never());

		assertFalse(manager.removeMemoryFromIndex("ghost"));
		assertFalse(manager.getStats().dirty());
	}

	@Test
	public void testUpsertKeepsOnlyLatestContent() throws Exception {
		IndexManager manager = newManager(FlushPolicy.never());
		manager.indexMemory(MemoryDocument.of("filler", "unrelated words"));

		manager.indexMemory(MemoryDocument.of("a", "first draft about kayaks"));
		manager.indexMemory(MemoryDocument.of("a", "second draft about canoes"));

		assertEquals(2, manager.getStats().totalDocs());
		assertTrue(manager.search("kayaks").isEmpty());
		assertEquals("a", manager.search("canoes").get(0).id());
		assertEquals(4, manager.loadIndex().documentLength("a"));
	}

	@Test
	public void testIndexDocumentUsesAllFields() throws Exception {
		IndexManager manager = newManager(FlushPolicy.never());
		manager.indexMemory(MemoryDocument.of("other", "nothing in common"));

		manager.indexDocument("m1", new MemoryFields("Renew passport", "reminder", List.of("travel", "admin"), "voice-note"));

		for (String query : List.of("passport", "reminder", "travel", "admin", "voice")) {
			List<SearchHit> hits = manager.search(query);
			assertEquals(1, hits.size(), "query: " + query);
			assertEquals("m1", hits.get(0).id());
		}
		assertEquals(7, manager.loadIndex().documentLength("m1"));
	}

	@Test
	public void testRebuildSkipsBadMemories() throws Exception {
		IndexManager manager = newManager(FlushPolicy.never());
		manager.indexMemory(MemoryDocument.of("stale", "this should disappear"));

		RebuildResult result = manager.rebuildIndex(Arrays.asList(
				MemoryDocument.of("a", "project alpha"),
				null,
				MemoryDocument.of("  ", "blank id"),
				new MemoryDocument("b", null, null, null, null)
		));

		assertEquals(2, result.indexed());
		assertEquals(2, result.skipped());
		assertEquals(2, result.stats().totalDocs());
		assertFalse(manager.hasMemory("stale"));
		assertTrue(manager.hasMemory("b"));
		assertTrue(Files.exists(indexFile()));
	}

	@Test
	public void testRebuildCountsRepeatedIdOnce() throws Exception {
		IndexManager manager = newManager(FlushPolicy.never());

		RebuildResult result = manager.rebuildIndex(List.of(
				MemoryDocument.of("a", "first copy"),
				MemoryDocument.of("a", "second copy wins"),
				MemoryDocument.of("b", "other")
		));

		assertEquals(2, result.indexed());
		assertEquals(0, result.skipped());
		assertEquals(2, result.stats().totalDocs());
		assertEquals(3, manager.loadIndex().documentLength("a"));
	}

	@Test
	public void testFlushIfDueWritesOnceMaxAgeElapses() throws Exception {
		ThresholdFlushPolicyTest.MutableClock clock = new ThresholdFlushPolicyTest.MutableClock();
		IndexManager manager = newManager(new ThresholdFlushPolicy(0, Duration.ofSeconds(30), clock));

		manager.indexMemory(MemoryDocument.of("a", "project alpha"));
		manager.flushIfDue();
		assertFalse(Files.exists(indexFile()));
		assertTrue(manager.getStats().dirty());

		clock.advance(Duration.ofSeconds(29));
		manager.flushIfDue();
		assertFalse(Files.exists(indexFile()));

		clock.advance(Duration.ofSeconds(1));
		manager.flushIfDue();
		assertTrue(Files.exists(indexFile()));
		assertFalse(manager.getStats().dirty());

		Files.delete(indexFile());
		clock.advance(Duration.ofMinutes(5));
		manager.flushIfDue();
		assertFalse(Files.exists(indexFile()), "a clean index must not be rewritten");
	}

	@Test
	public void testRejectsMemoriesWithoutId() {
		IndexManager manager = newManager(FlushPolicy.never());

		assertThrows(IllegalArgumentException.class, () -> manager.indexMemory(MemoryDocument.of(" ", "text")));
		assertThrows(IllegalArgumentException.class, () -> manager.indexMemory(null));
	}

	@Test
	public void testBatchIndexSavesOnce() throws Exception {
		IndexManager manager = newManager(FlushPolicy.never());

		int count = manager.batchIndex(List.of(
				MemoryDocument.of("a", "alpha"),
				MemoryDocument.of("b", "beta"),
				MemoryDocument.of("c", "gamma")
		));

		assertEquals(3, count);
		assertFalse(manager.getStats().dirty());
		assertEquals(3, new IndexSerializer().fromJson(Files.readString(indexFile())).totalDocs());
	}

	@Test
	public void testClearIndex() throws Exception {
		IndexManager manager = newManager(FlushPolicy.never());
		manager.batchIndex(List.of(MemoryDocument.of("a", "alpha"), MemoryDocument.of("b", "beta")));

		manager.clearIndex();

		IndexStats stats = manager.getStats();
		assertEquals(0, stats.totalDocs());
		assertEquals(0, stats.vocabularySize());
		assertFalse(stats.dirty());
		assertEquals(0, new IndexSerializer().fromJson(Files.readString(indexFile())).totalDocs());
	}

	@Test
	public void testStatsReportBackingFile() {
		IndexManager manager = newManager(FlushPolicy.never());

		IndexStats stats = manager.stats();

		assertEquals(indexFile().toAbsolutePath().toString(), stats.indexFile());
		assertEquals(0, stats.totalTokens());
		assertEquals(0.0, stats.averageDocLength());
	}

	@Test
	public void testSaveFailureKeepsIndexUsable() throws Exception {
		Path blocker = tempDir.resolve("blocker");
		Files.writeString(blocker, "a regular file where a directory is expected");
		JsonIndexStore store = new JsonIndexStore(blocker.resolve("bm25-index.json"), new IndexSerializer());
		IndexManager manager = newManager(store, FlushPolicy.never());

		manager.indexMemory(MemoryDocument.of("a", "daily standup notes about project alpha"));
		manager.indexMemory(MemoryDocument.of("b", "grocery list"));

		assertThrows(IOException.class, manager::flush);

		assertTrue(manager.getStats().dirty());
		assertEquals(2, manager.getStats().totalDocs());
		assertEquals("a", manager.search("standup").get(0).id());
	}

	@Test
	public void testOpportunisticSaveFailurePropagates() throws Exception {
		Path blocker = tempDir.resolve("blocker");
		Files.writeString(blocker, "not a directory");
		JsonIndexStore store = new JsonIndexStore(blocker.resolve("bm25-index.json"), new IndexSerializer());
		IndexManager manager = newManager(store, new ThresholdFlushPolicy(1, Duration.ZERO));

		assertThrows(IOException.class, () -> manager.indexMemory(MemoryDocument.of("a", "alpha")));

		assertTrue(manager.hasMemory("a"));
		assertTrue(manager.getStats().dirty());
	}

	@Test
	public void testConcurrentFirstLoadReadsFileOnce() throws Exception {
		IndexManager seed = newManager(FlushPolicy.never());
		seed.batchIndex(List.of(MemoryDocument.of("a", "alpha"), MemoryDocument.of("b", "beta")));

		AtomicInteger reads = new AtomicInteger();
		CountDownLatch start = new CountDownLatch(1);
		JsonIndexStore countingStore = new JsonIndexStore(indexFile(), new IndexSerializer()) {
			@Override
			public Optional<InvertedIndex> load() throws IOException {
				reads.incrementAndGet();
				try {
					Thread.sleep(50);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				return super.load();
			}
		};
		IndexManager manager = newManager(countingStore, FlushPolicy.never());

		int threads = 8;
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		try {
			List<Future<InvertedIndex>> results = new ArrayList<>();
			for (int i = 0; i < threads; i++) {
				Callable<InvertedIndex> task = () -> {
					start.await();
					return manager.loadIndex();
				};
				results.add(executor.submit(task));
			}
			start.countDown();

			InvertedIndex first = results.get(0).get(5, TimeUnit.SECONDS);
			for (Future<InvertedIndex> result : results) {
				assertSame(first, result.get(5, TimeUnit.SECONDS));
			}
		} finally {
			executor.shutdownNow();
		}

		assertEquals(1, reads.get());
		assertEquals(2, manager.getStats().totalDocs());
	}

	@Test
	public void testRequiresSharedTokenizer() {
		JsonIndexStore store = new JsonIndexStore(indexFile(), new IndexSerializer());

		assertThrows(IllegalArgumentException.class, () -> new IndexManager(
				store,
				new InvertedIndexBuilder(new Tokenizer()),
				new Bm25Searcher(new Tokenizer(), Bm25Parameters.defaults()),
				FlushPolicy.never(),
				SearchOptions.defaults()
		));
	}
}
