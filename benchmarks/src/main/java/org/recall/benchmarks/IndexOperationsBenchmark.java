package org.recall.benchmarks;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.recall.core.index.InvertedIndex;
import org.recall.core.index.InvertedIndexBuilder;
import org.recall.core.search.Bm25Parameters;
import org.recall.core.search.Bm25Searcher;
import org.recall.core.search.SearchOptions;
import org.recall.core.text.Tokenizer;
import org.recall.indexing.storage.IndexSerializer;
import org.recall.indexing.storage.JsonIndexStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for keyword index operations
 * Tests: upsert document, BM25 search, serialize, save, load
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class IndexOperationsBenchmark {

	private static final String[] VOCABULARY = {
			"project", "alpha", "standup", "notes", "grocery", "milk", "eggs", "bread", "meeting", "deploy",
			"release", "review", "design", "budget", "travel", "flight", "hotel", "doctor", "workout", "recipe",
			"idea", "journal", "book", "podcast", "garden", "invoice", "contract", "birthday", "gift", "family"
	};

	private Tokenizer tokenizer;
	private InvertedIndexBuilder indexBuilder;
	private Bm25Searcher searcher;
	private IndexSerializer serializer;
	private JsonIndexStore store;
	private Path benchmarkDir;

	private InvertedIndex preBuiltIndex;
	private String serializedIndex;
	private String updateText;

	@Param({"100", "1000", "5000"})
	private int indexSize;

	@Setup(Level.Trial)
	public void setup() throws IOException {
		System.out.println("=== Index Operations Benchmark Setup (indexSize=" + indexSize + ") ===");

		tokenizer = new Tokenizer();
		indexBuilder = new InvertedIndexBuilder(tokenizer);
		searcher = new Bm25Searcher(tokenizer, Bm25Parameters.defaults());
		serializer = new IndexSerializer();

		benchmarkDir = Files.createTempDirectory("benchmark-indexes");
		store = new JsonIndexStore(benchmarkDir.resolve("bm25-index-" + indexSize + ".json"), serializer);

		Random random = new Random(42);
		Map<String, String> corpus = new LinkedHashMap<>();
		for (int i = 0; i < indexSize; i++) {
			corpus.put("memory-" + i, syntheticText(random, 8 + random.nextInt(40)));
		}

		preBuiltIndex = indexBuilder.build(corpus);
		serializedIndex = serializer.toJson(preBuiltIndex);
		store.save(preBuiltIndex);
		updateText = syntheticText(random, 30);

		System.out.println("Index ready: " + preBuiltIndex.vocabularySize() + " unique terms");
	}

	@TearDown(Level.Trial)
	public void tearDown() throws IOException {
		Files.deleteIfExists(store.getIndexFile());
		Files.deleteIfExists(benchmarkDir);
	}

	/**
	 * Benchmark: Re-index an existing document (remove + add)
	 */
	@Benchmark
	public void upsertDocument(Blackhole blackhole) {
		indexBuilder.indexDocument(preBuiltIndex, "memory-0", updateText);
		blackhole.consume(preBuiltIndex.totalDocs());
	}

	/**
	 * Benchmark: Two-term BM25 query
	 */
	@Benchmark
	public void searchTwoTerms(Blackhole blackhole) {
		blackhole.consume(searcher.search(preBuiltIndex, "project alpha", SearchOptions.defaults()));
	}

	/**
	 * Benchmark: Query touching many postings
	 */
	@Benchmark
	public void searchManyTerms(Blackhole blackhole) {
		blackhole.consume(searcher.search(preBuiltIndex, "meeting notes budget review release deploy",
				SearchOptions.defaults()));
	}

	/**
	 * Benchmark: Serialize entire index to JSON text
	 */
	@Benchmark
	public void serializeIndexToJson(Blackhole blackhole) {
		blackhole.consume(serializer.toJson(preBuiltIndex));
	}

	/**
	 * Benchmark: Parse and validate index from JSON text
	 */
	@Benchmark
	public void deserializeIndexFromJson(Blackhole blackhole) throws IOException {
		blackhole.consume(serializer.fromJson(serializedIndex).totalDocs());
	}

	/**
	 * Benchmark: Full write through the file store
	 */
	@Benchmark
	public void saveIndexToFile(Blackhole blackhole) throws IOException {
		store.save(preBuiltIndex);
		blackhole.consume(store.getSizeInMB());
	}

	/**
	 * Benchmark: Full read through the file store
	 */
	@Benchmark
	public void loadIndexFromFile(Blackhole blackhole) throws IOException {
		blackhole.consume(store.load().map(InvertedIndex::vocabularySize).orElse(0));
	}

	private static String syntheticText(Random random, int words) {
		StringBuilder text = new StringBuilder();
		for (int i = 0; i < words; i++) {
			if (i > 0) {
				text.append(i % 7 == 0 ? ", " : " ");
			}
			text.append(VOCABULARY[random.nextInt(VOCABULARY.length)]);
			if (random.nextInt(10) == 0) {
				text.append(random.nextInt(100));
			}
		}
		return text.toString();
	}
}
