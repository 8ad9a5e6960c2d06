package org.recall.indexing.bootstrap;

import org.recall.core.index.InvertedIndexBuilder;
import org.recall.core.search.Bm25Parameters;
import org.recall.core.search.Bm25Searcher;
import org.recall.core.search.SearchOptions;
import org.recall.core.text.Tokenizer;
import org.recall.indexing.config.IndexingConfig;
import org.recall.indexing.service.FlushPolicy;
import org.recall.indexing.service.IndexManager;
import org.recall.indexing.service.ThresholdFlushPolicy;
import org.recall.indexing.storage.IndexSerializer;
import org.recall.indexing.storage.JsonIndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wires an {@link IndexManager} from configuration.
 *
 * <p>{@link #start(IndexingConfig)} additionally loads the index eagerly, schedules the time-based
 * flush check and registers a JVM shutdown hook that flushes pending changes.</p>
 */
public final class IndexingBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(IndexingBootstrap.class);

    private IndexingBootstrap() {}

    /**
     * Builds an index manager without starting any background work.
     */
    public static IndexManager create(IndexingConfig cfg) {
        Tokenizer tokenizer = buildTokenizer(cfg);
        Bm25Searcher searcher = new Bm25Searcher(tokenizer, new Bm25Parameters(cfg.bm25().k1(), cfg.bm25().b()));
        JsonIndexStore store = new JsonIndexStore(cfg.indexFile(), new IndexSerializer());
        return new IndexManager(
            store,
            new InvertedIndexBuilder(tokenizer),
            searcher,
            buildFlushPolicy(cfg),
            new SearchOptions(cfg.search().defaultLimit(), cfg.search().defaultThreshold())
        );
    }

    /**
     * Builds the manager, loads the index and installs background flushing.
     */
    public static IndexManager start(IndexingConfig cfg) {
        IndexManager manager = create(cfg);
        manager.loadIndex();
        ScheduledExecutorService scheduler = startFlushScheduler(cfg, manager);
        addShutdownHook(manager, scheduler);
        logger.info("Keyword index ready: {} ({} documents)",
            cfg.indexFile(), manager.getStats().totalDocs());
        return manager;
    }

    private static Tokenizer buildTokenizer(IndexingConfig cfg) {
        return new Tokenizer(
            cfg.tokenizer().minTermLength(),
            Tokenizer.parseStopWords(cfg.tokenizer().stopWords())
        );
    }

    private static FlushPolicy buildFlushPolicy(IndexingConfig cfg) {
        IndexingConfig.Flush flush = cfg.flush();
        if (flush.everyMutations() <= 0 && flush.maxAge().isZero()) {
            return FlushPolicy.never();
        }
        return new ThresholdFlushPolicy(flush.everyMutations(), flush.maxAge());
    }

    private static ScheduledExecutorService startFlushScheduler(IndexingConfig cfg, IndexManager manager) {
        long periodSeconds = cfg.flush().maxAge().toSeconds();
        if (periodSeconds <= 0) {
            return null;
        }

        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "index-flush");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(() -> flushIfDue(manager), periodSeconds, periodSeconds, TimeUnit.SECONDS);
        return scheduler;
    }

    private static void flushIfDue(IndexManager manager) {
        try {
            manager.flushIfDue();
        } catch (IOException e) {
            logger.error("Periodic index flush failed", e);
        }
    }

    private static void addShutdownHook(IndexManager manager, ScheduledExecutorService scheduler) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(manager, scheduler)));
    }

    private static void shutdown(IndexManager manager, ScheduledExecutorService scheduler) {
        logger.info("Flushing keyword index before shutdown...");
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        try {
            manager.close();
        } catch (IOException e) {
            logger.error("Failed to flush keyword index on shutdown", e);
        }
        logger.info("Keyword index stopped.");
    }
}
