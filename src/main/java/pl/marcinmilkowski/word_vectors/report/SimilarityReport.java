package pl.marcinmilkowski.word_vectors.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_vectors.indexer.EntityIndex;
import pl.marcinmilkowski.word_vectors.query.MatrixKind;
import pl.marcinmilkowski.word_vectors.query.RankedEntity;
import pl.marcinmilkowski.word_vectors.query.SimilarityExplorer;
import pl.marcinmilkowski.word_vectors.similarity.SimilarityMeasure;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Builds {@link SimilarityTable}s, ranking under each measure on a fixed thread pool.
 *
 * The vector space is immutable, so the rankings share it without locking.
 */
public class SimilarityReport implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityReport.class);

    private final SimilarityExplorer explorer;
    private final List<SimilarityMeasure> measures;
    private final int topK;
    private final ExecutorService executor;

    public SimilarityReport(SimilarityExplorer explorer, List<SimilarityMeasure> measures, int topK, int threads) {
        if (measures.isEmpty()) {
            throw new IllegalArgumentException("At least one similarity measure is required");
        }
        this.explorer = explorer;
        this.measures = List.copyOf(measures);
        this.topK = topK;
        this.executor = Executors.newFixedThreadPool(Math.max(1, Math.min(threads, measures.size())));
    }

    public SimilarityTable documentTable(String document, MatrixKind kind) throws InterruptedException {
        // resolve on the caller's thread so an unknown name is not wrapped
        explorer.getSpace().getDocuments().positionOf(document);
        return table(EntityIndex.DOCUMENT, document, kind,
            measure -> () -> explorer.similarDocuments(document, kind, measure, topK));
    }

    public SimilarityTable wordTable(String word, MatrixKind kind) throws InterruptedException {
        explorer.getSpace().getVocabulary().positionOf(word);
        return table(EntityIndex.WORD, word, kind,
            measure -> () -> explorer.similarWords(word, kind, measure, topK));
    }

    private SimilarityTable table(String entityKind, String pivot, MatrixKind kind,
                                  Function<SimilarityMeasure, Callable<List<RankedEntity>>> task)
            throws InterruptedException {
        long start = System.currentTimeMillis();
        List<Future<List<RankedEntity>>> futures = new ArrayList<>();
        for (SimilarityMeasure measure : measures) {
            futures.add(executor.submit(task.apply(measure)));
        }

        Map<String, List<RankedEntity>> columns = new LinkedHashMap<>();
        for (int i = 0; i < measures.size(); i++) {
            try {
                columns.put(measures.get(i).displayName(), futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException("Ranking failed for " + pivot, cause);
            }
        }

        logger.debug("Ranked {} '{}' on {} under {} measures in {} ms",
            entityKind, pivot, kind.id(), measures.size(), System.currentTimeMillis() - start);
        return new SimilarityTable(entityKind, pivot, kind, columns);
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
